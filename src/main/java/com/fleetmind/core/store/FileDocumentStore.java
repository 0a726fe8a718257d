package com.fleetmind.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * {@link DocumentStore} keeping one YAML file per key under a directory.
 *
 * <p>Mutual exclusion is two-level: an in-process {@link ReentrantLock} per lock file
 * (shared by every store instance in the JVM) and an OS-level {@link FileLock} on a sibling
 * {@code <key>.yaml.lock} file, so separate processes (dispatcher, turn-completion hook,
 * notification listener) exclude each other too. Both are acquired with a bounded wait.
 *
 * <p>Writes go to a temporary file in the same directory, then replace the document with an
 * atomic rename.
 */
public class FileDocumentStore<T> implements DocumentStore<T> {

    private static final Logger log = LoggerFactory.getLogger(FileDocumentStore.class);

    private static final String SUFFIX = ".yaml";
    private static final String LOCK_SUFFIX = ".lock";
    private static final long LOCK_POLL_MS = 50L;
    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9_.-]{1,128}");

    /** Keyed by absolute lock-file path so that two stores over one directory share locks. */
    private static final ConcurrentHashMap<Path, ReentrantLock> PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path directory;
    private final Class<T> type;
    private final Duration lockTimeout;

    public FileDocumentStore(Path directory, Class<T> type, Duration lockTimeout) {
        this.directory = directory.toAbsolutePath().normalize();
        this.type = type;
        this.lockTimeout = lockTimeout;
    }

    public Path directory() {
        return directory;
    }

    public Path documentPath(String key) {
        return directory.resolve(validKey(key) + SUFFIX);
    }

    @Override
    public Optional<T> read(String key) {
        Path file = documentPath(key);
        try {
            byte[] raw = Files.readAllBytes(file);
            if (raw.length == 0) {
                return Optional.empty();
            }
            return Optional.ofNullable(Yamls.mapper().readValue(raw, type));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StoreException("Failed to read " + file, e);
        }
    }

    @Override
    public T update(String key, Function<Optional<T>, T> mutation) {
        Path file = documentPath(key);
        return withLock(key, file, () -> {
            Optional<T> current = read(key);
            T next = mutation.apply(current);
            if (next == null || Objects.equals(next, current.orElse(null))) {
                log.debug("No change for {}; skipping write", file.getFileName());
                return current.orElse(null);
            }
            replace(file, next);
            return next;
        });
    }

    @Override
    public List<String> keys() {
        var keys = new ArrayList<String>();
        if (!Files.isDirectory(directory)) {
            return keys;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                keys.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list " + directory, e);
        }
        keys.sort(String::compareTo);
        return keys;
    }

    private void replace(Path file, T document) {
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            Yamls.mapper().writeValue(temp.toFile(), document);
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StoreException("Failed to replace " + file, e);
        }
    }

    private <R> R withLock(String key, Path file, Supplier<R> action) {
        Path lockFile = file.resolveSibling(file.getFileName() + LOCK_SUFFIX);
        ReentrantLock processLock = PROCESS_LOCKS.computeIfAbsent(lockFile, p -> new ReentrantLock());
        long deadline = System.nanoTime() + lockTimeout.toNanos();
        try {
            if (!processLock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new LockTimeoutException(key, lockTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(key, lockTimeout);
        }
        try {
            Files.createDirectories(directory);
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
                FileLock fileLock = acquire(channel, key, deadline);
                try {
                    return action.get();
                } finally {
                    fileLock.release();
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to lock " + lockFile, e);
        } finally {
            processLock.unlock();
        }
    }

    private FileLock acquire(FileChannel channel, String key, long deadline) throws IOException {
        while (true) {
            FileLock lock = channel.tryLock();
            if (lock != null) {
                return lock;
            }
            if (System.nanoTime() >= deadline) {
                throw new LockTimeoutException(key, lockTimeout);
            }
            try {
                Thread.sleep(LOCK_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(key, lockTimeout);
            }
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }

    private static String validKey(String key) {
        if (key == null || !SAFE_KEY.matcher(key).matches()) {
            throw new IllegalArgumentException("Invalid document key: " + key);
        }
        return key;
    }
}
