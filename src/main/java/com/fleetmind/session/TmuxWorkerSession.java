package com.fleetmind.session;

import com.fleetmind.core.model.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives workers living in tmux panes.
 *
 * <p>This class shells out to the {@code tmux} CLI via {@link ProcessBuilder}. The worker's
 * {@code session} field is used verbatim as the tmux target ({@code session:window.pane}).
 */
public class TmuxWorkerSession implements WorkerSession {

    private static final Logger log = LoggerFactory.getLogger(TmuxWorkerSession.class);

    static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(2);
    static final Duration SUBMIT_DELAY = Duration.ofMillis(300);

    private final String executable;

    public TmuxWorkerSession() {
        this("tmux");
    }

    public TmuxWorkerSession(String executable) {
        this.executable = executable;
    }

    @Override
    public String capture(Worker worker) {
        CommandResult result = run("capture-pane", "-p", "-t", worker.session());
        if (result.exitCode() != 0) {
            log.debug("capture-pane failed for {} (exit {}): {}", worker.workerId(), result.exitCode(), result.output());
            return "";
        }
        return result.output();
    }

    @Override
    public void send(Worker worker, String text) {
        CommandResult typed = run("send-keys", "-t", worker.session(), text);
        if (typed.exitCode() != 0) {
            throw new SessionException("send-keys to %s failed (exit %d): %s"
                    .formatted(worker.session(), typed.exitCode(), typed.output()));
        }
        pause(SUBMIT_DELAY);
        CommandResult submitted = run("send-keys", "-t", worker.session(), "Enter");
        if (submitted.exitCode() != 0) {
            throw new SessionException("Enter to %s failed (exit %d): %s"
                    .formatted(worker.session(), submitted.exitCode(), submitted.output()));
        }
        log.debug("Sent '{}' to {}", text, worker.workerId());
    }

    @Override
    public boolean available() {
        try {
            return run("list-sessions").exitCode() == 0;
        } catch (SessionException e) {
            return false;
        }
    }

    /**
     * Runs a tmux command and returns its exit code and merged output.
     *
     * @throws SessionException if tmux cannot be started or does not finish in time
     */
    CommandResult run(String... args) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(List.of(args));
        log.trace("Running: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new SessionException("Cannot start " + executable, e);
        }
        // Drained while waiting so a full pipe cannot stall the command.
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readOutput(process));
        try {
            if (!process.waitFor(COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new SessionException("%s timed out after %s".formatted(String.join(" ", command), COMMAND_TIMEOUT));
            }
            return new CommandResult(process.exitValue(), output.get(COMMAND_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        } catch (ExecutionException | TimeoutException e) {
            throw new SessionException("Cannot read output of " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SessionException("Interrupted while running " + String.join(" ", command), e);
        }
    }

    private static String readOutput(Process process) {
        try (InputStream in = process.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    void pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionException("Interrupted before submitting input", e);
        }
    }

    record CommandResult(int exitCode, String output) {
    }
}
