package com.fleetmind.core.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Key-value store of one document per worker, with a lock scoped to a single key.
 * <p>
 * Reads are lock-free snapshots. Updates are read-modify-write under the key's lock and
 * replace the stored document atomically, so a concurrent reader sees either the old or
 * the new document, never a partial one. Locks never span keys: unrelated workers never
 * contend.
 *
 * @param <T> document type
 */
public interface DocumentStore<T> {

    /**
     * Returns the current document for {@code key}, or empty when none was ever written.
     *
     * @throws StoreException if the stored document cannot be read or parsed
     */
    Optional<T> read(String key);

    /**
     * Applies {@code mutation} to the current document under the key's lock and persists the
     * result. When the mutation returns {@code null} or a value equal to the current document,
     * nothing is written. If the mutation throws, nothing is written and the exception
     * propagates.
     *
     * @return the document now stored (or {@code null} if none exists)
     * @throws LockTimeoutException if the lock is not acquired within the store's bound
     * @throws StoreException       if the document cannot be read or atomically replaced
     */
    T update(String key, Function<Optional<T>, T> mutation);

    /**
     * Keys that currently have a stored document, sorted.
     */
    List<String> keys();
}
