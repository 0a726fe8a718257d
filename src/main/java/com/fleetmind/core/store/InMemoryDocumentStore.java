package com.fleetmind.core.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Heap-backed {@link DocumentStore}. Per-key atomicity comes from
 * {@link ConcurrentHashMap#compute}; documents are expected to be immutable values.
 */
public class InMemoryDocumentStore<T> implements DocumentStore<T> {

    private final ConcurrentHashMap<String, T> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<T> read(String key) {
        return Optional.ofNullable(documents.get(key));
    }

    @Override
    public T update(String key, Function<Optional<T>, T> mutation) {
        return documents.compute(key, (k, current) -> {
            T next = mutation.apply(Optional.ofNullable(current));
            return next == null || Objects.equals(next, current) ? current : next;
        });
    }

    @Override
    public List<String> keys() {
        var keys = new ArrayList<>(documents.keySet());
        keys.sort(String::compareTo);
        return keys;
    }
}
