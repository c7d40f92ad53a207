package com.identity.matching.registry;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link RegistryStore}.
 * Keeps the last saved snapshot; snapshots are immutable so no copy is needed.
 */
public class InMemoryRegistryStore implements RegistryStore {

    private final AtomicReference<RegistrySnapshot> saved = new AtomicReference<>();
    private final AtomicInteger saveCount = new AtomicInteger();

    public InMemoryRegistryStore() {
    }

    public InMemoryRegistryStore(RegistrySnapshot initial) {
        saved.set(initial);
    }

    @Override
    public Optional<RegistrySnapshot> load() {
        return Optional.ofNullable(saved.get());
    }

    @Override
    public void save(RegistrySnapshot snapshot) {
        saved.set(snapshot);
        saveCount.incrementAndGet();
    }

    /**
     * Number of saves performed since creation.
     */
    public int getSaveCount() {
        return saveCount.get();
    }
}
