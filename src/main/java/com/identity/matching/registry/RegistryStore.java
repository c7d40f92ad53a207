package com.identity.matching.registry;

import java.util.Optional;

/**
 * Persistence collaborator for the identity registry.
 * Implementations must round-trip vectors bit-exactly, keep sample order and preserve all
 * counters and timestamps.
 */
public interface RegistryStore {

    /**
     * Loads the last saved registry.
     *
     * @return the stored snapshot, or empty if nothing has been saved yet
     */
    Optional<RegistrySnapshot> load();

    /**
     * Saves a registry snapshot. The registry only acknowledges a mutation after this
     * returns normally.
     */
    void save(RegistrySnapshot snapshot);
}
