package com.identity.matching.registry;

/**
 * Kinds of registry mutation reported to {@link RegistryListener}s.
 */
public enum RegistryChange {
    INSERTED,
    REPLACED,
    SAMPLES_APPENDED,
    MATCH_RECORDED,
    REMOVED,
    CLEARED
}
