package com.identity.matching.registry;

/**
 * Listener notified after a registry mutation has been persisted and published.
 * Called on the writing thread while the writer lock is held, so implementations must be quick.
 */
@FunctionalInterface
public interface RegistryListener {

    /**
     * @param change     the kind of mutation
     * @param identityId the affected identity, or null for {@link RegistryChange#CLEARED}
     * @param version    the version of the newly published snapshot
     */
    void onRegistryChanged(RegistryChange change, String identityId, long version);
}
