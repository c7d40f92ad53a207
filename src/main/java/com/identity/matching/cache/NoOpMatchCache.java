package com.identity.matching.cache;

import com.identity.matching.core.model.MatchResult;

import java.util.Optional;

/**
 * Used when caching is disabled.
 */
public class NoOpMatchCache implements MatchCache {

    @Override
    public Optional<MatchResult> get(long registryId, long registryVersion, double[] probe, double tolerance) {
        return Optional.empty();
    }

    @Override
    public void put(long registryId, long registryVersion, double[] probe, double tolerance, MatchResult result) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
