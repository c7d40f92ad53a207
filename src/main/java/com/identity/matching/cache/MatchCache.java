package com.identity.matching.cache;

import com.identity.matching.core.model.MatchResult;

import java.util.Optional;

/**
 * Replay cache for authentication results.
 *
 * <p>Entries are keyed by the registry instance, its snapshot version, the tolerance and the
 * exact bits of the probe vector. Versions restart at zero for every registry, so the instance id
 * keeps one cache safe to share between matchers. A result is therefore only ever returned for
 * the very same probe evaluated against the very same registry state, which keeps cached authentication indistinguishable
 * from a fresh evaluation apart from {@link MatchResult#elapsed()}.</p>
 */
public interface MatchCache {

    /**
     * @param registryId      {@link com.identity.matching.registry.IdentityRegistry#getInstanceId()}
     * @param registryVersion version of the snapshot the result was computed on
     */
    Optional<MatchResult> get(long registryId, long registryVersion, double[] probe, double tolerance);

    void put(long registryId, long registryVersion, double[] probe, double tolerance, MatchResult result);

    void invalidateAll();

    CacheStats getStats();
}
