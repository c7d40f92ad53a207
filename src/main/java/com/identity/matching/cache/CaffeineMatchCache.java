package com.identity.matching.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.identity.matching.core.model.MatchResult;
import com.identity.matching.registry.RegistryChange;
import com.identity.matching.registry.RegistryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

/**
 * Caffeine-backed match cache. Registered as a {@link RegistryListener} it drops every entry
 * when the registry changes, since entries for older versions can no longer be hit.
 */
public class CaffeineMatchCache implements MatchCache, RegistryListener {
    private static final Logger log = LoggerFactory.getLogger(CaffeineMatchCache.class);

    private final Cache<CacheKey, MatchResult> cache;

    public CaffeineMatchCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineMatchCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<MatchResult> get(long registryId, long registryVersion, double[] probe, double tolerance) {
        return Optional.ofNullable(cache.getIfPresent(CacheKey.of(registryId, registryVersion, probe, tolerance)));
    }

    @Override
    public void put(long registryId, long registryVersion, double[] probe, double tolerance, MatchResult result) {
        cache.put(CacheKey.of(registryId, registryVersion, probe, tolerance), result);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void onRegistryChanged(RegistryChange change, String identityId, long version) {
        log.debug("cache.invalidated change={} identityId={} version={}", change, identityId, version);
        cache.invalidateAll();
    }

    /**
     * Key over the raw bits of the probe so that {@code -0.0} and {@code 0.0} stay distinct.
     */
    static final class CacheKey {
        private final long registryId;
        private final long registryVersion;
        private final long toleranceBits;
        private final long[] probeBits;
        private final int hash;

        private CacheKey(long registryId, long registryVersion, long toleranceBits, long[] probeBits) {
            this.registryId = registryId;
            this.registryVersion = registryVersion;
            this.toleranceBits = toleranceBits;
            this.probeBits = probeBits;
            this.hash = 31 * (31 * (31 * Long.hashCode(registryId) + Long.hashCode(registryVersion))
                    + Long.hashCode(toleranceBits)) + Arrays.hashCode(probeBits);
        }

        static CacheKey of(long registryId, long registryVersion, double[] probe, double tolerance) {
            long[] bits = new long[probe.length];
            for (int i = 0; i < probe.length; i++) {
                bits[i] = Double.doubleToLongBits(probe[i]);
            }
            return new CacheKey(registryId, registryVersion, Double.doubleToLongBits(tolerance), bits);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof CacheKey other)) return false;
            return registryId == other.registryId
                    && registryVersion == other.registryVersion
                    && toleranceBits == other.toleranceBits
                    && Arrays.equals(probeBits, other.probeBits);
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }
}
