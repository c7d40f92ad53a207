package com.identity.matching.api;

import com.identity.matching.cache.CacheConfig;
import com.identity.matching.enrollment.EnrollmentPolicy;

import java.time.Duration;

/**
 * Options for an {@link IdentityMatcher}.
 * Configures the decision tolerance, enrollment policy, parallel scoring and caching.
 */
public class MatchingOptions {

    private static final double DEFAULT_TOLERANCE = 0.6;
    private static final double STRICT_TOLERANCE = 0.5;
    private static final int STRICT_MINIMUM_SAMPLES = 3;
    private static final int DEFAULT_PARALLELISM_THRESHOLD = 256;
    private static final int DEFAULT_CACHE_MAX_SIZE = 10_000;
    private static final int DEFAULT_CACHE_TTL_SECONDS = 300;

    private final double tolerance;
    private final EnrollmentPolicy enrollmentPolicy;
    private final int parallelismThreshold;
    private final int maxParallelism;
    private final Duration deadline;
    private final boolean cachingEnabled;
    private final int cacheMaxSize;
    private final int cacheTtlSeconds;
    private final String actorId;

    private MatchingOptions(Builder builder) {
        this.tolerance = builder.tolerance;
        this.enrollmentPolicy = builder.enrollmentPolicy;
        this.parallelismThreshold = builder.parallelismThreshold;
        this.maxParallelism = builder.maxParallelism;
        this.deadline = builder.deadline;
        this.cachingEnabled = builder.cachingEnabled;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.cacheTtlSeconds = builder.cacheTtlSeconds;
        this.actorId = builder.actorId;
    }

    public double getTolerance() {
        return tolerance;
    }

    public EnrollmentPolicy getEnrollmentPolicy() {
        return enrollmentPolicy;
    }

    public int getParallelismThreshold() {
        return parallelismThreshold;
    }

    public int getMaxParallelism() {
        return maxParallelism;
    }

    /**
     * Time limit per authentication, or null for none.
     */
    public Duration getDeadline() {
        return deadline;
    }

    public boolean isCachingEnabled() {
        return cachingEnabled;
    }

    public int getCacheMaxSize() {
        return cacheMaxSize;
    }

    public int getCacheTtlSeconds() {
        return cacheTtlSeconds;
    }

    public String getActorId() {
        return actorId;
    }

    public CacheConfig toCacheConfig() {
        return new CacheConfig(cacheMaxSize, cacheTtlSeconds);
    }

    public static MatchingOptions defaults() {
        return builder().build();
    }

    /**
     * Tighter tolerance and three valid samples per enrollment.
     */
    public static MatchingOptions strict() {
        return builder()
                .tolerance(STRICT_TOLERANCE)
                .enrollmentPolicy(new EnrollmentPolicy(STRICT_MINIMUM_SAMPLES))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double tolerance = DEFAULT_TOLERANCE;
        private EnrollmentPolicy enrollmentPolicy = EnrollmentPolicy.defaults();
        private int parallelismThreshold = DEFAULT_PARALLELISM_THRESHOLD;
        private int maxParallelism = Runtime.getRuntime().availableProcessors();
        private Duration deadline;
        private boolean cachingEnabled = false;
        private int cacheMaxSize = DEFAULT_CACHE_MAX_SIZE;
        private int cacheTtlSeconds = DEFAULT_CACHE_TTL_SECONDS;
        private String actorId = "SYSTEM";

        public Builder tolerance(double tolerance) {
            if (!Double.isFinite(tolerance) || tolerance < 0.0) {
                throw new IllegalArgumentException("tolerance must be finite and >= 0");
            }
            this.tolerance = tolerance;
            return this;
        }

        public Builder enrollmentPolicy(EnrollmentPolicy enrollmentPolicy) {
            if (enrollmentPolicy == null) {
                throw new IllegalArgumentException("enrollmentPolicy is required");
            }
            this.enrollmentPolicy = enrollmentPolicy;
            return this;
        }

        public Builder minimumAcceptedSamples(int minimumAcceptedSamples) {
            return enrollmentPolicy(new EnrollmentPolicy(minimumAcceptedSamples));
        }

        public Builder parallelismThreshold(int parallelismThreshold) {
            if (parallelismThreshold <= 0) {
                throw new IllegalArgumentException("parallelismThreshold must be positive");
            }
            this.parallelismThreshold = parallelismThreshold;
            return this;
        }

        /**
         * 1 disables parallel scoring.
         */
        public Builder maxParallelism(int maxParallelism) {
            if (maxParallelism <= 0) {
                throw new IllegalArgumentException("maxParallelism must be positive");
            }
            this.maxParallelism = maxParallelism;
            return this;
        }

        public Builder deadline(Duration deadline) {
            if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
                throw new IllegalArgumentException("deadline must be positive");
            }
            this.deadline = deadline;
            return this;
        }

        public Builder cachingEnabled(boolean cachingEnabled) {
            this.cachingEnabled = cachingEnabled;
            return this;
        }

        public Builder cacheMaxSize(int cacheMaxSize) {
            if (cacheMaxSize <= 0) {
                throw new IllegalArgumentException("cacheMaxSize must be positive");
            }
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder cacheTtlSeconds(int cacheTtlSeconds) {
            if (cacheTtlSeconds <= 0) {
                throw new IllegalArgumentException("cacheTtlSeconds must be positive");
            }
            this.cacheTtlSeconds = cacheTtlSeconds;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public MatchingOptions build() {
            return new MatchingOptions(this);
        }
    }

    @Override
    public String toString() {
        return "MatchingOptions{" +
                "tolerance=" + tolerance +
                ", minimumAcceptedSamples=" + enrollmentPolicy.minimumAcceptedSamples() +
                ", parallelismThreshold=" + parallelismThreshold +
                ", maxParallelism=" + maxParallelism +
                ", deadline=" + deadline +
                ", cachingEnabled=" + cachingEnabled +
                ", actorId='" + actorId + '\'' +
                '}';
    }
}
