package com.identity.matching.metrics;

import com.identity.matching.core.model.MatchDecision;

import java.time.Duration;

/**
 * Interface for recording identity matching metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordAuthenticationDuration(MatchDecision decision, Duration duration);

    void recordMatchScore(double score);

    void incrementEnrolled();

    void incrementEnrollmentRejected();

    void incrementSamplesRejected(String reason, int count);

    void incrementMatchRecorded();

    /**
     * @param direction {@code export} or {@code import}
     */
    void incrementTransfer(String direction);

    void recordRegistrySize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
