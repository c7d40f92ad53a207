package com.identity.matching.metrics;

import com.identity.matching.core.model.MatchDecision;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAuthenticationDuration(MatchDecision decision, Duration duration) {
    }

    @Override
    public void recordMatchScore(double score) {
    }

    @Override
    public void incrementEnrolled() {
    }

    @Override
    public void incrementEnrollmentRejected() {
    }

    @Override
    public void incrementSamplesRejected(String reason, int count) {
    }

    @Override
    public void incrementMatchRecorded() {
    }

    @Override
    public void incrementTransfer(String direction) {
    }

    @Override
    public void recordRegistrySize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
