package com.identity.matching.enrollment;

import java.time.Instant;

/**
 * Unvalidated enrollment input.
 *
 * @param vector     raw feature vector, validated by the pipeline
 * @param capturedAt acquisition time, or null to stamp it with the pipeline clock
 * @param provenance opaque source reference for audit (nullable)
 */
public record CandidateSample(double[] vector, Instant capturedAt, String provenance) {

    public static CandidateSample of(double[] vector) {
        return new CandidateSample(vector, null, null);
    }

    public static CandidateSample of(double[] vector, String provenance) {
        return new CandidateSample(vector, null, provenance);
    }
}
