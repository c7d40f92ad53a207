package com.identity.matching.core.model;

import java.util.Comparator;

/**
 * Distance statistics of a probe against one identity's samples.
 *
 * @param identityId   the scored identity
 * @param sampleCount  number of samples compared
 * @param minDistance  smallest probe-to-sample distance
 * @param meanDistance average probe-to-sample distance
 * @param maxDistance  largest probe-to-sample distance
 * @param score        weighted aggregate of min and mean; lower is closer
 */
public record CandidateScore(
        String identityId,
        int sampleCount,
        double minDistance,
        double meanDistance,
        double maxDistance,
        double score
) {
    /**
     * Best first: lowest score, ties broken by lexicographically smaller identity id.
     */
    public static final Comparator<CandidateScore> RANKING = Comparator
            .comparingDouble(CandidateScore::score)
            .thenComparing(CandidateScore::identityId);

    /**
     * Display-only confidence derived from the closest sample.
     */
    public double confidence() {
        return Math.max(0.0, 1.0 - minDistance);
    }

    @Override
    public String toString() {
        return String.format("CandidateScore{%s, samples=%d, min=%.4f, mean=%.4f, max=%.4f, score=%.4f}",
                identityId, sampleCount, minDistance, meanDistance, maxDistance, score);
    }
}
