package com.identity.matching.similarity;

/**
 * Weights combining the closest-sample distance and the mean sample distance.
 * Formula: score = minWeight * min + meanWeight * mean
 */
public record ScoringWeights(double minWeight, double meanWeight) {

    public ScoringWeights {
        if (minWeight < 0 || meanWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = minWeight + meanWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * 70% closest sample, 30% mean. The default tolerance of 0.6 is calibrated against
     * these weights and a 128-dimension face embedding model; changing either requires
     * recalibrating the tolerance.
     */
    public static ScoringWeights calibrated() {
        return new ScoringWeights(0.7, 0.3);
    }

    /**
     * Closest sample only (nearest-neighbour matching).
     */
    public static ScoringWeights nearestOnly() {
        return new ScoringWeights(1.0, 0.0);
    }
}
