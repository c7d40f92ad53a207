package com.identity.matching.similarity;

import com.identity.matching.core.model.Embedding;

/**
 * Interface for vector distance computation.
 * Implementations return 0.0 for identical vectors and grow with dissimilarity.
 */
public interface DistanceMetric {

    /**
     * Computes the distance between two vectors of equal length.
     *
     * @param a first vector
     * @param b second vector
     * @return non-negative distance
     */
    double distance(double[] a, double[] b);

    /**
     * Distance from a probe vector to a stored sample. Implementations should read the
     * sample through {@link Embedding#component(int)} to avoid copying it.
     */
    default double distance(double[] probe, Embedding sample) {
        return distance(probe, sample.vector());
    }
}
