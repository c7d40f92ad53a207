package com.identity.matching.similarity;

import com.identity.matching.core.model.Embedding;

/**
 * Euclidean (L2) distance: sqrt(sum_i (a_i - b_i)^2).
 */
public final class EuclideanDistance implements DistanceMetric {

    @Override
    public double distance(double[] a, double[] b) {
        checkDimension(a.length, b.length);
        double sumSq = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sumSq += d * d;
        }
        return Math.sqrt(sumSq);
    }

    @Override
    public double distance(double[] probe, Embedding sample) {
        checkDimension(probe.length, sample.dimension());
        double sumSq = 0.0;
        for (int i = 0; i < probe.length; i++) {
            double d = probe[i] - sample.component(i);
            sumSq += d * d;
        }
        return Math.sqrt(sumSq);
    }

    private static void checkDimension(int a, int b) {
        if (a != b) {
            throw new IllegalArgumentException("Dimension mismatch: " + a + " vs " + b);
        }
    }
}
