package com.identity.matching.similarity;

import com.identity.matching.core.model.CandidateScore;
import com.identity.matching.core.model.IdentityRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static com.identity.matching.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Distance and aggregate scoring")
class AggregateDistanceScorerTest {

    private final AggregateDistanceScorer scorer = new AggregateDistanceScorer();

    @Nested
    @DisplayName("EuclideanDistance")
    class EuclideanTests {

        private final EuclideanDistance metric = new EuclideanDistance();

        @Test
        @DisplayName("Should compute the L2 distance")
        void l2Distance() {
            assertEquals(5.0, metric.distance(new double[]{0, 0}, new double[]{3, 4}), 1e-12);
        }

        @ParameterizedTest
        @ValueSource(longs = {1L, 7L, 42L, 2024L})
        @DisplayName("Distance of a vector to itself should be zero")
        void selfDistanceIsZero(long seed) {
            double[] v = randomVector(new Random(seed), 128);

            assertEquals(0.0, metric.distance(v, v));
        }

        @Test
        @DisplayName("Distance to a stored sample should match the array form")
        void sampleDistance() {
            Random random = new Random(9);
            double[] probe = randomVector(random, 64);
            double[] stored = randomVector(random, 64);

            assertEquals(metric.distance(probe, stored), metric.distance(probe, embedding(stored)));
            assertThrows(IllegalArgumentException.class,
                    () -> metric.distance(new double[]{1.0}, embedding(1.0, 2.0)));
        }

        @Test
        @DisplayName("Should reject vectors of different lengths")
        void mismatchedLengths() {
            assertThrows(IllegalArgumentException.class,
                    () -> metric.distance(new double[]{1.0}, new double[]{1.0, 2.0}));
        }
    }

    @Test
    @DisplayName("Identical samples should score zero")
    void identicalSamplesScoreZero() {
        double[] v = {0.1, 0.2, 0.3};
        IdentityRecord alice = record("alice", v, v, v);

        CandidateScore score = scorer.score(v, alice);

        assertEquals(0.0, score.minDistance());
        assertEquals(0.0, score.meanDistance());
        assertEquals(0.0, score.score());
        assertEquals(3, score.sampleCount());
    }

    @Test
    @DisplayName("Score should weigh min at 0.7 and mean at 0.3")
    void calibratedWeights() {
        IdentityRecord record = record("alice", new double[]{1, 0}, new double[]{3, 0});

        CandidateScore score = scorer.score(new double[]{0, 0}, record);

        assertEquals(1.0, score.minDistance(), 1e-12);
        assertEquals(2.0, score.meanDistance(), 1e-12);
        assertEquals(3.0, score.maxDistance(), 1e-12);
        assertEquals(0.7 * 1.0 + 0.3 * 2.0, score.score(), 1e-12);
    }

    @ParameterizedTest
    @ValueSource(longs = {3L, 11L, 99L, 12345L})
    @DisplayName("Score should lie between min and max distance")
    void scoreWithinBounds(long seed) {
        Random random = new Random(seed);
        IdentityRecord record = record("u", randomVector(random, 16), randomVector(random, 16),
                randomVector(random, 16), randomVector(random, 16));

        CandidateScore score = scorer.score(randomVector(random, 16), record);

        assertTrue(score.score() >= score.minDistance());
        assertTrue(score.score() <= score.maxDistance());
        assertTrue(score.meanDistance() >= score.minDistance());
        assertTrue(score.meanDistance() <= score.maxDistance());
    }

    @Test
    @DisplayName("Equal distances should score exactly that distance")
    void equalDistancesScoreExactly() {
        double[] origin = {0.0, 0.0};
        for (int k = 1; k <= 1000; k++) {
            double d = k / 1000.0;
            double[] sample = {d, 0.0};
            CandidateScore score = scorer.score(origin, record("u", sample, sample, sample));

            assertEquals(score.minDistance(), score.maxDistance(), "d=" + d);
            assertEquals(score.minDistance(), score.meanDistance(), "d=" + d);
            assertEquals(score.minDistance(), score.score(), "d=" + d);
        }
    }

    @Test
    @DisplayName("Score should not depend on sample order")
    void permutationInvariant() {
        Random random = new Random(5);
        double[] a = randomVector(random, 32);
        double[] b = randomVector(random, 32);
        double[] c = randomVector(random, 32);
        double[] probe = randomVector(random, 32);

        CandidateScore forward = scorer.score(probe, record("u", a, b, c));
        CandidateScore reversed = scorer.score(probe, record("u", c, b, a));
        CandidateScore shuffled = scorer.score(probe, record("u", b, c, a));

        assertEquals(forward.score(), reversed.score());
        assertEquals(forward.score(), shuffled.score());
        assertEquals(forward.meanDistance(), shuffled.meanDistance());
    }

    @Test
    @DisplayName("Weights must be non-negative and sum to one")
    void weightValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(0.8, 0.3));
        assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(-0.1, 1.1));
        assertEquals(0.7, ScoringWeights.calibrated().minWeight());
    }

    @Test
    @DisplayName("Nearest-only weights should score the closest sample")
    void nearestOnly() {
        AggregateDistanceScorer nearest = scorer.withWeights(ScoringWeights.nearestOnly());
        IdentityRecord record = record("alice", new double[]{1, 0}, new double[]{3, 0});

        assertEquals(ScoringWeights.nearestOnly(), nearest.getWeights());
        assertEquals(1.0, nearest.score(new double[]{0, 0}, record).score(), 1e-12);
    }

    private static double[] randomVector(Random random, int dimension) {
        double[] v = new double[dimension];
        for (int i = 0; i < dimension; i++) {
            v[i] = random.nextGaussian();
        }
        return v;
    }
}
