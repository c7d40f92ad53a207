package com.identity.matching.similarity;

import com.identity.matching.core.model.CandidateScore;
import com.identity.matching.core.model.Embedding;
import com.identity.matching.core.model.IdentityRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Scores a probe against all samples of one identity.
 * Formula: score = w_min * min(D) + w_mean * mean(D), where D holds the probe's distance
 * to every stored sample. The score always lies in [min(D), max(D)].
 */
public class AggregateDistanceScorer {
    private static final Logger log = LoggerFactory.getLogger(AggregateDistanceScorer.class);

    private final DistanceMetric metric;
    private final ScoringWeights weights;

    public AggregateDistanceScorer() {
        this(new EuclideanDistance(), ScoringWeights.calibrated());
    }

    public AggregateDistanceScorer(ScoringWeights weights) {
        this(new EuclideanDistance(), weights);
    }

    public AggregateDistanceScorer(DistanceMetric metric, ScoringWeights weights) {
        this.metric = metric;
        this.weights = weights;
    }

    /**
     * Computes the distance statistics and aggregate score of one identity.
     *
     * @param probe  probe vector, already checked against the registry dimension
     * @param record the identity to score (at least one sample)
     */
    public CandidateScore score(double[] probe, IdentityRecord record) {
        List<Embedding> samples = record.getSamples();
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("Identity '" + record.getIdentityId() + "' has no samples");
        }

        double[] distances = new double[samples.size()];
        for (int i = 0; i < distances.length; i++) {
            distances[i] = metric.distance(probe, samples.get(i));
        }
        // Summing in ascending order keeps the mean independent of sample order.
        Arrays.sort(distances);
        double sum = 0.0;
        for (double d : distances) {
            sum += d;
        }
        double min = distances[0];
        double max = distances[distances.length - 1];
        // Rounding can push either value an ulp outside [min, max].
        double mean = clamp(sum / distances.length, min, max);
        double score = clamp(weights.minWeight() * min + weights.meanWeight() * mean, min, max);

        log.debug("Distance scores for '{}': samples={}, min={}, mean={}, max={}, score={}",
                record.getIdentityId(), distances.length, min, mean, max, score);

        return new CandidateScore(record.getIdentityId(), distances.length, min, mean, max, score);
    }

    private static double clamp(double value, double low, double high) {
        return Math.min(high, Math.max(low, value));
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    /**
     * Creates a new scorer with updated weights.
     */
    public AggregateDistanceScorer withWeights(ScoringWeights newWeights) {
        return new AggregateDistanceScorer(metric, newWeights);
    }
}
