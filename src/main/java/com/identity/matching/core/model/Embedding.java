package com.identity.matching.core.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A fixed-dimension feature vector for one biometric sample, plus provenance metadata.
 * Vectors are stored exactly as received; dimension and finiteness are enforced by
 * {@link com.identity.matching.validation.EmbeddingValidator}, not here.
 *
 * @param vector     the raw feature vector (copied on the way in and out)
 * @param capturedAt when the underlying sample was acquired
 * @param provenance opaque reference to the source sample, audit only (nullable)
 */
public record Embedding(double[] vector, Instant capturedAt, String provenance) {

    public Embedding {
        Objects.requireNonNull(vector, "vector is required");
        Objects.requireNonNull(capturedAt, "capturedAt is required");
        vector = vector.clone();
    }

    @Override
    public double[] vector() {
        return vector.clone();
    }

    public int dimension() {
        return vector.length;
    }

    /**
     * Component access without copying the vector.
     */
    public double component(int index) {
        return vector[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Embedding other)) return false;
        return Arrays.equals(vector, other.vector)
                && capturedAt.equals(other.capturedAt)
                && Objects.equals(provenance, other.provenance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(vector), capturedAt, provenance);
    }

    @Override
    public String toString() {
        return "Embedding{" +
                "dimension=" + vector.length +
                ", capturedAt=" + capturedAt +
                ", provenance='" + provenance + '\'' +
                '}';
    }
}
