package com.identity.matching.validation;

import com.identity.matching.core.exception.DimensionMismatchException;
import com.identity.matching.core.exception.InvalidValueException;
import com.identity.matching.core.model.Embedding;

import java.time.Instant;
import java.util.Objects;

/**
 * Validation for embeddings and identity keys.
 * Embeddings are accepted exactly as received: no normalization, since raw Euclidean
 * distance over the embedding space is what the tolerance is calibrated against.
 */
public final class EmbeddingValidator {

    /** Maximum allowed length for identity ids. */
    public static final int MAX_IDENTITY_ID_LENGTH = 256;

    private EmbeddingValidator() {
        // utility class
    }

    /**
     * Validates a raw vector and wraps it as an embedding.
     *
     * @param vector            the feature vector
     * @param expectedDimension the registry dimension
     * @param capturedAt        acquisition time
     * @param provenance        opaque source reference (nullable)
     * @return the validated embedding
     * @throws InvalidValueException      if the vector is null or has a non-finite component
     * @throws DimensionMismatchException if the vector length differs from the expected dimension
     */
    public static Embedding validate(double[] vector, int expectedDimension,
                                     Instant capturedAt, String provenance) {
        checkVector(vector, expectedDimension);
        return new Embedding(vector, capturedAt, provenance);
    }

    /**
     * Validates an already-constructed embedding against the expected dimension.
     *
     * @return the same embedding
     */
    public static Embedding validate(Embedding embedding, int expectedDimension) {
        Objects.requireNonNull(embedding, "embedding is required");
        if (embedding.dimension() != expectedDimension) {
            throw new DimensionMismatchException(expectedDimension, embedding.dimension());
        }
        for (int i = 0; i < expectedDimension; i++) {
            double value = embedding.component(i);
            if (!Double.isFinite(value)) {
                throw new InvalidValueException(i, value);
            }
        }
        return embedding;
    }

    /**
     * Validates an identity id.
     * Rejects null, blank, overly long, or control-character-containing ids.
     *
     * @throws IllegalArgumentException if the id is invalid
     */
    public static void validateIdentityId(String identityId) {
        if (identityId == null || identityId.isBlank()) {
            throw new IllegalArgumentException("Identity id must not be null or blank");
        }
        if (identityId.length() > MAX_IDENTITY_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "Identity id exceeds maximum length of " + MAX_IDENTITY_ID_LENGTH +
                            " characters (was " + identityId.length() + ")");
        }
        for (int i = 0; i < identityId.length(); i++) {
            if (Character.isISOControl(identityId.charAt(i))) {
                throw new IllegalArgumentException("Identity id must not contain control characters");
            }
        }
    }

    private static void checkVector(double[] vector, int expectedDimension) {
        if (vector == null) {
            throw new InvalidValueException("Embedding vector must not be null");
        }
        if (vector.length != expectedDimension) {
            throw new DimensionMismatchException(expectedDimension, vector.length);
        }
        for (int i = 0; i < vector.length; i++) {
            if (!Double.isFinite(vector[i])) {
                throw new InvalidValueException(i, vector[i]);
            }
        }
    }
}
