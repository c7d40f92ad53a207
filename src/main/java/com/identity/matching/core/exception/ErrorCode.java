package com.identity.matching.core.exception;

/**
 * Error taxonomy of the identity matching engine.
 * Each code carries a suggested HTTP-like status so callers can map failures
 * to their own exit codes or response statuses.
 */
public enum ErrorCode {
    /**
     * A vector's length differs from the registry dimension.
     */
    DIMENSION_MISMATCH(400),

    /**
     * A vector contains a non-finite component (NaN or Infinity).
     */
    INVALID_VALUE(422),

    /**
     * Fewer samples survived validation than the enrollment policy requires.
     */
    INSUFFICIENT_SAMPLES(422),

    /**
     * The identity already exists and overwrite was not requested.
     */
    DUPLICATE_IDENTITY(409),

    /**
     * The identity is not present in the registry.
     */
    UNKNOWN_IDENTITY(404),

    /**
     * The external embedding extractor could not produce an embedding.
     */
    EXTRACTION_FAILED(502),

    /**
     * Stored or imported data does not match the record layout.
     */
    MALFORMED_REGISTRY(500),

    /**
     * The persistence collaborator failed to load or save.
     */
    PERSISTENCE_FAILED(500),

    /**
     * Authentication was abandoned because its deadline passed or its thread was interrupted.
     */
    DEADLINE_EXCEEDED(504);

    private final int suggestedStatus;

    ErrorCode(int suggestedStatus) {
        this.suggestedStatus = suggestedStatus;
    }

    public int getSuggestedStatus() {
        return suggestedStatus;
    }
}
