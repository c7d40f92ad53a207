package com.identity.matching.core.exception;

/**
 * Thrown when a vector's length differs from the expected registry dimension.
 */
public class DimensionMismatchException extends IdentityMatchingException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(ErrorCode.DIMENSION_MISMATCH,
                "Expected embedding dimension " + expected + " but was " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
