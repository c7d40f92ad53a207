package com.identity.matching.core.exception;

/**
 * Thrown when an embedding vector is missing or has a non-finite component.
 * {@link #getIndex()} is -1 when the vector itself is absent.
 */
public class InvalidValueException extends IdentityMatchingException {

    private final int index;

    public InvalidValueException(String message) {
        super(ErrorCode.INVALID_VALUE, message);
        this.index = -1;
    }

    public InvalidValueException(int index, double value) {
        super(ErrorCode.INVALID_VALUE, "Non-finite value " + value + " at index " + index);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
