package com.identity.matching.core.exception;

import java.util.Objects;

/**
 * Base runtime exception for all identity matching failures.
 * Every subclass is bound to exactly one {@link ErrorCode}.
 */
public abstract class IdentityMatchingException extends RuntimeException {

    private final ErrorCode errorCode;

    protected IdentityMatchingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode is required");
    }

    protected IdentityMatchingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode is required");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
