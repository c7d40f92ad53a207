package com.identity.matching.core.exception;

/**
 * Thrown when an authentication is abandoned because its deadline passed
 * or the calling thread was interrupted.
 */
public class MatchingDeadlineExceededException extends IdentityMatchingException {

    public MatchingDeadlineExceededException(String message) {
        super(ErrorCode.DEADLINE_EXCEEDED, message);
    }

    public MatchingDeadlineExceededException(String message, Throwable cause) {
        super(ErrorCode.DEADLINE_EXCEEDED, message, cause);
    }
}
