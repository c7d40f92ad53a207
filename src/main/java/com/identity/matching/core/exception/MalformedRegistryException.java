package com.identity.matching.core.exception;

/**
 * Thrown when persisted or imported data does not conform to the record layout.
 */
public class MalformedRegistryException extends IdentityMatchingException {

    public MalformedRegistryException(String message) {
        super(ErrorCode.MALFORMED_REGISTRY, message);
    }

    public MalformedRegistryException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_REGISTRY, message, cause);
    }
}
