package com.identity.matching.core.exception;

/**
 * Thrown when an operation targets an identity that is not in the registry.
 */
public class UnknownIdentityException extends IdentityMatchingException {

    private final String identityId;

    public UnknownIdentityException(String identityId) {
        super(ErrorCode.UNKNOWN_IDENTITY, "Unknown identity: " + identityId);
        this.identityId = identityId;
    }

    public String getIdentityId() {
        return identityId;
    }
}
