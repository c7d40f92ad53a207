package com.identity.matching.core.exception;

/**
 * Thrown when inserting an identity that already exists without the overwrite flag.
 */
public class DuplicateIdentityException extends IdentityMatchingException {

    private final String identityId;

    public DuplicateIdentityException(String identityId) {
        super(ErrorCode.DUPLICATE_IDENTITY, "Identity already exists: " + identityId);
        this.identityId = identityId;
    }

    public String getIdentityId() {
        return identityId;
    }
}
