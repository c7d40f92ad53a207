package com.identity.matching.core.exception;

/**
 * Thrown when the persistence collaborator fails to load or save the registry.
 */
public class RegistryPersistenceException extends IdentityMatchingException {

    public RegistryPersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILED, message, cause);
    }
}
