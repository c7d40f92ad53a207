package com.identity.matching.audit;

/**
 * Types of auditable operations on the identity registry.
 */
public enum AuditAction {
    IDENTITY_ENROLLED,
    SAMPLES_APPENDED,
    AUTHENTICATION_ATTEMPTED,
    MATCH_RECORDED,
    IDENTITY_EXPORTED,
    IDENTITY_IMPORTED,
    IDENTITY_OVERWRITTEN,
    IDENTITY_REMOVED,
    REGISTRY_CLEARED
}
