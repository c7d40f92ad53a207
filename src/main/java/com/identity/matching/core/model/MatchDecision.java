package com.identity.matching.core.model;

/**
 * Outcome of an authentication attempt.
 */
public enum MatchDecision {
    /**
     * Best candidate scored within the tolerance.
     */
    ACCEPTED,

    /**
     * A closest candidate exists but its score is above the tolerance.
     */
    REJECTED,

    /**
     * The registry holds no identities; nothing to compare against.
     */
    NO_CANDIDATES
}
