package com.identity.matching.core.model;

import java.time.Instant;

/**
 * Read-only projection of an identity record used for listings.
 *
 * @param identityId    the identity key
 * @param sampleCount   number of stored reference embeddings
 * @param enrolledAt    when the identity was enrolled
 * @param lastMatchedAt last successful verification, or null if never matched
 * @param matchCount    number of successful verifications
 */
public record IdentitySummary(
        String identityId,
        int sampleCount,
        Instant enrolledAt,
        Instant lastMatchedAt,
        long matchCount
) {}
