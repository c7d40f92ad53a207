package com.identity.matching.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;

/**
 * Persisted form of one identity record. This layout is the bit-exact contract shared by
 * the registry file and identity exports.
 */
@JsonPropertyOrder({"identity_id", "samples", "enrolled_at", "last_matched_at", "match_count"})
public record IdentityDocument(
        @JsonProperty("identity_id") String identityId,
        @JsonProperty("samples") List<SampleDocument> samples,
        @JsonProperty("enrolled_at") Instant enrolledAt,
        @JsonProperty("last_matched_at") @JsonInclude(JsonInclude.Include.ALWAYS) Instant lastMatchedAt,
        @JsonProperty("match_count") Long matchCount
) {}
