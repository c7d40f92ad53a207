package com.identity.matching.codec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Persisted form of a whole registry.
 */
@JsonPropertyOrder({"format_version", "dimension", "threshold", "identities"})
public record RegistryDocument(
        @JsonProperty("format_version") String formatVersion,
        @JsonProperty("dimension") Integer dimension,
        @JsonProperty("threshold") Double threshold,
        @JsonProperty("identities") List<IdentityDocument> identities
) {}
