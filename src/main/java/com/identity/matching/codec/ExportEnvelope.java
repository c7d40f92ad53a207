package com.identity.matching.codec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Single-identity export file: the record plus when and in which format it was exported.
 */
@JsonPropertyOrder({"format_version", "exported_at", "identity"})
public record ExportEnvelope(
        @JsonProperty("format_version") String formatVersion,
        @JsonProperty("exported_at") Instant exportedAt,
        @JsonProperty("identity") IdentityDocument identity
) {}
