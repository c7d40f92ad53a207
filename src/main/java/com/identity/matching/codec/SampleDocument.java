package com.identity.matching.codec;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Persisted form of one embedding.
 */
public record SampleDocument(
        @JsonProperty("vector") double[] vector,
        @JsonProperty("captured_at") Instant capturedAt,
        @JsonProperty("provenance") String provenance
) {}
