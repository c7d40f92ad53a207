package com.identity.matching.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One enrolled identity: its reference embeddings and lifecycle counters.
 * Instances are immutable; mutations return a new record so the registry can publish
 * whole records atomically.
 */
public final class IdentityRecord {
    private final String identityId;
    private final List<Embedding> samples;
    private final Instant enrolledAt;
    private final Instant lastMatchedAt;
    private final long matchCount;

    private IdentityRecord(Builder builder) {
        this.identityId = builder.identityId;
        this.samples = List.copyOf(builder.samples);
        this.enrolledAt = builder.enrolledAt;
        this.lastMatchedAt = builder.lastMatchedAt;
        this.matchCount = builder.matchCount;
    }

    public String getIdentityId() {
        return identityId;
    }

    public List<Embedding> getSamples() {
        return samples;
    }

    public Instant getEnrolledAt() {
        return enrolledAt;
    }

    public Instant getLastMatchedAt() {
        return lastMatchedAt;
    }

    public long getMatchCount() {
        return matchCount;
    }

    public int sampleCount() {
        return samples.size();
    }

    public boolean isEnrolled() {
        return !samples.isEmpty();
    }

    /**
     * Returns a copy with the given embeddings appended after the existing ones.
     * Counters and enrollment time are kept.
     */
    public IdentityRecord withAppendedSamples(List<Embedding> additional) {
        List<Embedding> combined = new ArrayList<>(samples.size() + additional.size());
        combined.addAll(samples);
        combined.addAll(additional);
        return builder(this).samples(combined).build();
    }

    /**
     * Returns a copy reflecting one more successful verification at the given time.
     */
    public IdentityRecord withSuccessfulMatch(Instant at) {
        Objects.requireNonNull(at, "at is required");
        return builder(this)
                .lastMatchedAt(at)
                .matchCount(matchCount + 1)
                .build();
    }

    public IdentitySummary summary() {
        return new IdentitySummary(identityId, samples.size(), enrolledAt, lastMatchedAt, matchCount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdentityRecord that = (IdentityRecord) o;
        return matchCount == that.matchCount
                && identityId.equals(that.identityId)
                && samples.equals(that.samples)
                && enrolledAt.equals(that.enrolledAt)
                && Objects.equals(lastMatchedAt, that.lastMatchedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identityId, samples, enrolledAt, lastMatchedAt, matchCount);
    }

    @Override
    public String toString() {
        return "IdentityRecord{" +
                "identityId='" + identityId + '\'' +
                ", samples=" + samples.size() +
                ", enrolledAt=" + enrolledAt +
                ", lastMatchedAt=" + lastMatchedAt +
                ", matchCount=" + matchCount +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(IdentityRecord record) {
        return new Builder()
                .identityId(record.identityId)
                .samples(record.samples)
                .enrolledAt(record.enrolledAt)
                .lastMatchedAt(record.lastMatchedAt)
                .matchCount(record.matchCount);
    }

    public static class Builder {
        private String identityId;
        private List<Embedding> samples = List.of();
        private Instant enrolledAt;
        private Instant lastMatchedAt;
        private long matchCount;

        public Builder identityId(String identityId) {
            this.identityId = identityId;
            return this;
        }

        public Builder samples(List<Embedding> samples) {
            this.samples = samples;
            return this;
        }

        public Builder enrolledAt(Instant enrolledAt) {
            this.enrolledAt = enrolledAt;
            return this;
        }

        public Builder lastMatchedAt(Instant lastMatchedAt) {
            this.lastMatchedAt = lastMatchedAt;
            return this;
        }

        public Builder matchCount(long matchCount) {
            this.matchCount = matchCount;
            return this;
        }

        public IdentityRecord build() {
            Objects.requireNonNull(identityId, "identityId is required");
            Objects.requireNonNull(samples, "samples is required");
            Objects.requireNonNull(enrolledAt, "enrolledAt is required");
            if (identityId.isBlank()) {
                throw new IllegalArgumentException("identityId must not be blank");
            }
            if (matchCount < 0) {
                throw new IllegalArgumentException("matchCount must be >= 0");
            }
            return new IdentityRecord(this);
        }
    }
}
