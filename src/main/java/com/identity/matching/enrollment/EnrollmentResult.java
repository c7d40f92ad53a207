package com.identity.matching.enrollment;

import com.identity.matching.core.model.IdentityRecord;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successful enrollment or sample append.
 *
 * @param record        the record as stored (or as it would be stored, for {@code prepare})
 * @param acceptedCount number of samples accepted from this submission
 * @param rejected      samples dropped from this submission, in submission order
 */
public record EnrollmentResult(IdentityRecord record, int acceptedCount, List<RejectedSample> rejected) {

    public EnrollmentResult {
        Objects.requireNonNull(record, "record is required");
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
    }

    public int rejectedCount() {
        return rejected.size();
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }
}
