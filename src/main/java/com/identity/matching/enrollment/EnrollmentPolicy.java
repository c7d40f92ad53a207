package com.identity.matching.enrollment;

/**
 * How many valid samples an enrollment needs.
 *
 * @param minimumAcceptedSamples at least 1
 */
public record EnrollmentPolicy(int minimumAcceptedSamples) {

    public EnrollmentPolicy {
        if (minimumAcceptedSamples < 1) {
            throw new IllegalArgumentException("minimumAcceptedSamples must be >= 1");
        }
    }

    public static EnrollmentPolicy defaults() {
        return new EnrollmentPolicy(1);
    }

    public static EnrollmentPolicy requireAtLeast(int samples) {
        return new EnrollmentPolicy(samples);
    }
}
