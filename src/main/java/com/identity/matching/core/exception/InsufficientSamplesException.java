package com.identity.matching.core.exception;

import com.identity.matching.enrollment.RejectedSample;

import java.util.List;

/**
 * Thrown when fewer samples were accepted than the enrollment policy requires.
 * Carries the rejections so callers can report why each sample was dropped.
 */
public class InsufficientSamplesException extends IdentityMatchingException {

    private final String identityId;
    private final int accepted;
    private final int required;
    private final List<RejectedSample> rejections;

    public InsufficientSamplesException(String identityId, int accepted, int required) {
        this(identityId, accepted, required, List.of());
    }

    public InsufficientSamplesException(String identityId, int accepted, int required,
                                        List<RejectedSample> rejections) {
        super(ErrorCode.INSUFFICIENT_SAMPLES,
                "Identity '" + identityId + "' has " + accepted + " accepted sample(s), "
                        + required + " required");
        this.identityId = identityId;
        this.accepted = accepted;
        this.required = required;
        this.rejections = rejections != null ? List.copyOf(rejections) : List.of();
    }

    public String getIdentityId() {
        return identityId;
    }

    public int getAccepted() {
        return accepted;
    }

    public int getRequired() {
        return required;
    }

    public List<RejectedSample> getRejections() {
        return rejections;
    }
}
