package com.identity.matching.enrollment;

import com.identity.matching.core.exception.ErrorCode;

/**
 * A candidate sample dropped during enrollment.
 *
 * @param index      position of the sample in the submitted list
 * @param provenance provenance of the sample, when known
 * @param code       why it was dropped
 * @param message    human-readable detail
 */
public record RejectedSample(int index, String provenance, ErrorCode code, String message) {
}
