package com.identity.matching.core.exception;

/**
 * Raised by an embedding extractor when no embedding can be produced for a raw sample,
 * for example when no face is found. Enrollment records the sample as rejected and goes on.
 */
public class ExtractionFailedException extends IdentityMatchingException {

    public ExtractionFailedException(String message) {
        super(ErrorCode.EXTRACTION_FAILED, message);
    }

    public ExtractionFailedException(String message, Throwable cause) {
        super(ErrorCode.EXTRACTION_FAILED, message, cause);
    }
}
