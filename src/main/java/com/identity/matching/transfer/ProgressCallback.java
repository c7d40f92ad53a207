package com.identity.matching.transfer;

/**
 * Callback for tracking progress of bulk imports.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed number of files processed so far
     * @param total     total number of files, or -1 if unknown
     * @param message   progress message
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
