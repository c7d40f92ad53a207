package com.identity.matching.transfer;

import com.identity.matching.core.exception.ErrorCode;

import java.util.List;

/**
 * Result of a directory import.
 *
 * @param totalFiles  number of export files found
 * @param imported    identities stored as new records
 * @param overwritten identities that replaced an existing record
 * @param errors      one entry per file that could not be imported
 */
public record ImportResult(
        int totalFiles,
        int imported,
        int overwritten,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public int successCount() {
        return imported + overwritten;
    }

    public int errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A file that failed to import.
     *
     * @param file    file name within the directory
     * @param code    failure category
     * @param message the error message
     */
    public record ImportError(String file, ErrorCode code, String message) {}

    @Override
    public String toString() {
        return "ImportResult{files=" + totalFiles +
                ", imported=" + imported +
                ", overwritten=" + overwritten +
                ", errors=" + errors.size() + '}';
    }
}
