package com.identity.matching.transfer;

import com.identity.matching.core.exception.ErrorCode;
import com.identity.matching.core.exception.IdentityMatchingException;
import com.identity.matching.core.exception.RegistryPersistenceException;
import com.identity.matching.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Imports every {@code *.json} identity export found in a directory.
 *
 * <p>Files are processed in file-name order. A file that fails to import is recorded as an
 * {@link ImportResult.ImportError} and the import carries on with the next one.</p>
 */
public class DirectoryImporter {
    private static final Logger log = LoggerFactory.getLogger(DirectoryImporter.class);
    private static final String EXTENSION = ".json";

    private final IdentityTransferService transferService;

    public DirectoryImporter(IdentityTransferService transferService) {
        this.transferService = Objects.requireNonNull(transferService, "transferService is required");
    }

    /**
     * @param directory directory holding one export per file
     * @param overwrite replace existing identities instead of reporting them as duplicates
     * @param callback  progress callback (nullable)
     * @throws IllegalArgumentException     if {@code directory} is not a directory
     * @throws RegistryPersistenceException if the directory cannot be listed
     */
    public ImportResult importDirectory(Path directory, boolean overwrite, ProgressCallback callback) {
        Objects.requireNonNull(directory, "directory is required");
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<Path> files = listExports(directory);

        int imported = 0;
        int overwritten = 0;
        List<ImportResult.ImportError> errors = new ArrayList<>();

        try (LogContext ctx = LogContext.forImport(LogContext.generateCorrelationId())) {
            log.info("import.started directory={} files={} overwrite={}", directory, files.size(), overwrite);
            int processed = 0;
            for (Path file : files) {
                String name = file.getFileName().toString();
                try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                    if (transferService.importFrom(reader, overwrite).replaced()) {
                        overwritten++;
                    } else {
                        imported++;
                    }
                } catch (IdentityMatchingException e) {
                    errors.add(new ImportResult.ImportError(name, e.getErrorCode(), e.getMessage()));
                    log.warn("import.error file={} code={} error={}", name, e.getErrorCode(), e.getMessage());
                } catch (IllegalArgumentException e) {
                    errors.add(new ImportResult.ImportError(name, ErrorCode.MALFORMED_REGISTRY, e.getMessage()));
                    log.warn("import.error file={} code={} error={}", name, ErrorCode.MALFORMED_REGISTRY, e.getMessage());
                } catch (IOException e) {
                    errors.add(new ImportResult.ImportError(name, ErrorCode.PERSISTENCE_FAILED, e.getMessage()));
                    log.warn("import.error file={} code={} error={}", name, ErrorCode.PERSISTENCE_FAILED, e.getMessage());
                }
                processed++;
                cb.onProgress(processed, files.size(), "Processed " + name);
            }
        }

        ImportResult result = new ImportResult(files.size(), imported, overwritten, errors);
        cb.onProgress(files.size(), files.size(), "Import completed");
        log.info("import.completed directory={} result={}", directory, result);
        return result;
    }

    private static List<Path> listExports(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RegistryPersistenceException("Failed to list directory " + directory, e);
        }
    }
}
