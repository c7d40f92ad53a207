package com.identity.matching.registry;

import com.identity.matching.codec.RecordCodec;
import com.identity.matching.core.exception.RegistryPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RegistryStore} persisting the registry as a single pretty-printed JSON file.
 *
 * <p>Each save writes a temporary file next to the target and moves it over the target, atomically
 * where the file system supports it, so a crash mid-save leaves the previous file intact.</p>
 */
public class JsonFileRegistryStore implements RegistryStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileRegistryStore.class);

    private final Path file;
    private final RecordCodec codec;

    public JsonFileRegistryStore(Path file) {
        this(file, new RecordCodec());
    }

    public JsonFileRegistryStore(Path file, RecordCodec codec) {
        this.file = Objects.requireNonNull(file, "file is required").toAbsolutePath();
        this.codec = Objects.requireNonNull(codec, "codec is required");
    }

    @Override
    public Optional<RegistrySnapshot> load() {
        if (!Files.exists(file)) {
            log.info("store.load.missing file={}", file);
            return Optional.empty();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            RegistrySnapshot snapshot = codec.readRegistry(reader);
            log.info("store.load.completed file={} identities={}", file, snapshot.size());
            return Optional.of(snapshot);
        } catch (IOException e) {
            throw new RegistryPersistenceException("Failed to read registry file " + file, e);
        }
    }

    @Override
    public void save(RegistrySnapshot snapshot) {
        Path directory = file.getParent();
        Path temp = null;
        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                codec.writeRegistry(snapshot, writer);
            }
            move(temp, file);
            log.debug("store.save.completed file={} version={} identities={}",
                    file, snapshot.getVersion(), snapshot.size());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new RegistryPersistenceException("Failed to write registry file " + file, e);
        } catch (RuntimeException e) {
            deleteQuietly(temp);
            throw e;
        }
    }

    public Path getFile() {
        return file;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary registry file {}: {}", temp, e.getMessage());
        }
    }
}
