package com.identity.matching.transfer;

import com.identity.matching.audit.AuditService;
import com.identity.matching.codec.RecordCodec;
import com.identity.matching.core.exception.ErrorCode;
import com.identity.matching.metrics.NoOpMetricsService;
import com.identity.matching.registry.IdentityRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.identity.matching.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DirectoryImporterTest {

    @TempDir
    Path directory;

    private IdentityRegistry registry;
    private IdentityTransferService service;
    private DirectoryImporter importer;

    @BeforeEach
    void setUp() {
        registry = IdentityRegistry.create(2, 0.6);
        service = new IdentityTransferService(registry, new RecordCodec(), new AuditService(),
                new NoOpMetricsService(), CLOCK, "admin");
        importer = new DirectoryImporter(service);
    }

    private void writeExport(String fileName, String identityId, double[] vector) throws IOException {
        String json = new RecordCodec().writeExport(record(identityId, vector), NOW);
        Files.writeString(directory.resolve(fileName), json, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Good files should import while bad ones are reported")
    void mixedDirectory() throws IOException {
        writeExport("01-alice.json", "alice", new double[]{0.1, 0.2});
        writeExport("02-bob.json", "bob", new double[]{0.3, 0.4});
        writeExport("03-wide.json", "wide", new double[]{0.1, 0.2, 0.3});
        Files.writeString(directory.resolve("04-broken.json"), "{ nope", StandardCharsets.UTF_8);
        Files.writeString(directory.resolve("notes.txt"), "ignored", StandardCharsets.UTF_8);

        ImportResult result = importer.importDirectory(directory, false, null);

        assertEquals(4, result.totalFiles());
        assertEquals(2, result.imported());
        assertEquals(0, result.overwritten());
        assertEquals(2, result.errorCount());
        assertTrue(result.hasErrors());
        assertEquals("03-wide.json", result.errors().get(0).file());
        assertEquals(ErrorCode.DIMENSION_MISMATCH, result.errors().get(0).code());
        assertEquals(ErrorCode.MALFORMED_REGISTRY, result.errors().get(1).code());
        assertEquals(List.of("alice", "bob"), registry.snapshot().records().stream()
                .map(r -> r.getIdentityId()).toList());
    }

    @Test
    @DisplayName("Existing identities should be duplicates or overwrites depending on the flag")
    void duplicatesAndOverwrites() throws IOException {
        registry.insert(record("alice", new double[]{0.9, 0.9}), false);
        writeExport("alice.json", "alice", new double[]{0.1, 0.2});

        ImportResult refused = importer.importDirectory(directory, false, null);
        ImportResult replaced = importer.importDirectory(directory, true, null);

        assertEquals(ErrorCode.DUPLICATE_IDENTITY, refused.errors().get(0).code());
        assertEquals(1, replaced.overwritten());
        assertEquals(0.1, registry.find("alice").orElseThrow().getSamples().get(0).component(0));
    }

    @Test
    @DisplayName("Progress should be reported per file in name order")
    void progress() throws IOException {
        writeExport("b.json", "bob", new double[]{0.3, 0.4});
        writeExport("a.json", "alice", new double[]{0.1, 0.2});
        List<String> messages = new ArrayList<>();

        importer.importDirectory(directory, false,
                (processed, total, message) -> messages.add(processed + "/" + total + " " + message));

        assertEquals(List.of("1/2 Processed a.json", "2/2 Processed b.json", "2/2 Import completed"), messages);
    }

    @Test
    @DisplayName("Empty directory should import nothing")
    void emptyDirectory() {
        ImportResult result = importer.importDirectory(directory, false, null);

        assertEquals(0, result.totalFiles());
        assertEquals(0, result.successCount());
    }

    @Test
    @DisplayName("A file path should be rejected")
    void notADirectory() throws IOException {
        Path file = Files.writeString(directory.resolve("single.json"), "{}", StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> importer.importDirectory(file, false, null));
    }
}
