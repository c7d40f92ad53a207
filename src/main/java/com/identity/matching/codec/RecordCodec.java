package com.identity.matching.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.identity.matching.core.exception.MalformedRegistryException;
import com.identity.matching.core.exception.RegistryPersistenceException;
import com.identity.matching.core.model.Embedding;
import com.identity.matching.core.model.IdentityRecord;
import com.identity.matching.registry.RegistrySnapshot;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for identity records, exports and whole registries.
 *
 * <p>Doubles are written in their shortest round-tripping form and instants as ISO-8601 with
 * full precision, so vectors, counters and timestamps survive a write/read cycle exactly.
 * Unknown properties and missing required fields fail the read with
 * {@link MalformedRegistryException}. Writers and readers passed in are left open.</p>
 */
public class RecordCodec {

    public static final String FORMAT_VERSION = "1.0";

    private final ObjectMapper objectMapper;

    public RecordCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
    }

    // ========== Exports ==========

    public String writeExport(IdentityRecord record, Instant exportedAt) {
        try {
            return objectMapper.writeValueAsString(toEnvelope(record, exportedAt));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize identity " + record.getIdentityId(), e);
        }
    }

    public void writeExport(IdentityRecord record, Instant exportedAt, Writer writer) {
        try {
            objectMapper.writeValue(writer, toEnvelope(record, exportedAt));
        } catch (IOException e) {
            throw new RegistryPersistenceException("Failed to write export of " + record.getIdentityId(), e);
        }
    }

    public ExportEnvelope readExport(String json) {
        try {
            return checkEnvelope(objectMapper.readValue(json, ExportEnvelope.class));
        } catch (JsonProcessingException e) {
            throw new MalformedRegistryException("Malformed identity export: " + e.getOriginalMessage(), e);
        }
    }

    public ExportEnvelope readExport(Reader reader) {
        try {
            return checkEnvelope(objectMapper.readValue(reader, ExportEnvelope.class));
        } catch (JsonProcessingException e) {
            throw new MalformedRegistryException("Malformed identity export: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RegistryPersistenceException("Failed to read identity export", e);
        }
    }

    // ========== Registry ==========

    public void writeRegistry(RegistrySnapshot snapshot, Writer writer) {
        List<IdentityDocument> identities = new ArrayList<>(snapshot.size());
        for (IdentityRecord record : snapshot.records()) {
            identities.add(toDocument(record));
        }
        RegistryDocument document = new RegistryDocument(FORMAT_VERSION, snapshot.getDimension(),
                snapshot.getThreshold(), identities);
        try {
            objectMapper.writeValue(writer, document);
        } catch (IOException e) {
            throw new RegistryPersistenceException("Failed to write registry", e);
        }
    }

    public RegistrySnapshot readRegistry(Reader reader) {
        RegistryDocument document;
        try {
            document = objectMapper.readValue(reader, RegistryDocument.class);
        } catch (JsonProcessingException e) {
            throw new MalformedRegistryException("Malformed registry: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RegistryPersistenceException("Failed to read registry", e);
        }
        if (document == null) {
            throw new MalformedRegistryException("Registry document is empty");
        }
        checkFormatVersion(document.formatVersion());
        require(document.dimension(), "dimension");
        require(document.threshold(), "threshold");
        require(document.identities(), "identities");

        List<IdentityRecord> records = new ArrayList<>(document.identities().size());
        for (IdentityDocument identity : document.identities()) {
            records.add(toRecord(identity));
        }
        try {
            return RegistrySnapshot.of(document.dimension(), document.threshold(), records);
        } catch (IllegalArgumentException e) {
            throw new MalformedRegistryException("Invalid registry: " + e.getMessage(), e);
        }
    }

    // ========== Mapping ==========

    public IdentityDocument toDocument(IdentityRecord record) {
        List<SampleDocument> samples = new ArrayList<>(record.sampleCount());
        for (Embedding embedding : record.getSamples()) {
            samples.add(new SampleDocument(embedding.vector(), embedding.capturedAt(), embedding.provenance()));
        }
        return new IdentityDocument(record.getIdentityId(), samples, record.getEnrolledAt(),
                record.getLastMatchedAt(), record.getMatchCount());
    }

    public IdentityRecord toRecord(IdentityDocument document) {
        if (document == null) {
            throw new MalformedRegistryException("Identity document is missing");
        }
        require(document.identityId(), "identity_id");
        require(document.samples(), "samples");
        require(document.enrolledAt(), "enrolled_at");
        require(document.matchCount(), "match_count");

        List<Embedding> samples = new ArrayList<>(document.samples().size());
        for (SampleDocument sample : document.samples()) {
            if (sample == null) {
                throw new MalformedRegistryException("Identity '" + document.identityId() + "' has a null sample");
            }
            require(sample.vector(), "samples[].vector");
            require(sample.capturedAt(), "samples[].captured_at");
            samples.add(new Embedding(sample.vector(), sample.capturedAt(), sample.provenance()));
        }
        try {
            return IdentityRecord.builder()
                    .identityId(document.identityId())
                    .samples(samples)
                    .enrolledAt(document.enrolledAt())
                    .lastMatchedAt(document.lastMatchedAt())
                    .matchCount(document.matchCount())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new MalformedRegistryException("Invalid identity document: " + e.getMessage(), e);
        }
    }

    private ExportEnvelope toEnvelope(IdentityRecord record, Instant exportedAt) {
        return new ExportEnvelope(FORMAT_VERSION, exportedAt, toDocument(record));
    }

    private ExportEnvelope checkEnvelope(ExportEnvelope envelope) {
        if (envelope == null) {
            throw new MalformedRegistryException("Identity export is empty");
        }
        checkFormatVersion(envelope.formatVersion());
        require(envelope.identity(), "identity");
        return envelope;
    }

    private static void checkFormatVersion(String formatVersion) {
        require(formatVersion, "format_version");
        if (!FORMAT_VERSION.equals(formatVersion)) {
            throw new MalformedRegistryException("Unsupported format_version '" + formatVersion
                    + "', expected " + FORMAT_VERSION);
        }
    }

    private static void require(Object value, String field) {
        if (value == null) {
            throw new MalformedRegistryException("Missing required field: " + field);
        }
    }
}
