package com.identity.matching.transfer;

import com.identity.matching.audit.AuditAction;
import com.identity.matching.audit.AuditService;
import com.identity.matching.codec.ExportEnvelope;
import com.identity.matching.codec.RecordCodec;
import com.identity.matching.core.exception.DimensionMismatchException;
import com.identity.matching.core.exception.DuplicateIdentityException;
import com.identity.matching.core.exception.MalformedRegistryException;
import com.identity.matching.core.exception.UnknownIdentityException;
import com.identity.matching.core.model.IdentityRecord;
import com.identity.matching.core.model.IdentitySummary;
import com.identity.matching.logging.LogContext;
import com.identity.matching.metrics.MetricsService;
import com.identity.matching.registry.IdentityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.io.Writer;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Moves identity records in and out of the registry as portable JSON exports, and
 * administers the registry contents.
 */
public class IdentityTransferService {
    private static final Logger log = LoggerFactory.getLogger(IdentityTransferService.class);

    static final String EXPORT = "export";
    static final String IMPORT = "import";

    private final IdentityRegistry registry;
    private final RecordCodec codec;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final String actorId;

    public IdentityTransferService(IdentityRegistry registry, RecordCodec codec, AuditService auditService,
                                   MetricsService metricsService, Clock clock, String actorId) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.codec = Objects.requireNonNull(codec, "codec is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.actorId = actorId;
    }

    /**
     * Serializes one identity, counters and sample timestamps included.
     *
     * @throws UnknownIdentityException if the identity is absent
     */
    public String exportIdentity(String identityId) {
        try (LogContext ctx = LogContext.forTransfer(LogContext.generateCorrelationId(), EXPORT, identityId)) {
            IdentityRecord record = require(identityId);
            String json = codec.writeExport(record, clock.instant());
            exported(record);
            return json;
        }
    }

    /**
     * Writes one identity export to the writer, which is left open.
     *
     * @throws UnknownIdentityException if the identity is absent
     */
    public void exportIdentity(String identityId, Writer writer) {
        Objects.requireNonNull(writer, "writer is required");
        try (LogContext ctx = LogContext.forTransfer(LogContext.generateCorrelationId(), EXPORT, identityId)) {
            IdentityRecord record = require(identityId);
            codec.writeExport(record, clock.instant(), writer);
            exported(record);
        }
    }

    /**
     * Stores an exported identity.
     *
     * @param overwrite replace an existing record wholesale instead of failing
     * @return the stored record
     * @throws MalformedRegistryException  if the document does not parse or misses fields
     * @throws DimensionMismatchException  if a sample dimension differs from the registry's
     * @throws DuplicateIdentityException  if the id exists and {@code overwrite} is false
     */
    public IdentityRecord importIdentity(String json, boolean overwrite) {
        Objects.requireNonNull(json, "json is required");
        return store(codec.readExport(json), overwrite).record();
    }

    /**
     * Reads an export from the reader, which is left open, and stores it.
     *
     * @see #importIdentity(String, boolean)
     */
    public IdentityRecord importIdentity(Reader reader, boolean overwrite) {
        return importFrom(reader, overwrite).record();
    }

    public List<IdentitySummary> list() {
        return registry.list();
    }

    /**
     * @return the removed record
     * @throws UnknownIdentityException if the identity is absent
     */
    public IdentityRecord remove(String identityId) {
        try (LogContext ctx = LogContext.forTransfer(LogContext.generateCorrelationId(), "remove", identityId)) {
            IdentityRecord removed = registry.remove(identityId);
            auditService.record(AuditAction.IDENTITY_REMOVED, identityId, actorId, Map.of(
                    "samples", removed.sampleCount(),
                    "matchCount", removed.getMatchCount()
            ));
            log.info("identity.removed identityId={}", identityId);
            return removed;
        }
    }

    /**
     * Removes every identity.
     *
     * @return the number of identities removed
     */
    public int clear() {
        int removed = registry.clear();
        auditService.record(AuditAction.REGISTRY_CLEARED, null, actorId, Map.of("removed", removed));
        log.info("registry.cleared removed={}", removed);
        return removed;
    }

    Imported importFrom(Reader reader, boolean overwrite) {
        Objects.requireNonNull(reader, "reader is required");
        return store(codec.readExport(reader), overwrite);
    }

    // ========== Internal ==========

    private Imported store(ExportEnvelope envelope, boolean overwrite) {
        IdentityRecord record = codec.toRecord(envelope.identity());
        String identityId = record.getIdentityId();
        try (LogContext ctx = LogContext.forTransfer(LogContext.generateCorrelationId(), IMPORT, identityId)) {
            boolean replacing = overwrite && registry.contains(identityId);
            IdentityRecord stored = registry.insert(record, overwrite);

            metricsService.incrementTransfer(IMPORT);
            auditService.record(replacing ? AuditAction.IDENTITY_OVERWRITTEN : AuditAction.IDENTITY_IMPORTED,
                    identityId, actorId, Map.of(
                            "samples", stored.sampleCount(),
                            "matchCount", stored.getMatchCount(),
                            "exportedAt", String.valueOf(envelope.exportedAt())
                    ));
            log.info("identity.imported identityId={} samples={} overwritten={}",
                    identityId, stored.sampleCount(), replacing);
            return new Imported(stored, replacing);
        }
    }

    private IdentityRecord require(String identityId) {
        return registry.find(identityId).orElseThrow(() -> new UnknownIdentityException(identityId));
    }

    private void exported(IdentityRecord record) {
        metricsService.incrementTransfer(EXPORT);
        auditService.record(AuditAction.IDENTITY_EXPORTED, record.getIdentityId(), actorId,
                Map.of("samples", record.sampleCount()));
        log.info("identity.exported identityId={} samples={}", record.getIdentityId(), record.sampleCount());
    }

    record Imported(IdentityRecord record, boolean replaced) {}
}
