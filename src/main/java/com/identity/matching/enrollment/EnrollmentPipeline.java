package com.identity.matching.enrollment;

import com.identity.matching.audit.AuditAction;
import com.identity.matching.audit.AuditService;
import com.identity.matching.core.exception.DimensionMismatchException;
import com.identity.matching.core.exception.DuplicateIdentityException;
import com.identity.matching.core.exception.ErrorCode;
import com.identity.matching.core.exception.ExtractionFailedException;
import com.identity.matching.core.exception.InsufficientSamplesException;
import com.identity.matching.core.exception.InvalidValueException;
import com.identity.matching.core.exception.UnknownIdentityException;
import com.identity.matching.core.model.Embedding;
import com.identity.matching.core.model.IdentityRecord;
import com.identity.matching.logging.LogContext;
import com.identity.matching.metrics.MetricsService;
import com.identity.matching.registry.IdentityRegistry;
import com.identity.matching.validation.EmbeddingValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns candidate samples into identity records and stores them in the registry.
 *
 * <p>Each candidate is validated independently. Invalid candidates are dropped and reported as
 * {@link RejectedSample}s; the enrollment succeeds as long as the number of accepted samples
 * reaches the policy minimum, otherwise it fails with {@link InsufficientSamplesException}
 * and the registry is left untouched. Accepted samples keep their submission order.</p>
 */
public class EnrollmentPipeline {
    private static final Logger log = LoggerFactory.getLogger(EnrollmentPipeline.class);

    private final IdentityRegistry registry;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final String actorId;

    public EnrollmentPipeline(IdentityRegistry registry, AuditService auditService,
                              MetricsService metricsService, Clock clock, String actorId) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.actorId = actorId;
    }

    /**
     * Validates the candidates and builds the record without touching the registry.
     *
     * @throws IllegalArgumentException     if the identity id is invalid
     * @throws InsufficientSamplesException if fewer than the policy minimum are valid
     */
    public EnrollmentResult prepare(String identityId, List<CandidateSample> candidates, EnrollmentPolicy policy) {
        EmbeddingValidator.validateIdentityId(identityId);
        Objects.requireNonNull(policy, "policy is required");
        Screening screening = screen(candidates);
        requireEnough(identityId, screening, policy);
        return new EnrollmentResult(newRecord(identityId, screening.accepted),
                screening.accepted.size(), screening.rejected);
    }

    /**
     * Validates the candidates and inserts the new record.
     *
     * @param overwrite replace an existing identity wholesale instead of failing
     * @throws DuplicateIdentityException   if the id exists and {@code overwrite} is false
     * @throws InsufficientSamplesException if fewer than the policy minimum are valid
     */
    public EnrollmentResult enroll(String identityId, List<CandidateSample> candidates,
                                   EnrollmentPolicy policy, boolean overwrite) {
        try (LogContext ctx = LogContext.forEnrollment(LogContext.generateCorrelationId(), identityId)) {
            EmbeddingValidator.validateIdentityId(identityId);
            Objects.requireNonNull(policy, "policy is required");
            if (!overwrite && registry.contains(identityId)) {
                throw new DuplicateIdentityException(identityId);
            }
            return store(identityId, screen(candidates), policy, overwrite);
        }
    }

    /**
     * Runs the extractor on each raw sample, then enrolls like {@link #enroll}. A sample whose
     * extraction fails with {@link ExtractionFailedException} is dropped with code
     * {@link ErrorCode#EXTRACTION_FAILED}; any other extractor failure propagates.
     */
    public <R> EnrollmentResult enrollRaw(String identityId, List<R> rawSamples, EmbeddingExtractor<R> extractor,
                                          EnrollmentPolicy policy, boolean overwrite) {
        Objects.requireNonNull(rawSamples, "rawSamples is required");
        Objects.requireNonNull(extractor, "extractor is required");
        try (LogContext ctx = LogContext.forEnrollment(LogContext.generateCorrelationId(), identityId)) {
            EmbeddingValidator.validateIdentityId(identityId);
            Objects.requireNonNull(policy, "policy is required");
            if (!overwrite && registry.contains(identityId)) {
                throw new DuplicateIdentityException(identityId);
            }

            Screening screening = new Screening();
            for (int i = 0; i < rawSamples.size(); i++) {
                Embedding extracted;
                try {
                    extracted = extractor.extract(rawSamples.get(i));
                } catch (ExtractionFailedException e) {
                    log.debug("enrollment.extraction.failed index={} error={}", i, e.getMessage());
                    screening.reject(i, null, ErrorCode.EXTRACTION_FAILED, e.getMessage());
                    continue;
                }
                if (extracted == null) {
                    screening.reject(i, null, ErrorCode.EXTRACTION_FAILED, "Extractor returned no embedding");
                    continue;
                }
                try {
                    screening.accept(EmbeddingValidator.validate(extracted, registry.getDimension()));
                } catch (DimensionMismatchException | InvalidValueException e) {
                    screening.reject(i, extracted.provenance(), e.getErrorCode(), e.getMessage());
                }
            }
            return store(identityId, screening, policy, overwrite);
        }
    }

    /**
     * Validates the candidates and appends the accepted ones to an existing identity.
     * Match counters are preserved.
     *
     * @throws UnknownIdentityException     if the identity is absent
     * @throws InsufficientSamplesException if fewer than the policy minimum are valid
     */
    public EnrollmentResult appendSamples(String identityId, List<CandidateSample> candidates, EnrollmentPolicy policy) {
        Objects.requireNonNull(policy, "policy is required");
        try (LogContext ctx = LogContext.forEnrollment(LogContext.generateCorrelationId(), identityId)
                .with("mode", "append")) {
            if (!registry.contains(identityId)) {
                throw new UnknownIdentityException(identityId);
            }
            Screening screening = screen(candidates);
            requireEnough(identityId, screening, policy);

            IdentityRecord updated = registry.appendSamples(identityId, screening.accepted);
            recordRejections(screening);
            auditService.record(AuditAction.SAMPLES_APPENDED, identityId, actorId, Map.of(
                    "accepted", screening.accepted.size(),
                    "rejected", screening.rejected.size(),
                    "totalSamples", updated.sampleCount()
            ));
            log.info("enrollment.appended identityId={} accepted={} rejected={} totalSamples={}",
                    identityId, screening.accepted.size(), screening.rejected.size(), updated.sampleCount());
            return new EnrollmentResult(updated, screening.accepted.size(), screening.rejected);
        }
    }

    // ========== Internal ==========

    private EnrollmentResult store(String identityId, Screening screening, EnrollmentPolicy policy, boolean overwrite) {
        requireEnough(identityId, screening, policy);
        boolean replacing = overwrite && registry.contains(identityId);
        IdentityRecord record = registry.insert(newRecord(identityId, screening.accepted), overwrite);

        metricsService.incrementEnrolled();
        recordRejections(screening);
        auditService.record(AuditAction.IDENTITY_ENROLLED, identityId, actorId, Map.of(
                "accepted", screening.accepted.size(),
                "rejected", screening.rejected.size(),
                "overwrite", replacing
        ));
        log.info("enrollment.completed identityId={} accepted={} rejected={} overwrite={}",
                identityId, screening.accepted.size(), screening.rejected.size(), replacing);
        return new EnrollmentResult(record, screening.accepted.size(), screening.rejected);
    }

    private Screening screen(List<CandidateSample> candidates) {
        Objects.requireNonNull(candidates, "candidates is required");
        int dimension = registry.getDimension();
        Screening screening = new Screening();
        for (int i = 0; i < candidates.size(); i++) {
            CandidateSample candidate = candidates.get(i);
            if (candidate == null) {
                screening.reject(i, null, ErrorCode.INVALID_VALUE, "Candidate sample is null");
                continue;
            }
            Instant capturedAt = candidate.capturedAt() != null ? candidate.capturedAt() : clock.instant();
            try {
                screening.accept(EmbeddingValidator.validate(candidate.vector(), dimension,
                        capturedAt, candidate.provenance()));
            } catch (DimensionMismatchException | InvalidValueException e) {
                log.debug("enrollment.sample.rejected index={} code={} error={}", i, e.getErrorCode(), e.getMessage());
                screening.reject(i, candidate.provenance(), e.getErrorCode(), e.getMessage());
            }
        }
        return screening;
    }

    private void requireEnough(String identityId, Screening screening, EnrollmentPolicy policy) {
        int required = policy.minimumAcceptedSamples();
        if (screening.accepted.size() >= required) {
            return;
        }
        metricsService.incrementEnrollmentRejected();
        recordRejections(screening);
        log.warn("enrollment.rejected identityId={} accepted={} required={} rejected={}",
                identityId, screening.accepted.size(), required, screening.rejected.size());
        throw new InsufficientSamplesException(identityId, screening.accepted.size(), required, screening.rejected);
    }

    private void recordRejections(Screening screening) {
        Map<ErrorCode, Integer> byCode = new EnumMap<>(ErrorCode.class);
        for (RejectedSample rejected : screening.rejected) {
            byCode.merge(rejected.code(), 1, Integer::sum);
        }
        byCode.forEach((code, count) -> metricsService.incrementSamplesRejected(code.name(), count));
    }

    private IdentityRecord newRecord(String identityId, List<Embedding> samples) {
        return IdentityRecord.builder()
                .identityId(identityId)
                .samples(samples)
                .enrolledAt(clock.instant())
                .matchCount(0)
                .build();
    }

    private static final class Screening {
        private final List<Embedding> accepted = new ArrayList<>();
        private final List<RejectedSample> rejected = new ArrayList<>();

        void accept(Embedding embedding) {
            accepted.add(embedding);
        }

        void reject(int index, String provenance, ErrorCode code, String message) {
            rejected.add(new RejectedSample(index, provenance, code, message));
        }
    }
}
