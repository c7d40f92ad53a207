package com.identity.matching.api;

import com.identity.matching.audit.AuditAction;
import com.identity.matching.audit.AuditRepository;
import com.identity.matching.audit.AuditService;
import com.identity.matching.audit.InMemoryAuditRepository;
import com.identity.matching.cache.CacheStats;
import com.identity.matching.cache.CaffeineMatchCache;
import com.identity.matching.cache.MatchCache;
import com.identity.matching.cache.NoOpMatchCache;
import com.identity.matching.codec.RecordCodec;
import com.identity.matching.core.model.Embedding;
import com.identity.matching.core.model.IdentityRecord;
import com.identity.matching.core.model.IdentitySummary;
import com.identity.matching.core.model.MatchResult;
import com.identity.matching.enrollment.CandidateSample;
import com.identity.matching.enrollment.EmbeddingExtractor;
import com.identity.matching.enrollment.EnrollmentPipeline;
import com.identity.matching.enrollment.EnrollmentPolicy;
import com.identity.matching.enrollment.EnrollmentResult;
import com.identity.matching.lock.LockConfig;
import com.identity.matching.logging.LogContext;
import com.identity.matching.matching.MatchingEngine;
import com.identity.matching.metrics.MetricsService;
import com.identity.matching.metrics.NoOpMetricsService;
import com.identity.matching.registry.IdentityRegistry;
import com.identity.matching.registry.InMemoryRegistryStore;
import com.identity.matching.registry.JsonFileRegistryStore;
import com.identity.matching.registry.RegistryListener;
import com.identity.matching.registry.RegistrySnapshot;
import com.identity.matching.registry.RegistryStore;
import com.identity.matching.similarity.AggregateDistanceScorer;
import com.identity.matching.similarity.ScoringWeights;
import com.identity.matching.transfer.DirectoryImporter;
import com.identity.matching.transfer.IdentityTransferService;
import com.identity.matching.transfer.ImportResult;
import com.identity.matching.transfer.ProgressCallback;
import com.identity.matching.validation.EmbeddingValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Reader;
import java.io.Writer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for identity enrollment and verification.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (IdentityMatcher matcher = IdentityMatcher.builder()
 *         .dimension(128)
 *         .registryFile(Path.of("registry.json"))
 *         .options(MatchingOptions.strict())
 *         .build()) {
 *
 *     matcher.enroll("alice", List.of(
 *             CandidateSample.of(v1), CandidateSample.of(v2), CandidateSample.of(v3)));
 *
 *     MatchResult result = matcher.verify(matcher.probe(captured, "camera-0"));
 *     if (result.accepted()) {
 *         ...
 *     }
 * }
 * </pre>
 *
 * <p>{@link #authenticate} is read-only; {@link #verify} additionally records the successful
 * match on the accepted identity.</p>
 */
public class IdentityMatcher implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IdentityMatcher.class);

    private final IdentityRegistry registry;
    private final MatchingOptions options;
    private final Clock clock;
    private final MatchingEngine engine;
    private final EnrollmentPipeline enrollmentPipeline;
    private final IdentityTransferService transferService;
    private final DirectoryImporter directoryImporter;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final MatchCache matchCache;
    private final boolean cachingActive;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private IdentityMatcher(Builder builder) {
        this.options = builder.options;
        this.clock = builder.clock;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        RegistryStore store = builder.store != null ? builder.store : new InMemoryRegistryStore();
        this.registry = IdentityRegistry.open(store, builder.dimension, options.getTolerance(), builder.lockConfig);

        AuditRepository auditRepository = builder.auditRepository != null
                ? builder.auditRepository : new InMemoryAuditRepository();
        this.auditService = new AuditService(auditRepository, clock);

        // Parallel scoring
        if (options.getMaxParallelism() > 1 && builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else if (options.getMaxParallelism() > 1) {
            this.executor = Executors.newFixedThreadPool(options.getMaxParallelism(), new ScoringThreadFactory());
            this.ownsExecutor = true;
        } else {
            this.executor = null;
            this.ownsExecutor = false;
        }
        AggregateDistanceScorer scorer = new AggregateDistanceScorer(builder.scoringWeights);
        this.engine = new MatchingEngine(scorer, executor, options.getParallelismThreshold(),
                options.getMaxParallelism(), clock);

        this.enrollmentPipeline = new EnrollmentPipeline(registry, auditService, metricsService,
                clock, options.getActorId());
        this.transferService = new IdentityTransferService(registry, new RecordCodec(), auditService,
                metricsService, clock, options.getActorId());
        this.directoryImporter = new DirectoryImporter(transferService);

        // Cache, dropped on every registry change when it listens
        if (builder.matchCache != null) {
            this.matchCache = builder.matchCache;
        } else if (options.isCachingEnabled()) {
            this.matchCache = new CaffeineMatchCache(options.toCacheConfig());
        } else {
            this.matchCache = new NoOpMatchCache();
        }
        this.cachingActive = !(matchCache instanceof NoOpMatchCache);
        if (matchCache instanceof RegistryListener listener) {
            registry.addListener(listener);
        }

        log.info("IdentityMatcher initialized: dimension={}, identities={}, options={}",
                registry.getDimension(), registry.size(), options);
    }

    // ========== Enrollment API ==========

    /**
     * Validates a probe vector and stamps it with the current time.
     */
    public Embedding probe(double[] vector, String provenance) {
        return EmbeddingValidator.validate(vector, registry.getDimension(), clock.instant(), provenance);
    }

    /**
     * Enrolls a new identity with the configured policy.
     */
    public EnrollmentResult enroll(String identityId, List<CandidateSample> candidates) {
        return enroll(identityId, candidates, false);
    }

    public EnrollmentResult enroll(String identityId, List<CandidateSample> candidates, boolean overwrite) {
        return enroll(identityId, candidates, options.getEnrollmentPolicy(), overwrite);
    }

    public EnrollmentResult enroll(String identityId, List<CandidateSample> candidates,
                                   EnrollmentPolicy policy, boolean overwrite) {
        return enrollmentPipeline.enroll(identityId, candidates, policy, overwrite);
    }

    /**
     * Enrolls a new identity from raw samples run through an external extractor.
     */
    public <R> EnrollmentResult enrollRaw(String identityId, List<R> rawSamples, EmbeddingExtractor<R> extractor) {
        return enrollRaw(identityId, rawSamples, extractor, false);
    }

    public <R> EnrollmentResult enrollRaw(String identityId, List<R> rawSamples, EmbeddingExtractor<R> extractor,
                                          boolean overwrite) {
        return enrollmentPipeline.enrollRaw(identityId, rawSamples, extractor, options.getEnrollmentPolicy(),
                overwrite);
    }

    /**
     * Adds samples to an enrolled identity, keeping its match history.
     */
    public EnrollmentResult appendSamples(String identityId, List<CandidateSample> candidates) {
        return enrollmentPipeline.appendSamples(identityId, candidates, options.getEnrollmentPolicy());
    }

    // ========== Matching API ==========

    /**
     * Authenticates a probe with the configured tolerance. Read-only.
     */
    public MatchResult authenticate(Embedding probe) {
        return authenticate(probe, registry.getThreshold());
    }

    /**
     * Authenticates a probe with an explicit tolerance. Read-only.
     */
    public MatchResult authenticate(Embedding probe, double tolerance) {
        RegistrySnapshot snapshot = registry.snapshot();
        try (LogContext ctx = LogContext.forAuthentication(LogContext.generateCorrelationId())) {
            if (cachingActive) {
                Optional<MatchResult> cached = matchCache.get(registry.getInstanceId(), snapshot.getVersion(),
                        probe.vector(), tolerance);
                if (cached.isPresent()) {
                    metricsService.recordCacheHit();
                    log.debug("authentication.cache.hit version={}", snapshot.getVersion());
                    audit(cached.get(), true);
                    return cached.get();
                }
                metricsService.recordCacheMiss();
            }

            Instant deadline = options.getDeadline() != null ? clock.instant().plus(options.getDeadline()) : null;
            MatchResult result = engine.authenticate(probe, snapshot, tolerance, deadline);

            metricsService.recordAuthenticationDuration(result.decision(), result.elapsed());
            metricsService.recordMatchScore(result.score());
            metricsService.recordRegistrySize(snapshot.size());
            audit(result, false);

            if (cachingActive) {
                matchCache.put(registry.getInstanceId(), snapshot.getVersion(), probe.vector(), tolerance, result);
            }
            return result;
        }
    }

    /**
     * Marks a successful verification of an identity at the current time.
     */
    public IdentityRecord recordSuccessfulMatch(String identityId) {
        IdentityRecord updated = registry.recordSuccessfulMatch(identityId, clock.instant());
        metricsService.incrementMatchRecorded();
        auditService.record(AuditAction.MATCH_RECORDED, identityId, options.getActorId(),
                Map.of("matchCount", updated.getMatchCount()));
        return updated;
    }

    /**
     * Authenticates and, when accepted, records the successful match.
     */
    public MatchResult verify(Embedding probe) {
        return verify(probe, registry.getThreshold());
    }

    public MatchResult verify(Embedding probe, double tolerance) {
        MatchResult result = authenticate(probe, tolerance);
        if (result.accepted()) {
            recordSuccessfulMatch(result.matchedIdentity());
        }
        return result;
    }

    // ========== Transfer API ==========

    public String exportIdentity(String identityId) {
        return transferService.exportIdentity(identityId);
    }

    public void exportIdentity(String identityId, Writer writer) {
        transferService.exportIdentity(identityId, writer);
    }

    public IdentityRecord importIdentity(String json, boolean overwrite) {
        return transferService.importIdentity(json, overwrite);
    }

    public IdentityRecord importIdentity(Reader reader, boolean overwrite) {
        return transferService.importIdentity(reader, overwrite);
    }

    public ImportResult importDirectory(Path directory, boolean overwrite) {
        return importDirectory(directory, overwrite, ProgressCallback.NOOP);
    }

    public ImportResult importDirectory(Path directory, boolean overwrite, ProgressCallback callback) {
        return directoryImporter.importDirectory(directory, overwrite, callback);
    }

    // ========== Registry API ==========

    public List<IdentitySummary> list() {
        return transferService.list();
    }

    public Optional<IdentityRecord> find(String identityId) {
        return registry.find(identityId);
    }

    public IdentityRecord remove(String identityId) {
        return transferService.remove(identityId);
    }

    public int clear() {
        return transferService.clear();
    }

    public IdentityRegistry getRegistry() {
        return registry;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MatchingOptions getOptions() {
        return options;
    }

    public CacheStats getCacheStats() {
        return matchCache.getStats();
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void audit(MatchResult result, boolean cached) {
        Map<String, Object> details = new HashMap<>();
        details.put("decision", result.decision().name());
        details.put("score", result.score());
        details.put("tolerance", result.tolerance());
        details.put("candidates", result.candidates().size());
        details.put("cached", cached);
        auditService.record(AuditAction.AUTHENTICATION_ATTEMPTED, result.matchedIdentity(),
                options.getActorId(), details);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int dimension = IdentityRegistry.DEFAULT_DIMENSION;
        private RegistryStore store;
        private Clock clock = Clock.systemUTC();
        private MatchingOptions options = MatchingOptions.defaults();
        private MetricsService metricsService;
        private AuditRepository auditRepository;
        private MatchCache matchCache;
        private ScoringWeights scoringWeights = ScoringWeights.calibrated();
        private LockConfig lockConfig = LockConfig.defaults();
        private ExecutorService executor;

        /**
         * Sets the embedding dimension. Defaults to 128.
         */
        public Builder dimension(int dimension) {
            if (dimension <= 0) {
                throw new IllegalArgumentException("dimension must be positive");
            }
            this.dimension = dimension;
            return this;
        }

        /**
         * Sets a custom registry store. Defaults to an in-memory store.
         */
        public Builder store(RegistryStore store) {
            this.store = store;
            return this;
        }

        /**
         * Persists the registry to a JSON file, loading it first if it exists.
         */
        public Builder registryFile(Path file) {
            this.store = new JsonFileRegistryStore(file);
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock is required");
            }
            this.clock = clock;
            return this;
        }

        public Builder options(MatchingOptions options) {
            if (options == null) {
                throw new IllegalArgumentException("options is required");
            }
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        /**
         * Sets a custom match cache, used regardless of {@link MatchingOptions#isCachingEnabled()}.
         * Entries are keyed per registry, so one cache may serve several matchers.
         */
        public Builder matchCache(MatchCache matchCache) {
            this.matchCache = matchCache;
            return this;
        }

        /**
         * Overrides the min/mean weights. The default tolerance is calibrated for
         * {@link ScoringWeights#calibrated()}; other weights need a recalibrated tolerance.
         */
        public Builder scoringWeights(ScoringWeights scoringWeights) {
            if (scoringWeights == null) {
                throw new IllegalArgumentException("scoringWeights is required");
            }
            this.scoringWeights = scoringWeights;
            return this;
        }

        public Builder lockConfig(LockConfig lockConfig) {
            if (lockConfig == null) {
                throw new IllegalArgumentException("lockConfig is required");
            }
            this.lockConfig = lockConfig;
            return this;
        }

        /**
         * Uses an externally managed executor for parallel scoring. It is not shut down on close.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public IdentityMatcher build() {
            return new IdentityMatcher(this);
        }
    }

    private static final class ScoringThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "identity-matching-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
