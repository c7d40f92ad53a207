package com.identity.matching.metrics;

import com.identity.matching.core.model.MatchDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code identity.authentication.duration}: Timer (tag: decision)</li>
 *   <li>{@code identity.match.score}: DistributionSummary</li>
 *   <li>{@code identity.enrolled}: Counter</li>
 *   <li>{@code identity.enrollment.rejected}: Counter</li>
 *   <li>{@code identity.samples.rejected}: Counter (tag: reason)</li>
 *   <li>{@code identity.match.recorded}: Counter</li>
 *   <li>{@code identity.transfer}: Counter (tag: direction)</li>
 *   <li>{@code identity.registry.size}: DistributionSummary</li>
 *   <li>{@code identity.cache.hit} / {@code identity.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary matchScoreSummary;
    private final DistributionSummary registrySizeSummary;
    private final Counter enrolledCounter;
    private final Counter enrollmentRejectedCounter;
    private final Counter matchRecordedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.matchScoreSummary = DistributionSummary.builder("identity.match.score")
                .description("Aggregate score of the best candidate per authentication")
                .register(registry);
        this.registrySizeSummary = DistributionSummary.builder("identity.registry.size")
                .description("Number of identities scored per authentication")
                .register(registry);
        this.enrolledCounter = Counter.builder("identity.enrolled")
                .description("Number of identities enrolled")
                .register(registry);
        this.enrollmentRejectedCounter = Counter.builder("identity.enrollment.rejected")
                .description("Number of enrollments rejected for insufficient samples")
                .register(registry);
        this.matchRecordedCounter = Counter.builder("identity.match.recorded")
                .description("Number of successful matches recorded")
                .register(registry);
        this.cacheHitCounter = Counter.builder("identity.cache.hit")
                .description("Number of match cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("identity.cache.miss")
                .description("Number of match cache misses")
                .register(registry);
    }

    @Override
    public void recordAuthenticationDuration(MatchDecision decision, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(decision.name(), k ->
                Timer.builder("identity.authentication.duration")
                        .description("Duration of authentication against the registry")
                        .tag("decision", decision.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordMatchScore(double score) {
        if (Double.isFinite(score)) {
            matchScoreSummary.record(score);
        }
    }

    @Override
    public void incrementEnrolled() {
        enrolledCounter.increment();
    }

    @Override
    public void incrementEnrollmentRejected() {
        enrollmentRejectedCounter.increment();
    }

    @Override
    public void incrementSamplesRejected(String reason, int count) {
        if (count <= 0) {
            return;
        }
        Counter counter = counterCache.computeIfAbsent("samples:" + reason, k ->
                Counter.builder("identity.samples.rejected")
                        .description("Number of candidate samples dropped during enrollment")
                        .tag("reason", reason)
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void incrementMatchRecorded() {
        matchRecordedCounter.increment();
    }

    @Override
    public void incrementTransfer(String direction) {
        Counter counter = counterCache.computeIfAbsent("transfer:" + direction, k ->
                Counter.builder("identity.transfer")
                        .description("Number of identities exported or imported")
                        .tag("direction", direction)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordRegistrySize(int size) {
        registrySizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
