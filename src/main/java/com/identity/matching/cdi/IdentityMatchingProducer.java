package com.identity.matching.cdi;

import com.identity.matching.api.IdentityMatcher;
import com.identity.matching.api.MatchingOptions;
import com.identity.matching.audit.AuditService;
import com.identity.matching.lock.LockConfig;
import com.identity.matching.registry.IdentityRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires an {@link IdentityMatcher} from MicroProfile Config properties.
 *
 * <pre>
 * identity-matching:
 *   registry:
 *     path: /var/lib/identity/registry.json
 *     dimension: 128
 *   matching:
 *     tolerance: 0.6
 * </pre>
 *
 * <p>Without {@code identity-matching.registry.path} the registry lives in memory only.</p>
 */
@ApplicationScoped
public class IdentityMatchingProducer {

    private static final Logger log = LoggerFactory.getLogger(IdentityMatchingProducer.class);

    // ── Registry ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-matching.registry.path")
    Optional<String> registryPath;

    @Inject
    @ConfigProperty(name = "identity-matching.registry.dimension", defaultValue = "128")
    int dimension;

    // ── Matching ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-matching.matching.tolerance", defaultValue = "0.6")
    double tolerance;

    @Inject
    @ConfigProperty(name = "identity-matching.matching.parallelism-threshold", defaultValue = "256")
    int parallelismThreshold;

    @Inject
    @ConfigProperty(name = "identity-matching.matching.max-parallelism")
    Optional<Integer> maxParallelism;

    @Inject
    @ConfigProperty(name = "identity-matching.matching.deadline-millis", defaultValue = "0")
    long deadlineMillis;

    // ── Enrollment ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-matching.enrollment.minimum-accepted-samples", defaultValue = "1")
    int minimumAcceptedSamples;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-matching.cache.enabled", defaultValue = "false")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "identity-matching.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "identity-matching.cache.ttl-seconds", defaultValue = "300")
    int cacheTtlSeconds;

    // ── Lock ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "identity-matching.lock.timeout-millis", defaultValue = "5000")
    long lockTimeoutMillis;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public IdentityMatcher identityMatcher() {
        log.info("Producing IdentityMatcher: dimension={} registry={}",
                dimension, registryPath.orElse("<in-memory>"));

        IdentityMatcher.Builder builder = IdentityMatcher.builder()
                .dimension(dimension)
                .options(matchingOptions())
                .lockConfig(new LockConfig(lockTimeoutMillis));
        registryPath.map(Path::of).ifPresent(builder::registryFile);
        return builder.build();
    }

    public void closeMatcher(@Disposes IdentityMatcher matcher) {
        log.info("Closing IdentityMatcher");
        matcher.close();
    }

    @Produces
    @ApplicationScoped
    public IdentityRegistry identityRegistry(IdentityMatcher matcher) {
        return matcher.getRegistry();
    }

    @Produces
    @ApplicationScoped
    public AuditService auditService(IdentityMatcher matcher) {
        return matcher.getAuditService();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    MatchingOptions matchingOptions() {
        MatchingOptions.Builder builder = MatchingOptions.builder()
                .tolerance(tolerance)
                .minimumAcceptedSamples(minimumAcceptedSamples)
                .parallelismThreshold(parallelismThreshold)
                .cachingEnabled(cacheEnabled)
                .cacheMaxSize(cacheMaxSize)
                .cacheTtlSeconds(cacheTtlSeconds);
        maxParallelism.ifPresent(builder::maxParallelism);
        if (deadlineMillis > 0) {
            builder.deadline(Duration.ofMillis(deadlineMillis));
        }
        return builder.build();
    }
}
