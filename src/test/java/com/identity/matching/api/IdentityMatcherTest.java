package com.identity.matching.api;

import com.identity.matching.audit.AuditAction;
import com.identity.matching.audit.AuditEntry;
import com.identity.matching.cache.CacheConfig;
import com.identity.matching.cache.CaffeineMatchCache;
import com.identity.matching.core.exception.InsufficientSamplesException;
import com.identity.matching.core.model.Embedding;
import com.identity.matching.core.model.IdentityRecord;
import com.identity.matching.core.model.MatchDecision;
import com.identity.matching.core.model.MatchResult;
import com.identity.matching.enrollment.CandidateSample;
import com.identity.matching.metrics.MetricsService;
import com.identity.matching.transfer.ImportResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.identity.matching.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

@DisplayName("IdentityMatcher Tests")
class IdentityMatcherTest {

    private static final int DIMENSION = 4;

    private IdentityMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = IdentityMatcher.builder()
                .dimension(DIMENSION)
                .clock(CLOCK)
                .options(MatchingOptions.builder().maxParallelism(1).build())
                .build();
    }

    @AfterEach
    void tearDown() {
        matcher.close();
    }

    private static List<CandidateSample> samples(double... values) {
        return Arrays.stream(values)
                .mapToObj(value -> CandidateSample.of(filled(DIMENSION, value)))
                .toList();
    }

    @Nested
    @DisplayName("Verification")
    class VerificationTests {

        @Test
        @DisplayName("Authenticate should not touch match counters")
        void authenticateIsReadOnly() {
            matcher.enroll("alice", samples(0.1, 0.1, 0.1));

            MatchResult result = matcher.authenticate(matcher.probe(filled(DIMENSION, 0.1), "cam-0"));

            assertEquals(MatchDecision.ACCEPTED, result.decision());
            IdentityRecord alice = matcher.find("alice").orElseThrow();
            assertEquals(0, alice.getMatchCount());
            assertNull(alice.getLastMatchedAt());
        }

        @Test
        @DisplayName("Verify should record accepted matches only")
        void verifyRecordsAcceptedMatches() {
            matcher.enroll("alice", samples(0.1));

            MatchResult accepted = matcher.verify(matcher.probe(filled(DIMENSION, 0.1), null));
            MatchResult rejected = matcher.verify(matcher.probe(filled(DIMENSION, 5.0), null));

            assertTrue(accepted.accepted());
            assertEquals(MatchDecision.REJECTED, rejected.decision());
            assertEquals("alice", rejected.matchedIdentity());
            IdentityRecord alice = matcher.find("alice").orElseThrow();
            assertEquals(1, alice.getMatchCount());
            assertEquals(NOW, alice.getLastMatchedAt());
            assertEquals(1, matcher.getAuditService().getEntriesByAction(AuditAction.MATCH_RECORDED).size());
            assertEquals(2, matcher.getAuditService().getEntriesByAction(AuditAction.AUTHENTICATION_ATTEMPTED).size());
        }

        @Test
        @DisplayName("Explicit tolerance should override the configured one")
        void explicitTolerance() {
            matcher.enroll("alice", samples(0.0));
            Embedding probe = matcher.probe(filled(DIMENSION, 0.5), null);

            assertFalse(matcher.authenticate(probe).accepted());
            assertTrue(matcher.authenticate(probe, 1.5).accepted());
        }

        @Test
        @DisplayName("Empty registry should report no candidates")
        void emptyRegistry() {
            MatchResult result = matcher.verify(matcher.probe(filled(DIMENSION, 0.1), null));

            assertEquals(MatchDecision.NO_CANDIDATES, result.decision());
            assertTrue(matcher.getAuditService().getEntriesByAction(AuditAction.MATCH_RECORDED).isEmpty());
        }

        @Test
        @DisplayName("Audit entries should never carry embedding vectors")
        void auditCarriesNoVectors() {
            matcher.enroll("alice", samples(0.1));
            matcher.verify(matcher.probe(filled(DIMENSION, 0.1), null));

            for (AuditEntry entry : matcher.getAuditService().getAllEntries()) {
                assertTrue(entry.details().values().stream().noneMatch(v -> v instanceof double[]));
            }
        }
    }

    @Nested
    @DisplayName("Options")
    class OptionsTests {

        @Test
        @DisplayName("Strict options should require three valid samples")
        void strictPreset() {
            try (IdentityMatcher strict = IdentityMatcher.builder()
                    .dimension(DIMENSION)
                    .clock(CLOCK)
                    .options(MatchingOptions.strict())
                    .build()) {

                assertThrows(InsufficientSamplesException.class, () -> strict.enroll("alice", samples(0.1, 0.2)));
                assertEquals(3, strict.enroll("alice", samples(0.1, 0.2, 0.3)).acceptedCount());
                assertEquals(0.5, strict.getRegistry().getThreshold());
            }
        }

        @Test
        @DisplayName("Parallel scoring on an external executor should agree with sequential scoring")
        void externalExecutor() {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try (IdentityMatcher parallel = IdentityMatcher.builder()
                    .dimension(DIMENSION)
                    .clock(CLOCK)
                    .executor(executor)
                    .options(MatchingOptions.builder().maxParallelism(2).parallelismThreshold(1).build())
                    .build()) {
                for (int i = 0; i < 10; i++) {
                    parallel.enroll("id-" + i, samples(i * 0.1));
                    matcher.enroll("id-" + i, samples(i * 0.1));
                }
                Embedding probe = matcher.probe(filled(DIMENSION, 0.42), null);

                assertEquals(matcher.authenticate(probe).candidates(), parallel.authenticate(probe).candidates());
            } finally {
                assertFalse(executor.isShutdown());
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        private MetricsService metrics;
        private IdentityMatcher cached;

        @BeforeEach
        void setUp() {
            metrics = mock(MetricsService.class);
            cached = IdentityMatcher.builder()
                    .dimension(DIMENSION)
                    .clock(CLOCK)
                    .metricsService(metrics)
                    .options(MatchingOptions.builder().maxParallelism(1).cachingEnabled(true).build())
                    .build();
        }

        @AfterEach
        void tearDown() {
            cached.close();
        }

        @Test
        @DisplayName("Repeated probes should be served from the cache")
        void repeatedProbe() {
            cached.enroll("alice", samples(0.1));
            Embedding probe = cached.probe(filled(DIMENSION, 0.1), null);

            MatchResult first = cached.authenticate(probe);
            MatchResult second = cached.authenticate(probe);

            assertEquals(first, second);
            assertEquals(1, cached.getCacheStats().hitCount());
            verify(metrics).recordCacheHit();
            verify(metrics).recordCacheMiss();
            verify(metrics, times(1)).recordMatchScore(anyDouble());
        }

        @Test
        @DisplayName("Registry changes should invalidate cached results")
        void invalidation() {
            cached.enroll("alice", samples(0.1));
            Embedding probe = cached.probe(filled(DIMENSION, 0.12), null);
            assertEquals("alice", cached.authenticate(probe).matchedIdentity());

            cached.enroll("bob", samples(0.12));

            assertEquals("bob", cached.authenticate(probe).matchedIdentity());
            assertEquals(0, cached.getCacheStats().hitCount());
        }

        @Test
        @DisplayName("A cache shared by two matchers should keep their results apart")
        void sharedCache() {
            CaffeineMatchCache shared = new CaffeineMatchCache(CacheConfig.defaults());
            try (IdentityMatcher first = IdentityMatcher.builder().dimension(DIMENSION).clock(CLOCK)
                    .options(MatchingOptions.builder().maxParallelism(1).build()).matchCache(shared).build();
                 IdentityMatcher second = IdentityMatcher.builder().dimension(DIMENSION).clock(CLOCK)
                         .options(MatchingOptions.builder().maxParallelism(1).build()).matchCache(shared).build()) {
                first.enroll("alice", samples(0.1));
                second.enroll("bob", samples(0.1));
                assertEquals(first.getRegistry().snapshot().getVersion(), second.getRegistry().snapshot().getVersion());
                Embedding probe = first.probe(filled(DIMENSION, 0.1), null);

                assertEquals("alice", first.authenticate(probe).matchedIdentity());
                assertEquals("bob", second.authenticate(probe).matchedIdentity());
                assertEquals(0, shared.getStats().hitCount());
            }
        }

        @Test
        @DisplayName("Cache should be inactive unless enabled")
        void disabledByDefault() {
            matcher.enroll("alice", samples(0.1));
            Embedding probe = matcher.probe(filled(DIMENSION, 0.1), null);
            matcher.authenticate(probe);
            matcher.authenticate(probe);

            assertEquals(0, matcher.getCacheStats().hitCount());
            assertEquals(0, matcher.getCacheStats().missCount());
        }
    }

    @Nested
    @DisplayName("Persistence and transfer")
    class PersistenceTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("A file-backed registry should survive reopening")
        void reopen() {
            Path file = tempDir.resolve("registry.json");
            try (IdentityMatcher first = IdentityMatcher.builder().dimension(DIMENSION).clock(CLOCK)
                    .registryFile(file).build()) {
                first.enroll("alice", samples(0.1, 0.2));
                first.verify(first.probe(filled(DIMENSION, 0.1), null));
            }

            try (IdentityMatcher second = IdentityMatcher.builder().dimension(DIMENSION).clock(CLOCK)
                    .registryFile(file).build()) {
                IdentityRecord alice = second.find("alice").orElseThrow();
                assertEquals(2, alice.sampleCount());
                assertEquals(1, alice.getMatchCount());
            }
        }

        @Test
        @DisplayName("Exports should import through a directory")
        void exportToDirectory() throws Exception {
            matcher.enroll("alice", samples(0.1));
            matcher.enroll("bob", samples(0.9));
            Files.writeString(tempDir.resolve("alice.json"), matcher.exportIdentity("alice"));
            Files.writeString(tempDir.resolve("bob.json"), matcher.exportIdentity("bob"));
            matcher.clear();

            ImportResult result = matcher.importDirectory(tempDir, false);

            assertEquals(2, result.imported());
            assertEquals(2, matcher.list().size());
            assertEquals("bob", matcher.remove("bob").getIdentityId());
            assertEquals(1, matcher.list().size());
        }
    }
}
