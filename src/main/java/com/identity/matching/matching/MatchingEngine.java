package com.identity.matching.matching;

import com.identity.matching.core.exception.DimensionMismatchException;
import com.identity.matching.core.exception.InvalidValueException;
import com.identity.matching.core.exception.MatchingDeadlineExceededException;
import com.identity.matching.core.model.CandidateScore;
import com.identity.matching.core.model.Embedding;
import com.identity.matching.core.model.IdentityRecord;
import com.identity.matching.core.model.MatchResult;
import com.identity.matching.registry.RegistrySnapshot;
import com.identity.matching.similarity.AggregateDistanceScorer;
import com.identity.matching.validation.EmbeddingValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Scores a probe embedding against every identity of a registry snapshot and decides
 * accept or reject.
 *
 * <p>The engine is read-only and holds no registry lock: it works on the immutable snapshot it
 * is given, so abandoning an evaluation leaves nothing behind. Large snapshots are split into
 * chunks scored on the executor; every path reduces through {@link CandidateScore#RANKING}, so
 * sequential and parallel evaluation return identical results.</p>
 *
 * <p>The deadline, read from the injected clock, and the thread's interrupt flag are checked
 * between identities. Either one aborts the evaluation with
 * {@link MatchingDeadlineExceededException}.</p>
 */
public class MatchingEngine {
    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    private final AggregateDistanceScorer scorer;
    private final ExecutorService executor;
    private final int parallelismThreshold;
    private final int maxParallelism;
    private final Clock clock;

    /**
     * Creates a sequential engine.
     */
    public MatchingEngine(AggregateDistanceScorer scorer, Clock clock) {
        this(scorer, null, Integer.MAX_VALUE, 1, clock);
    }

    /**
     * @param executor             executor for chunk scoring, or null to always score sequentially
     * @param parallelismThreshold minimum number of identities before scoring in parallel
     * @param maxParallelism       maximum number of chunks per evaluation
     */
    public MatchingEngine(AggregateDistanceScorer scorer, ExecutorService executor,
                          int parallelismThreshold, int maxParallelism, Clock clock) {
        if (parallelismThreshold < 1) {
            throw new IllegalArgumentException("parallelismThreshold must be >= 1");
        }
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("maxParallelism must be >= 1");
        }
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.executor = executor;
        this.parallelismThreshold = parallelismThreshold;
        this.maxParallelism = maxParallelism;
    }

    public MatchResult authenticate(Embedding probe, RegistrySnapshot snapshot, double tolerance) {
        return authenticate(probe, snapshot, tolerance, null);
    }

    /**
     * Authenticates a probe against a snapshot.
     *
     * @param tolerance maximum accepted score, finite and non-negative
     * @param deadline  instant after which evaluation is abandoned, or null for none
     * @throws DimensionMismatchException         if the probe dimension differs from the registry's
     * @throws InvalidValueException              if the probe has a non-finite component
     * @throws MatchingDeadlineExceededException  on deadline or interrupt
     */
    public MatchResult authenticate(Embedding probe, RegistrySnapshot snapshot, double tolerance, Instant deadline) {
        Objects.requireNonNull(probe, "probe is required");
        Objects.requireNonNull(snapshot, "snapshot is required");
        if (!Double.isFinite(tolerance) || tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be finite and >= 0, was " + tolerance);
        }
        EmbeddingValidator.validate(probe, snapshot.getDimension());

        if (snapshot.isEmpty()) {
            log.info("authentication.completed decision=NO_CANDIDATES candidates=0");
            return MatchResult.noCandidates(tolerance);
        }

        long started = System.nanoTime();
        double[] vector = probe.vector();
        List<IdentityRecord> records = snapshot.records();
        List<CandidateScore> scores = shouldParallelize(records.size())
                ? scoreParallel(vector, records, deadline)
                : scoreRange(vector, records, 0, records.size(), deadline);
        scores.sort(CandidateScore.RANKING);

        MatchResult result = MatchResult.of(scores, tolerance, Duration.ofNanos(System.nanoTime() - started));
        log.info("authentication.completed decision={} identityId={} score={} candidates={} elapsedMs={}",
                result.decision(), result.matchedIdentity(), result.score(), scores.size(),
                result.elapsed().toMillis());
        return result;
    }

    public boolean isParallel() {
        return executor != null && maxParallelism > 1;
    }

    // ========== Internal ==========

    private boolean shouldParallelize(int identities) {
        return isParallel() && identities >= parallelismThreshold;
    }

    private List<CandidateScore> scoreRange(double[] probe, List<IdentityRecord> records,
                                            int from, int to, Instant deadline) {
        List<CandidateScore> scores = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            checkCancellation(deadline);
            scores.add(scorer.score(probe, records.get(i)));
        }
        return scores;
    }

    private List<CandidateScore> scoreParallel(double[] probe, List<IdentityRecord> records, Instant deadline) {
        int total = records.size();
        int chunks = Math.min(maxParallelism, total);
        int chunkSize = (total + chunks - 1) / chunks;
        log.debug("Scoring {} identities in chunks of {}", total, chunkSize);

        List<Future<List<CandidateScore>>> futures = new ArrayList<>(chunks);
        List<CandidateScore> scores = new ArrayList<>(total);
        try {
            for (int from = 0; from < total; from += chunkSize) {
                int start = from;
                int end = Math.min(from + chunkSize, total);
                futures.add(executor.submit(() -> scoreRange(probe, records, start, end, deadline)));
            }
            for (Future<List<CandidateScore>> future : futures) {
                scores.addAll(await(future, deadline));
            }
        } catch (RuntimeException | Error e) {
            cancelAll(futures);
            throw e;
        }
        return scores;
    }

    private List<CandidateScore> await(Future<List<CandidateScore>> future, Instant deadline) {
        try {
            if (deadline == null) {
                return future.get();
            }
            long remaining = Duration.between(clock.instant(), deadline).toMillis();
            return future.get(Math.max(remaining, 0), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MatchingDeadlineExceededException("Authentication interrupted", e);
        } catch (TimeoutException e) {
            throw new MatchingDeadlineExceededException("Authentication deadline " + deadline + " exceeded", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Chunk scoring failed", cause);
        }
    }

    private void checkCancellation(Instant deadline) {
        if (Thread.currentThread().isInterrupted()) {
            throw new MatchingDeadlineExceededException("Authentication interrupted");
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new MatchingDeadlineExceededException("Authentication deadline " + deadline + " exceeded");
        }
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }
}
