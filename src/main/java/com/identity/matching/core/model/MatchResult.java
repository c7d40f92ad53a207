package com.identity.matching.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Result of authenticating one probe against a registry snapshot.
 * "No match" is a normal value ({@link MatchDecision#REJECTED} or
 * {@link MatchDecision#NO_CANDIDATES}), never an exception.
 *
 * @param matchedIdentity best-ranked identity, or null when the registry is empty
 * @param score           aggregate score of the best identity; +Infinity with no candidates
 * @param minDistance     closest single-sample distance of the best identity
 * @param confidence      display-only value, {@code max(0, 1 - minDistance)}
 * @param tolerance       the tolerance the decision was taken against
 * @param decision        accept/reject outcome
 * @param candidates      every identity's score, best first
 * @param elapsed         time spent scoring
 */
public record MatchResult(
        String matchedIdentity,
        double score,
        double minDistance,
        double confidence,
        double tolerance,
        MatchDecision decision,
        List<CandidateScore> candidates,
        Duration elapsed
) {
    public MatchResult {
        Objects.requireNonNull(decision, "decision is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        elapsed = elapsed != null ? elapsed : Duration.ZERO;
        if (decision == MatchDecision.NO_CANDIDATES && matchedIdentity != null) {
            throw new IllegalArgumentException("NO_CANDIDATES result cannot name a matched identity");
        }
        if (decision != MatchDecision.NO_CANDIDATES && matchedIdentity == null) {
            throw new IllegalArgumentException("matchedIdentity is required for decision " + decision);
        }
    }

    /**
     * Result for an empty registry.
     */
    public static MatchResult noCandidates(double tolerance) {
        return new MatchResult(null, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 0.0,
                tolerance, MatchDecision.NO_CANDIDATES, List.of(), Duration.ZERO);
    }

    /**
     * Builds the decision from the best-ranked candidate.
     */
    public static MatchResult of(List<CandidateScore> ranked, double tolerance, Duration elapsed) {
        if (ranked.isEmpty()) {
            return noCandidates(tolerance);
        }
        CandidateScore best = ranked.get(0);
        MatchDecision decision = best.score() <= tolerance ? MatchDecision.ACCEPTED : MatchDecision.REJECTED;
        return new MatchResult(best.identityId(), best.score(), best.minDistance(), best.confidence(),
                tolerance, decision, ranked, elapsed);
    }

    public boolean accepted() {
        return decision == MatchDecision.ACCEPTED;
    }

    public boolean hasCandidates() {
        return decision != MatchDecision.NO_CANDIDATES;
    }

    @Override
    public String toString() {
        return "MatchResult{" +
                "matchedIdentity='" + matchedIdentity + '\'' +
                ", score=" + score +
                ", confidence=" + confidence +
                ", tolerance=" + tolerance +
                ", decision=" + decision +
                ", candidates=" + candidates.size() +
                ", elapsed=" + elapsed +
                '}';
    }
}
