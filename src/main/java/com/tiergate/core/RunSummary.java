package com.tiergate.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verdict of one engine run. Created fresh per run, never persisted.
 *
 * <p>{@code blocked} means a validator explicitly vetoed the change. FAIL and TIMEOUT
 * results mean a validator malfunctioned; they never make a run blocked on their own.
 *
 * @param success            True when no result is a BLOCK
 * @param blocked            True when at least one result is a BLOCK
 * @param results            Results in execution order (tier order, then submission order)
 * @param totalDurationMs    Sum of all task durations
 * @param maxDurationMs      Longest single task duration
 * @param parallelEfficiency totalDurationMs / maxDurationMs, 1 for an empty run
 * @param byTier             Tier label to stats, in tier order, only tiers that produced results
 */
public record RunSummary(
        boolean success,
        boolean blocked,
        List<ExecutionResult> results,
        long totalDurationMs,
        long maxDurationMs,
        double parallelEfficiency,
        Map<String, TierStats> byTier
) {

    public RunSummary {
        results = List.copyOf(results);
        byTier = Collections.unmodifiableMap(new LinkedHashMap<>(byTier));
    }

    /**
     * Results with a BLOCK outcome.
     */
    public List<ExecutionResult> blocks() {
        return results.stream()
                .filter(ExecutionResult::isBlocked)
                .toList();
    }

    /**
     * Results with a FAIL or TIMEOUT outcome.
     */
    public List<ExecutionResult> errors() {
        return results.stream()
                .filter(r -> r.outcome().isError())
                .toList();
    }

    /**
     * Whether any validator malfunctioned (FAIL or TIMEOUT).
     */
    public boolean hasFailures() {
        return results.stream().anyMatch(r -> r.outcome().isError());
    }
}
