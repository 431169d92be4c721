package com.tiergate.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Timing breakdown of a run.
 *
 * @param totalTasks         Number of results
 * @param totalDurationMs    Sum of task durations
 * @param maxDurationMs      Longest task duration
 * @param parallelEfficiency totalDurationMs / maxDurationMs
 * @param averageDurationMs  Mean task duration, 0 for an empty run
 * @param successRate        Percentage of ALLOW results, 100 for an empty run
 * @param byTier             Per-tier breakdown, tiers in precedence order
 */
public record PerformanceStats(
        int totalTasks,
        long totalDurationMs,
        long maxDurationMs,
        double parallelEfficiency,
        double averageDurationMs,
        double successRate,
        Map<String, TierPerformance> byTier
) {

    public PerformanceStats {
        byTier = Collections.unmodifiableMap(new LinkedHashMap<>(byTier));
    }

    /**
     * @param count      Tasks run in the tier
     * @param durationMs Summed duration of the tier's tasks
     * @param success    ALLOW results in the tier
     */
    public record TierPerformance(int count, long durationMs, int success) {
    }
}
