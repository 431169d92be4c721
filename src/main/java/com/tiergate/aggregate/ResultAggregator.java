package com.tiergate.aggregate;

import com.tiergate.core.ExecutionResult;
import com.tiergate.core.Outcome;
import com.tiergate.core.RunSummary;
import com.tiergate.core.Tier;
import com.tiergate.core.TierStats;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds execution results into a {@link RunSummary}.
 * Pure functions: no state, no I/O.
 */
public final class ResultAggregator {

    private ResultAggregator() {
    }

    /**
     * Build the summary for a list of results.
     *
     * @param results Results in execution order
     * @return Summary; an empty list gives a successful summary with efficiency 1
     */
    public static RunSummary aggregate(List<ExecutionResult> results) {
        if (results == null) {
            throw new NullPointerException("Results cannot be null");
        }

        long total = 0;
        long max = 0;
        boolean blocked = false;
        Map<Tier, List<ExecutionResult>> byTier = new EnumMap<>(Tier.class);

        for (ExecutionResult result : results) {
            total += result.durationMs();
            max = Math.max(max, result.durationMs());
            blocked |= result.isBlocked();
            byTier.computeIfAbsent(result.tier(), t -> new ArrayList<>()).add(result);
        }

        Map<String, TierStats> tierStats = new LinkedHashMap<>();
        for (Map.Entry<Tier, List<ExecutionResult>> entry : byTier.entrySet()) {
            tierStats.put(entry.getKey().label(), tierStats(entry.getValue()));
        }

        return new RunSummary(
                !blocked,
                blocked,
                results,
                total,
                max,
                efficiency(total, max),
                tierStats
        );
    }

    /**
     * Stats for the results of one tier.
     */
    static TierStats tierStats(List<ExecutionResult> results) {
        Map<Outcome, Integer> counts = new EnumMap<>(Outcome.class);
        long total = 0;
        long max = 0;
        for (ExecutionResult result : results) {
            counts.merge(result.outcome(), 1, Integer::sum);
            total += result.durationMs();
            max = Math.max(max, result.durationMs());
        }
        return new TierStats(
                counts.getOrDefault(Outcome.ALLOW, 0),
                counts.getOrDefault(Outcome.BLOCK, 0),
                counts.getOrDefault(Outcome.FAIL, 0),
                counts.getOrDefault(Outcome.TIMEOUT, 0),
                total,
                max,
                efficiency(total, max)
        );
    }

    /**
     * Summed duration over longest duration; 1 when nothing took measurable time.
     */
    static double efficiency(long totalDurationMs, long maxDurationMs) {
        if (maxDurationMs <= 0) {
            return 1.0;
        }
        return (double) totalDurationMs / maxDurationMs;
    }

    /**
     * Performance breakdown of a finished run.
     */
    public static PerformanceStats performanceStats(RunSummary summary) {
        List<ExecutionResult> results = summary.results();
        int totalTasks = results.size();

        Map<String, PerformanceStats.TierPerformance> byTier = new LinkedHashMap<>();
        int allowed = 0;
        for (Tier tier : Tier.values()) {
            int count = 0;
            long duration = 0;
            int success = 0;
            for (ExecutionResult result : results) {
                if (result.tier() != tier) {
                    continue;
                }
                count++;
                duration += result.durationMs();
                if (result.outcome() == Outcome.ALLOW) {
                    success++;
                }
            }
            if (count > 0) {
                byTier.put(tier.label(), new PerformanceStats.TierPerformance(count, duration, success));
                allowed += success;
            }
        }

        double average = totalTasks > 0 ? (double) summary.totalDurationMs() / totalTasks : 0.0;
        double successRate = totalTasks > 0 ? 100.0 * allowed / totalTasks : 100.0;

        return new PerformanceStats(
                totalTasks,
                summary.totalDurationMs(),
                summary.maxDurationMs(),
                summary.parallelEfficiency(),
                average,
                successRate,
                byTier
        );
    }
}
