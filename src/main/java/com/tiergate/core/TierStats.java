package com.tiergate.core;

/**
 * Per-tier outcome counts and timing, for diagnostics.
 *
 * @param allow              Number of ALLOW results
 * @param block              Number of BLOCK results
 * @param fail               Number of FAIL results
 * @param timeout            Number of TIMEOUT results
 * @param totalDurationMs    Sum of task durations in the tier
 * @param maxDurationMs      Longest single task duration in the tier
 * @param parallelEfficiency totalDurationMs / maxDurationMs, 1 when nothing ran
 */
public record TierStats(
        int allow,
        int block,
        int fail,
        int timeout,
        long totalDurationMs,
        long maxDurationMs,
        double parallelEfficiency
) {

    public int total() {
        return allow + block + fail + timeout;
    }
}
