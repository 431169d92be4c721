package com.tiergate.core;

/**
 * Options for one engine run, passed explicitly to the entry point.
 *
 * @param timeoutMs            Cap applied to every invocation's timeout; 0 or less means no cap
 * @param fallbackToSequential Replay sequentially when the concurrent orchestration faults
 * @param verbose              Log per-tier and per-task progress at INFO instead of DEBUG
 */
public record RunOptions(
        long timeoutMs,
        boolean fallbackToSequential,
        boolean verbose
) {

    public static final long DEFAULT_TIMEOUT_MS = 30_000;

    /**
     * Defaults: 30 second cap, fallback enabled, quiet.
     */
    public static RunOptions defaults() {
        return new RunOptions(DEFAULT_TIMEOUT_MS, true, false);
    }

    public RunOptions withTimeoutMs(long timeoutMs) {
        return new RunOptions(timeoutMs, fallbackToSequential, verbose);
    }

    public RunOptions withFallbackToSequential(boolean fallbackToSequential) {
        return new RunOptions(timeoutMs, fallbackToSequential, verbose);
    }

    public RunOptions withVerbose(boolean verbose) {
        return new RunOptions(timeoutMs, fallbackToSequential, verbose);
    }

    /**
     * Timeout to enforce for a task: its own timeout, capped by {@link #timeoutMs()}.
     */
    public long effectiveTimeoutMs(TaskDescriptor task) {
        long taskTimeout = task.timeoutMs() > 0 ? task.timeoutMs() : task.tier().defaultTimeoutMs();
        if (timeoutMs > 0) {
            return Math.min(taskTimeout, timeoutMs);
        }
        return taskTimeout;
    }
}
