package com.tiergate.config;

import com.tiergate.core.RunOptions;

/**
 * Execution defaults for the engine.
 *
 * @param timeoutMs            Cap on every invocation's timeout (0 = no cap)
 * @param fallbackToSequential Replay sequentially when the concurrent orchestration faults
 * @param verbose              Progress logs at INFO
 * @param killGraceMs          Time between graceful termination and force kill on timeout
 * @param workingDirectory     Directory validators are spawned in, null for the JVM's own
 */
public record ExecutionConfig(
        long timeoutMs,
        boolean fallbackToSequential,
        boolean verbose,
        long killGraceMs,
        String workingDirectory
) {

    public static final long DEFAULT_KILL_GRACE_MS = 1000;

    public static ExecutionConfig defaults() {
        return new ExecutionConfig(RunOptions.DEFAULT_TIMEOUT_MS, true, false, DEFAULT_KILL_GRACE_MS, null);
    }

    /**
     * Run options derived from these defaults.
     */
    public RunOptions toRunOptions() {
        return new RunOptions(timeoutMs, fallbackToSequential, verbose);
    }
}
