package com.tiergate.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Result of one task invocation. Read-only after creation.
 *
 * @param taskId      Task identifier
 * @param tier        Tier the task ran in
 * @param family      Task family
 * @param outcome     Decoded verdict
 * @param exitCode    Process exit code, null when the process did not exit on its own
 * @param durationMs  Wall clock from spawn to settle
 * @param output      Captured standard output
 * @param errorOutput Captured standard error
 * @param error       Diagnostic message (timeout, spawn failure), null on a clean exit
 */
public record ExecutionResult(
        String taskId,
        Tier tier,
        String family,
        Outcome outcome,
        Integer exitCode,
        long durationMs,
        String output,
        String errorOutput,
        String error
) {

    /**
     * Result for a process that exited on its own.
     */
    public static ExecutionResult exited(TaskDescriptor task, Outcome outcome, int exitCode,
                                         long durationMs, String output, String errorOutput) {
        return new ExecutionResult(task.id(), task.tier(), task.family(), outcome, exitCode,
                durationMs, output, errorOutput, null);
    }

    /**
     * Result for an invocation that failed without an exit code.
     */
    public static ExecutionResult failed(TaskDescriptor task, long durationMs, String error) {
        return new ExecutionResult(task.id(), task.tier(), task.family(), Outcome.FAIL, null,
                durationMs, "", "", error);
    }

    /**
     * Result for an invocation that ran past its deadline.
     */
    public static ExecutionResult timedOut(TaskDescriptor task, long timeoutMs, long durationMs,
                                           String output, String errorOutput) {
        return new ExecutionResult(task.id(), task.tier(), task.family(), Outcome.TIMEOUT, null,
                durationMs, output, errorOutput,
                "Task timed out after " + timeoutMs + "ms");
    }

    @JsonIgnore
    public boolean isBlocked() {
        return outcome == Outcome.BLOCK;
    }
}
