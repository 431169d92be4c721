package com.tiergate.invoker;

import com.tiergate.core.ExecutionResult;
import com.tiergate.core.RunOptions;
import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.TaskInput;

/**
 * Runs one validator task and reports its verdict.
 *
 * <p>Implementations must never throw: every failure mode (spawn error, timeout, bad exit
 * code) is returned as an {@link ExecutionResult}. The tier scheduler's settle-all join
 * relies on every invocation completing normally.
 */
@FunctionalInterface
public interface TaskInvoker {

    /**
     * Invoke a task.
     *
     * @param task    Task to run
     * @param input   Shared read-only payload
     * @param options Run options (timeout cap, verbosity)
     * @return Result, never null
     */
    ExecutionResult invoke(TaskDescriptor task, TaskInput input, RunOptions options);
}
