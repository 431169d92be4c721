package com.tiergate.scheduler;

import com.tiergate.core.ExecutionResult;
import com.tiergate.core.RunOptions;
import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.TaskInput;
import com.tiergate.invoker.TaskInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Holds invokers to their never-throw contract.
 */
final class Invocations {

    private static final Logger log = LoggerFactory.getLogger(Invocations.class);

    private Invocations() {
    }

    /**
     * Invoke a task; an exception or a missing result from the invoker becomes a FAIL result.
     */
    static ExecutionResult guarded(TaskInvoker invoker, TaskDescriptor task, TaskInput input, RunOptions options) {
        long startNanos = System.nanoTime();
        try {
            ExecutionResult result = invoker.invoke(task, input, options);
            if (result == null) {
                log.warn("Invoker returned no result for task {}", task.id());
                return ExecutionResult.failed(task, elapsedMs(startNanos), "Invoker returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Invoker threw for task {}, recording as failure", task.id(), e);
            return ExecutionResult.failed(task, elapsedMs(startNanos), "Invocation failed: " + e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
