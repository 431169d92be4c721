package com.tiergate.scheduler;

import com.tiergate.aggregate.ResultAggregator;
import com.tiergate.core.ExecutionResult;
import com.tiergate.core.RunOptions;
import com.tiergate.core.RunSummary;
import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.TaskInput;
import com.tiergate.core.Tier;
import com.tiergate.invoker.TaskInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs tasks strictly one at a time, in tier order.
 *
 * <p>Used only when the concurrent orchestration faults. It tolerates the malformed
 * input that may have caused the fault: null tasks are skipped and tasks without a tier
 * run as {@link Tier#MEDIUM}. The summary has the same shape as the concurrent path.
 */
public class SequentialFallback implements TierScheduler {

    private static final Logger log = LoggerFactory.getLogger(SequentialFallback.class);

    private final TaskInvoker invoker;

    public SequentialFallback(TaskInvoker invoker) {
        if (invoker == null) {
            throw new NullPointerException("Invoker cannot be null");
        }
        this.invoker = invoker;
    }

    @Override
    public RunSummary run(List<TaskDescriptor> tasks, TaskInput input, RunOptions options) {
        return runSequential(tasks, input, options);
    }

    public RunSummary runSequential(List<TaskDescriptor> tasks, TaskInput input, RunOptions options) {
        List<TaskDescriptor> ordered = order(tasks);
        log.info("Executing {} tasks sequentially", ordered.size());

        List<ExecutionResult> results = new ArrayList<>(ordered.size());
        for (TaskDescriptor task : ordered) {
            ExecutionResult result = Invocations.guarded(invoker, task, input, options);
            results.add(result);

            if (options.verbose()) {
                log.info("  {} {} ({}ms)", result.outcome().label(), task.id(), result.durationMs());
            }

            if (task.tier().isGating() && result.isBlocked()) {
                log.info("Task {} blocked in {} tier, stopping execution", task.id(), task.tier().label());
                break;
            }
        }

        return ResultAggregator.aggregate(results);
    }

    /**
     * Flatten into execution order: tier precedence, then input order (the sort is stable).
     */
    private List<TaskDescriptor> order(List<TaskDescriptor> tasks) {
        if (tasks == null) {
            throw new NullPointerException("Tasks cannot be null");
        }
        List<TaskDescriptor> ordered = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            TaskDescriptor task = tasks.get(i);
            if (task == null) {
                log.warn("Skipping null task at index {}", i);
                continue;
            }
            if (task.tier() == null) {
                log.warn("Task {} has no tier, running it as {}", task.id(), Tier.MEDIUM.label());
                task = new TaskDescriptor(task.id(), Tier.MEDIUM, task.family(), task.command(), task.timeoutMs());
            }
            ordered.add(task);
        }
        ordered.sort(Comparator.comparing(TaskDescriptor::tier));
        return ordered;
    }
}
