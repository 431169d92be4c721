package com.tiergate.scheduler;

import com.tiergate.aggregate.ResultAggregator;
import com.tiergate.core.ExecutionResult;
import com.tiergate.core.RunOptions;
import com.tiergate.core.RunSummary;
import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.TaskInput;
import com.tiergate.core.Tier;
import com.tiergate.exception.OrchestrationFaultException;
import com.tiergate.invoker.TaskInvoker;
import com.tiergate.priority.TierGroups;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs tiers one after another and the tasks of a tier concurrently.
 *
 * <p>Each tier ends with a settle-all join: every task submitted for the tier is waited
 * for, whatever its siblings did. Only after the join is the tier inspected; a block in a
 * gating tier then stops the tiers that have not started.
 *
 * <p>Per-run state lives on the stack of {@link #run}, so one scheduler can serve
 * concurrent runs.
 */
public class ConcurrentTierScheduler implements TierScheduler {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentTierScheduler.class);

    private final TaskInvoker invoker;
    private final ExecutorService workers;

    /**
     * @param invoker Runs individual tasks
     * @param workers Pool the tasks of a tier are submitted to; not owned by the scheduler
     */
    public ConcurrentTierScheduler(TaskInvoker invoker, ExecutorService workers) {
        if (invoker == null) {
            throw new NullPointerException("Invoker cannot be null");
        }
        if (workers == null) {
            throw new NullPointerException("Workers cannot be null");
        }
        this.invoker = invoker;
        this.workers = workers;
    }

    @Override
    public RunSummary run(List<TaskDescriptor> tasks, TaskInput input, RunOptions options) {
        TierGroups groups;
        try {
            groups = TierGroups.partition(tasks);
        } catch (NullPointerException e) {
            throw new OrchestrationFaultException("Malformed task list: " + e.getMessage(), e);
        }

        List<ExecutionResult> results = new ArrayList<>(groups.size());
        for (Tier tier : groups.nonEmptyTiers()) {
            List<TaskDescriptor> tierTasks = groups.get(tier);
            progress(options, "Executing {} {} tier tasks in parallel", tierTasks.size(), tier.label());

            List<ExecutionResult> tierResults = runTier(tier, tierTasks, input, options);
            results.addAll(tierResults);

            if (tier.isGating() && tierResults.stream().anyMatch(ExecutionResult::isBlocked)) {
                progress(options, "{} tier task blocked, stopping execution", tier.label());
                break;
            }
        }

        return ResultAggregator.aggregate(results);
    }

    private List<ExecutionResult> runTier(Tier tier, List<TaskDescriptor> tasks, TaskInput input, RunOptions options) {
        List<Future<ExecutionResult>> futures = new ArrayList<>(tasks.size());
        try {
            for (TaskDescriptor task : tasks) {
                futures.add(workers.submit(() -> Invocations.guarded(invoker, task, input, options)));
            }
        } catch (RejectedExecutionException e) {
            // Let whatever already started finish before giving up on the tier
            settleAll(tasks, futures);
            throw new OrchestrationFaultException(
                    "Worker pool rejected a " + tier.label() + " tier task", e);
        }
        return settleAll(tasks, futures);
    }

    /**
     * Wait for every future, in submission order. A future that completed exceptionally
     * becomes a FAIL result; it never stops the wait for its siblings.
     */
    private List<ExecutionResult> settleAll(List<TaskDescriptor> tasks, List<Future<ExecutionResult>> futures) {
        List<ExecutionResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            TaskDescriptor task = tasks.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.warn("Task {} did not settle normally: {}", task.id(), e.getCause().toString());
                results.add(ExecutionResult.failed(task, 0, "Invocation failed: " + e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new OrchestrationFaultException("Interrupted while waiting for tier tasks", e);
            }
        }
        return results;
    }

    private void progress(RunOptions options, String format, Object... args) {
        if (options.verbose()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
