package com.tiergate.scheduler;

import com.tiergate.core.RunOptions;
import com.tiergate.core.RunSummary;
import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.TaskInput;

import java.util.List;

/**
 * Executes tasks tier by tier and folds their results into a summary.
 *
 * <p>Tiers run in precedence order. A block in a gating tier stops every tier that has
 * not started yet. Individual task failures are results, never exceptions.
 */
public interface TierScheduler {

    /**
     * Run the tasks.
     *
     * @param tasks   Tasks to run, in input order
     * @param input   Shared read-only payload
     * @param options Run options
     * @return Summary of every task that ran
     * @throws com.tiergate.exception.OrchestrationFaultException if the scheduling itself breaks
     */
    RunSummary run(List<TaskDescriptor> tasks, TaskInput input, RunOptions options);
}
