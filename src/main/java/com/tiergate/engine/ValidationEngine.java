package com.tiergate.engine;

import com.tiergate.aggregate.PerformanceStats;
import com.tiergate.aggregate.ResultAggregator;
import com.tiergate.config.GateConfig;
import com.tiergate.core.RunOptions;
import com.tiergate.core.RunSummary;
import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.TaskInput;
import com.tiergate.exception.GateException;
import com.tiergate.exception.OrchestrationFaultException;
import com.tiergate.invoker.ProcessInvoker;
import com.tiergate.invoker.TaskInvoker;
import com.tiergate.priority.PriorityClassifier;
import com.tiergate.scheduler.ConcurrentTierScheduler;
import com.tiergate.scheduler.SequentialFallback;
import com.tiergate.scheduler.TierScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Public entry point: runs validator tasks by tier and returns the verdict.
 *
 * <p>The concurrent scheduler runs first. If its own orchestration faults, the same
 * tasks are replayed by the sequential fallback, unless the options disable it. Task
 * failures never reach this level; they are part of the summary.
 *
 * <p>Thread-safe. The engine owns its worker pool; call {@link #shutdown()} when done.
 */
public class ValidationEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    private final PriorityClassifier classifier;
    private final TierScheduler scheduler;
    private final SequentialFallback fallback;
    private final ExecutorService workers;
    private final RunOptions defaultOptions;
    private final TaskInvoker invoker;
    private ProcessInvoker ownedInvoker;

    /**
     * Engine spawning validators as processes, configured from {@code config}.
     */
    public ValidationEngine(GateConfig config) {
        this(config, new ProcessInvoker(requireConfig(config).execution()), newWorkerPool());
        this.ownedInvoker = (ProcessInvoker) invoker;
    }

    public ValidationEngine(GateConfig config, TaskInvoker invoker) {
        this(config, invoker, newWorkerPool());
    }

    /**
     * @param config  Configuration (classification defaults, run option defaults)
     * @param invoker Runs individual tasks
     * @param workers Pool tier tasks are submitted to; owned by the engine from now on
     */
    public ValidationEngine(GateConfig config, TaskInvoker invoker, ExecutorService workers) {
        this.classifier = new PriorityClassifier(requireConfig(config));
        this.invoker = invoker;
        this.workers = workers;
        this.scheduler = new ConcurrentTierScheduler(invoker, workers);
        this.fallback = new SequentialFallback(invoker);
        this.defaultOptions = config.execution().toRunOptions();

        log.info("ValidationEngine initialized: {} (timeout cap {}ms, fallback {})",
                config.name(), defaultOptions.timeoutMs(),
                defaultOptions.fallbackToSequential() ? "enabled" : "disabled");
    }

    private static GateConfig requireConfig(GateConfig config) {
        if (config == null) {
            throw new NullPointerException("Config cannot be null");
        }
        return config;
    }

    private static ExecutorService newWorkerPool() {
        AtomicInteger threadCount = new AtomicInteger(0);
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("tiergate-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run tasks with the configured default options.
     */
    public RunSummary execute(List<TaskDescriptor> tasks, Object input) {
        return execute(tasks, input, defaultOptions);
    }

    /**
     * Run tasks.
     *
     * @param tasks   Classified tasks
     * @param input   Event payload, serialized once and written to every validator's stdin
     * @param options Run options
     * @return Run verdict
     * @throws OrchestrationFaultException if orchestration faults and fallback is disabled
     *                                     or the calling thread was interrupted
     * @throws GateException               if orchestration faults and the fallback fails too
     */
    public RunSummary execute(List<TaskDescriptor> tasks, Object input, RunOptions options) {
        if (tasks == null) {
            throw new NullPointerException("Tasks cannot be null");
        }
        if (options == null) {
            throw new NullPointerException("Options cannot be null");
        }

        TaskInput taskInput = TaskInput.of(input);
        long startNanos = System.nanoTime();

        RunSummary summary;
        try {
            summary = scheduler.run(tasks, taskInput, options);
        } catch (RuntimeException e) {
            summary = recover(tasks, taskInput, options, e);
        }

        if (options.verbose()) {
            logSummary(summary, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        }
        return summary;
    }

    /**
     * Classify raw task maps, then run them.
     */
    public RunSummary executeRaw(List<Map<String, Object>> rawTasks, Object input, RunOptions options) {
        return execute(classifier.classifyAll(rawTasks), input, options);
    }

    private RunSummary recover(List<TaskDescriptor> tasks, TaskInput input, RunOptions options,
                               RuntimeException fault) {
        OrchestrationFaultException orchestrationFault = fault instanceof OrchestrationFaultException ofe
                ? ofe
                : new OrchestrationFaultException("Concurrent execution failed: " + fault.getMessage(), fault);

        if (!options.fallbackToSequential()) {
            throw orchestrationFault;
        }
        if (Thread.currentThread().isInterrupted()) {
            // Replaying would only record every task as interrupted
            throw orchestrationFault;
        }

        log.warn("Parallel execution failed, falling back to sequential: {}", orchestrationFault.getMessage());
        try {
            return fallback.runSequential(tasks, input, options);
        } catch (RuntimeException fallbackFailure) {
            log.error("Sequential fallback also failed: {}", fallbackFailure.getMessage());
            GateException fatal = new GateException("Sequential fallback failed after orchestration fault",
                    fallbackFailure);
            fatal.addSuppressed(orchestrationFault);
            throw fatal;
        }
    }

    private void logSummary(RunSummary summary, long wallClockMs) {
        PerformanceStats stats = ResultAggregator.performanceStats(summary);
        log.info("Run finished in {}ms: {} tasks, {} blocked, {} errors, efficiency {}, success rate {}%",
                wallClockMs,
                stats.totalTasks(),
                summary.blocks().size(),
                summary.errors().size(),
                String.format("%.2f", stats.parallelEfficiency()),
                String.format("%.1f", stats.successRate()));
        stats.byTier().forEach((tier, perf) ->
                log.info("  {}: {} tasks, {}ms, {} allowed", tier, perf.count(), perf.durationMs(), perf.success()));
    }

    public PriorityClassifier getClassifier() {
        return classifier;
    }

    public RunOptions getDefaultOptions() {
        return defaultOptions;
    }

    /**
     * Stop the worker pool. Runs in progress are interrupted.
     */
    public void shutdown() {
        log.info("Shutting down ValidationEngine");
        workers.shutdownNow();
        if (ownedInvoker != null) {
            ownedInvoker.close();
        }
    }

    public boolean isShutdown() {
        return workers.isShutdown();
    }

    @Override
    public void close() {
        shutdown();
    }
}
