package com.tiergate.invoker;

import com.tiergate.config.ExecutionConfig;
import com.tiergate.core.ExecutionResult;
import com.tiergate.core.Outcome;
import com.tiergate.core.RunOptions;
import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.TaskInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a task as an external process.
 *
 * <p>The serialized input is written once to the child's stdin, which is then closed.
 * Stdout and stderr are drained concurrently and kept as text. The verdict comes only from
 * the exit code (see {@link ExitCodeConvention}).
 *
 * <p>On timeout the process and its descendants receive a graceful termination signal,
 * get {@code killGraceMs} to exit, and are then killed forcibly. The child is reaped before
 * the result is returned.
 */
public class ProcessInvoker implements TaskInvoker, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessInvoker.class);

    private final File workingDirectory;
    private final long killGraceMs;
    private final ExecutorService ioPool;

    public ProcessInvoker() {
        this(ExecutionConfig.defaults());
    }

    public ProcessInvoker(ExecutionConfig config) {
        this(config.workingDirectory() != null ? new File(config.workingDirectory()) : null,
                config.killGraceMs());
    }

    public ProcessInvoker(File workingDirectory, long killGraceMs) {
        if (killGraceMs < 0) {
            throw new IllegalArgumentException("killGraceMs must not be negative: " + killGraceMs);
        }
        this.workingDirectory = workingDirectory;
        this.killGraceMs = killGraceMs;

        AtomicInteger threadCount = new AtomicInteger(0);
        this.ioPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("tiergate-io-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ExecutionResult invoke(TaskDescriptor task, TaskInput input, RunOptions options) {
        long startNanos = System.nanoTime();

        if (!task.hasCommand()) {
            log.warn("Task {} has no command", task.id());
            return ExecutionResult.failed(task, 0, "No command specified");
        }

        List<String> command;
        try {
            command = CommandTokenizer.tokenize(task.command());
        } catch (IllegalArgumentException e) {
            log.warn("Task {} has a malformed command: {}", task.id(), e.getMessage());
            return ExecutionResult.failed(task, elapsedMs(startNanos), "Invalid command: " + e.getMessage());
        }

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            if (workingDirectory != null) {
                builder.directory(workingDirectory);
            }
            process = builder.start();
        } catch (IOException | RuntimeException e) {
            long duration = elapsedMs(startNanos);
            log.warn("Task {} failed to start: {}", task.id(), e.getMessage());
            return ExecutionResult.failed(task, duration, "Failed to start: " + e.getMessage());
        }

        long timeoutMs = options.effectiveTimeoutMs(task);
        progress(options, "Spawned task {} (pid {}, timeout {}ms)", task.id(), process.pid(), timeoutMs);

        StreamCollector stdout = new StreamCollector(process.getInputStream(), task.id() + " stdout");
        StreamCollector stderr = new StreamCollector(process.getErrorStream(), task.id() + " stderr");
        Future<?> stdoutReader;
        Future<?> stderrReader;
        try {
            ioPool.submit(() -> writeInput(process, input, task));
            stdoutReader = ioPool.submit(stdout);
            stderrReader = ioPool.submit(stderr);
        } catch (RejectedExecutionException e) {
            terminate(process);
            log.error("Invoker is closed, task {} not run", task.id());
            return ExecutionResult.failed(task, elapsedMs(startNanos), "Invoker is closed");
        }

        try {
            boolean exited = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!exited) {
                terminate(process);
                long duration = elapsedMs(startNanos);
                awaitReader(stdoutReader, task);
                awaitReader(stderrReader, task);
                progress(options, "Task {} timed out after {}ms", task.id(), duration);
                return ExecutionResult.timedOut(task, timeoutMs, duration, stdout.text(), stderr.text());
            }

            long duration = elapsedMs(startNanos);
            int exitCode = process.exitValue();
            awaitReader(stdoutReader, task);
            awaitReader(stderrReader, task);

            Outcome outcome = ExitCodeConvention.decode(exitCode);
            progress(options, "Task {} completed in {}ms (exit: {}, outcome: {})",
                    task.id(), duration, exitCode, outcome.label());
            return ExecutionResult.exited(task, outcome, exitCode, duration, stdout.text(), stderr.text());

        } catch (InterruptedException e) {
            destroyTree(process, true);
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for task {}", task.id());
            return ExecutionResult.failed(task, elapsedMs(startNanos), "Interrupted while waiting for task");
        }
    }

    private void writeInput(Process process, TaskInput input, TaskDescriptor task) {
        try (OutputStream stdin = process.getOutputStream()) {
            input.writeTo(stdin);
        } catch (IOException e) {
            // Child exited or closed stdin without reading; the exit code still decides
            log.debug("Could not write input to task {}: {}", task.id(), e.getMessage());
        }
    }

    /**
     * Graceful termination, then force kill after the grace period. Covers descendants
     * so nothing started by the task outlives it.
     */
    private void terminate(Process process) {
        List<ProcessHandle> descendants = destroyTree(process, false);

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(killGraceMs);
        boolean exited = awaitExit(process.toHandle(), deadline);
        if (!exited) {
            log.debug("Process {} ignored termination, killing", process.pid());
            // Children started during the grace period are missing from the first snapshot
            List<ProcessHandle> late = process.descendants().toList();
            process.destroyForcibly();
            late.forEach(ProcessHandle::destroyForcibly);
        }
        for (ProcessHandle descendant : descendants) {
            if (!awaitExit(descendant, deadline)) {
                descendant.destroyForcibly();
            }
        }

        // Reap
        awaitExit(process.toHandle(), System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(killGraceMs));
    }

    /**
     * Signal the process and every descendant.
     *
     * @return Descendants captured before the parent was signalled
     */
    private List<ProcessHandle> destroyTree(Process process, boolean forcibly) {
        List<ProcessHandle> descendants = process.descendants().toList();
        if (forcibly) {
            process.destroyForcibly();
            descendants.forEach(ProcessHandle::destroyForcibly);
        } else {
            process.destroy();
            descendants.forEach(ProcessHandle::destroy);
        }
        return descendants;
    }

    private boolean awaitExit(ProcessHandle handle, long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            return !handle.isAlive();
        }
        try {
            handle.onExit().get(remaining, TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException | ExecutionException e) {
            return !handle.isAlive();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !handle.isAlive();
        }
    }

    /**
     * Wait for a stream reader to reach end-of-file. A descendant that inherited the pipe
     * can keep it open, so the wait is bounded by the kill grace period.
     */
    private void awaitReader(Future<?> reader, TaskDescriptor task) throws InterruptedException {
        try {
            reader.get(Math.max(killGraceMs, 1), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            reader.cancel(true);
            log.debug("Output of task {} still open after exit, keeping what was read", task.id());
        } catch (ExecutionException e) {
            log.debug("Output reader for task {} failed: {}", task.id(), e.getCause().getMessage());
        }
    }

    private void progress(RunOptions options, String format, Object... args) {
        if (options.verbose()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    @Override
    public void close() {
        ioPool.shutdownNow();
    }
}
