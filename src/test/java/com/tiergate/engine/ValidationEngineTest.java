package com.tiergate.engine;

import com.tiergate.config.GateConfig;
import com.tiergate.core.Outcome;
import com.tiergate.core.RunOptions;
import com.tiergate.core.RunSummary;
import com.tiergate.core.TaskDescriptor;
import com.tiergate.core.Tier;
import com.tiergate.exception.GateException;
import com.tiergate.exception.OrchestrationFaultException;
import com.tiergate.invoker.TaskInvoker;
import com.tiergate.scheduler.ScriptedInvoker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ValidationEngine.
 */
class ValidationEngineTest {

    private ScriptedInvoker invoker;
    private ValidationEngine engine;

    @BeforeEach
    void setUp() {
        invoker = new ScriptedInvoker();
        engine = new ValidationEngine(GateConfig.defaults(), invoker);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private static TaskDescriptor task(String id, Tier tier) {
        return TaskDescriptor.of(id, tier, TaskDescriptor.UNCLASSIFIED, "validator " + id);
    }

    /**
     * Engine whose worker pool refuses every submission, forcing an orchestration fault.
     */
    private static ValidationEngine faultingEngine(TaskInvoker invoker) {
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdown();
        return new ValidationEngine(GateConfig.defaults(), invoker, closed);
    }

    // ==================== Scenarios ====================

    @Test
    @DisplayName("High block after critical allow stops the medium tier")
    void highBlockScenario() {
        invoker.script("crit", Outcome.ALLOW, 50);
        invoker.script("high", Outcome.BLOCK, 30);
        invoker.script("med", Outcome.ALLOW, 20);

        RunSummary summary = engine.execute(
                List.of(task("crit", Tier.CRITICAL), task("high", Tier.HIGH), task("med", Tier.MEDIUM)), null);

        assertTrue(summary.blocked());
        assertFalse(summary.success());
        assertEquals(2, summary.results().size());
        assertEquals(80, summary.totalDurationMs());
        assertEquals(List.of("crit", "high"), invoker.invoked());
    }

    @Test
    @DisplayName("Five medium allows report their parallel efficiency")
    void parallelEfficiencyScenario() {
        long[] durations = {10, 20, 30, 5, 15};
        List<TaskDescriptor> tasks = new ArrayList<>();
        for (int i = 0; i < durations.length; i++) {
            invoker.script("m" + i, Outcome.ALLOW, durations[i]);
            tasks.add(task("m" + i, Tier.MEDIUM));
        }

        RunSummary summary = engine.execute(tasks, Map.of());

        assertTrue(summary.success());
        assertEquals(5, summary.results().size());
        assertEquals(80, summary.totalDurationMs());
        assertEquals(30, summary.maxDurationMs());
        assertEquals(80.0 / 30.0, summary.parallelEfficiency(), 1e-9);
    }

    @Test
    @DisplayName("Empty task list succeeds with efficiency 1")
    void emptyScenario() {
        RunSummary summary = engine.execute(List.of(), null);

        assertTrue(summary.success());
        assertFalse(summary.blocked());
        assertTrue(summary.results().isEmpty());
        assertEquals(1.0, summary.parallelEfficiency());
    }

    @Test
    @DisplayName("Efficiency is never below 1 when tasks ran")
    void efficiencyAtLeastOne() {
        invoker.script("a", Outcome.ALLOW, 7);
        invoker.script("b", Outcome.FAIL, 3);

        RunSummary summary = engine.execute(List.of(task("a", Tier.LOW), task("b", Tier.BACKGROUND)), null);

        assertTrue(summary.parallelEfficiency() >= 1.0);
    }

    // ==================== Fallback ====================

    @Test
    @DisplayName("Orchestration fault falls back to sequential execution with the same verdict")
    void fallbackOnFault() {
        invoker.script("crit", Outcome.ALLOW, 50);
        invoker.script("high", Outcome.BLOCK, 30);
        invoker.script("med", Outcome.ALLOW, 20);

        try (ValidationEngine faulting = faultingEngine(invoker)) {
            RunSummary summary = faulting.execute(
                    List.of(task("crit", Tier.CRITICAL), task("high", Tier.HIGH), task("med", Tier.MEDIUM)),
                    null, RunOptions.defaults());

            assertTrue(summary.blocked());
            assertEquals(2, summary.results().size());
            assertEquals(80, summary.totalDurationMs());
            assertEquals(1, invoker.maxConcurrent());
        }
    }

    @Test
    @DisplayName("Null task element is handled by the fallback")
    void nullTaskFallsBack() {
        List<TaskDescriptor> tasks = new ArrayList<>();
        tasks.add(task("a", Tier.HIGH));
        tasks.add(null);
        tasks.add(task("b", Tier.LOW));

        RunSummary summary = engine.execute(tasks, null);

        assertTrue(summary.success());
        assertEquals(List.of("a", "b"), invoker.invoked());
    }

    @Test
    @DisplayName("Disabled fallback lets the orchestration fault propagate")
    void faultPropagatesWithoutFallback() {
        try (ValidationEngine faulting = faultingEngine(invoker)) {
            RunOptions options = RunOptions.defaults().withFallbackToSequential(false);

            assertThrows(OrchestrationFaultException.class,
                    () -> faulting.execute(List.of(task("a", Tier.HIGH)), null, options));
            assertTrue(invoker.invoked().isEmpty());
        }
    }

    @Test
    @DisplayName("Failing fallback raises GateException carrying the original fault")
    void fallbackFailure() {
        // Unusable in both the concurrent and the sequential path
        List<TaskDescriptor> poisoned = new ArrayList<>(List.of(task("a", Tier.HIGH))) {
            @Override
            public int size() {
                throw new IllegalStateException("list unusable");
            }
        };

        GateException e = assertThrows(GateException.class,
                () -> engine.execute(poisoned, null, RunOptions.defaults()));

        assertFalse(e instanceof OrchestrationFaultException);
        assertEquals(1, e.getSuppressed().length);
        assertInstanceOf(OrchestrationFaultException.class, e.getSuppressed()[0]);
        assertTrue(invoker.invoked().isEmpty());
    }

    @Test
    @DisplayName("Interrupted run propagates the fault without replaying tasks")
    void interruptedRunSkipsFallback() {
        try (ValidationEngine faulting = faultingEngine(invoker)) {
            Thread.currentThread().interrupt();

            assertThrows(OrchestrationFaultException.class,
                    () -> faulting.execute(List.of(task("a", Tier.HIGH)), null, RunOptions.defaults()));
            assertTrue(invoker.invoked().isEmpty());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    // ==================== Raw tasks ====================

    @Test
    @DisplayName("Raw tasks are classified before they run")
    void executeRaw() {
        invoker.script("guard", Outcome.BLOCK, 10);

        RunSummary summary = engine.executeRaw(List.of(
                Map.of("id", "later", "tier", "low", "command", "x"),
                Map.of("id", "guard", "priority", "CRITICAL", "command", "y")), null, RunOptions.defaults());

        assertTrue(summary.blocked());
        assertEquals(List.of("guard"), invoker.invoked());
        assertEquals(Tier.CRITICAL, summary.results().get(0).tier());
    }

    @Test
    @DisplayName("Null arguments are rejected")
    void nullArguments() {
        assertThrows(NullPointerException.class, () -> engine.execute(null, null));
        assertThrows(NullPointerException.class, () -> engine.execute(List.of(), null, null));

        NullPointerException e = assertThrows(NullPointerException.class, () -> new ValidationEngine(null));
        assertEquals("Config cannot be null", e.getMessage());
        NullPointerException withInvoker = assertThrows(NullPointerException.class,
                () -> new ValidationEngine(null, invoker));
        assertEquals("Config cannot be null", withInvoker.getMessage());
    }

    @Test
    @DisplayName("Null input is delivered as an empty object")
    void nullInputIsEmptyObject() {
        engine.execute(List.of(task("a", Tier.MEDIUM)), null);

        assertEquals(List.of("{}"), invoker.inputs());
    }

    @Test
    @DisplayName("Concurrent runs on one engine do not interfere")
    void concurrentRuns() throws Exception {
        invoker.script("blocker", Outcome.BLOCK, 5);
        List<TaskDescriptor> blocked = List.of(task("blocker", Tier.CRITICAL), task("x", Tier.LOW));
        List<TaskDescriptor> clean = List.of(task("y", Tier.CRITICAL), task("z", Tier.LOW));

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            var first = callers.submit(() -> engine.execute(blocked, null));
            var second = callers.submit(() -> engine.execute(clean, null));

            assertTrue(first.get().blocked());
            assertEquals(1, first.get().results().size());
            assertTrue(second.get().success());
            assertEquals(2, second.get().results().size());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    @DisplayName("Shutdown stops the worker pool")
    void shutdown() {
        engine.shutdown();

        assertTrue(engine.isShutdown());
    }
}
