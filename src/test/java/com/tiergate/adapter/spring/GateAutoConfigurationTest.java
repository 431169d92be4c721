package com.tiergate.adapter.spring;

import com.tiergate.config.GateConfig;
import com.tiergate.engine.ValidationEngine;
import com.tiergate.exception.ConfigurationException;
import com.tiergate.invoker.ProcessInvoker;
import com.tiergate.invoker.TaskInvoker;
import com.tiergate.priority.PriorityClassifier;
import com.tiergate.priority.TaskValidator;
import com.tiergate.scheduler.ScriptedInvoker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GateAutoConfiguration.
 */
class GateAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(GateAutoConfiguration.class))
            .withPropertyValues("tiergate.config-path=classpath:tiergate-test.yaml");

    @Test
    @DisplayName("Should create the engine beans from the configured file")
    void shouldCreateBeans() {
        contextRunner.run(context -> {
            assertNotNull(context.getBean(GateConfig.class));
            assertEquals("test-gate", context.getBean(GateConfig.class).name());
            assertNotNull(context.getBean(PriorityClassifier.class));
            assertNotNull(context.getBean(TaskValidator.class));
            assertInstanceOf(ProcessInvoker.class, context.getBean(TaskInvoker.class));

            ValidationEngine engine = context.getBean(ValidationEngine.class);
            assertFalse(engine.getDefaultOptions().fallbackToSequential());
            assertEquals(10000, engine.getDefaultOptions().timeoutMs());
        });
    }

    @Test
    @DisplayName("Should shut the engine down with the context")
    void shouldShutDownEngine() {
        ValidationEngine[] holder = new ValidationEngine[1];
        contextRunner.run(context -> holder[0] = context.getBean(ValidationEngine.class));

        assertTrue(holder[0].isShutdown());
    }

    @Test
    @DisplayName("Should back off when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("tiergate.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(ValidationEngine.class).isEmpty()));
    }

    @Test
    @DisplayName("Should use a user-supplied invoker")
    void shouldUseCustomInvoker() {
        contextRunner.withBean(TaskInvoker.class, ScriptedInvoker::new)
                .run(context -> assertInstanceOf(ScriptedInvoker.class, context.getBean(TaskInvoker.class)));
    }

    @Test
    @DisplayName("Should fail startup for a missing configuration file")
    void shouldFailForMissingConfig() {
        contextRunner.withPropertyValues("tiergate.config-path=classpath:missing.yaml")
                .run(context -> {
                    assertNotNull(context.getStartupFailure());
                    Throwable root = context.getStartupFailure();
                    while (root.getCause() != null) {
                        root = root.getCause();
                    }
                    assertInstanceOf(ConfigurationException.class, root);
                });
    }
}
