package com.tiergate.adapter.spring;

import com.tiergate.config.ConfigLoader;
import com.tiergate.config.GateConfig;
import com.tiergate.engine.ValidationEngine;
import com.tiergate.invoker.ProcessInvoker;
import com.tiergate.invoker.TaskInvoker;
import com.tiergate.priority.PriorityClassifier;
import com.tiergate.priority.TaskValidator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for Tiergate.
 */
@Configuration
@ConditionalOnProperty(prefix = "tiergate", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(GateProperties.class)
public class GateAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GateAutoConfiguration.class);

    private ValidationEngine validationEngine;
    private ProcessInvoker processInvoker;

    @Bean
    @ConditionalOnMissingBean
    public GateConfig gateConfig(GateProperties properties) {
        log.info("Loading Tiergate configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public PriorityClassifier priorityClassifier(GateConfig config) {
        return new PriorityClassifier(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskInvoker taskInvoker(GateConfig config) {
        this.processInvoker = new ProcessInvoker(config.execution());
        return this.processInvoker;
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskValidator taskValidator(GateConfig config, PriorityClassifier classifier) {
        return new TaskValidator(config, classifier);
    }

    @Bean
    @ConditionalOnMissingBean
    public ValidationEngine validationEngine(GateConfig config, TaskInvoker taskInvoker) {
        log.info("Creating ValidationEngine: {}", config.name());
        this.validationEngine = new ValidationEngine(config, taskInvoker);
        return this.validationEngine;
    }

    @PreDestroy
    public void shutdown() {
        if (validationEngine != null && !validationEngine.isShutdown()) {
            validationEngine.shutdown();
        }
        if (processInvoker != null) {
            processInvoker.close();
        }
    }
}
