package com.tiergate;

import com.tiergate.cli.GateCommandLine;
import com.tiergate.config.GateConfig;
import com.tiergate.engine.ValidationEngine;
import com.tiergate.priority.TaskValidator;
import com.tiergate.spring.EnableGate;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Command line application running validator hooks through the engine.
 */
@SpringBootApplication
@EnableGate
public class TiergateApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TiergateApplication.class, args)));
    }

    @Bean
    public GateCommandLine gateCommandLine(GateConfig config, ValidationEngine engine, TaskValidator validator) {
        return new GateCommandLine(config, engine, validator);
    }
}
