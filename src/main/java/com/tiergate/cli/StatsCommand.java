package com.tiergate.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tiergate.config.GateConfig;
import com.tiergate.priority.CatalogStatistics;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI command: tiergate stats
 */
@Command(name = "stats", mixinStandardHelpOptions = true, exitCodeOnInvalidInput = 1,
        description = "Print task catalog statistics")
class StatsCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    private final GateConfig config;
    private final HookIO io;

    StatsCommand(GateConfig config, HookIO io) {
        this.config = config;
        this.io = io;
    }

    @Override
    public Integer call() throws JsonProcessingException {
        io.print(spec.commandLine().getOut(), CatalogStatistics.of(config));
        return GateCommandLine.EXIT_OK;
    }
}
