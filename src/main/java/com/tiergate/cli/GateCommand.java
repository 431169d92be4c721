package com.tiergate.cli;

import com.tiergate.engine.ValidationEngine;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Top-level CLI command. Without a subcommand it behaves like {@code run}.
 */
@Command(
        name = "tiergate",
        mixinStandardHelpOptions = true,
        version = "Tiergate 1.0.0",
        exitCodeOnInvalidInput = 1,
        description = "Runs validator hooks by priority tier and prints the verdict as JSON"
)
class GateCommand extends HookCommand {

    private final ValidationEngine engine;

    GateCommand(ValidationEngine engine, HookIO io) {
        super(io);
        this.engine = engine;
    }

    @Override
    protected int execute(HookInput input, PrintWriter out) throws IOException {
        return RunCommand.runHooks(engine, io, input, out);
    }
}
