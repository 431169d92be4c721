package com.tiergate.cli;

import com.tiergate.core.RunSummary;
import com.tiergate.engine.ValidationEngine;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * CLI command: tiergate run [FILE]
 * <p>
 * Classifies and runs the hooks, prints the run summary. Exit 2 when blocked, 1 when a
 * hook failed or timed out, 0 otherwise.
 */
@Command(name = "run", mixinStandardHelpOptions = true, exitCodeOnInvalidInput = 1,
        description = "Run the hooks and print the summary")
class RunCommand extends HookCommand {

    private final ValidationEngine engine;

    RunCommand(ValidationEngine engine, HookIO io) {
        super(io);
        this.engine = engine;
    }

    @Override
    protected int execute(HookInput input, PrintWriter out) throws IOException {
        return runHooks(engine, io, input, out);
    }

    static int runHooks(ValidationEngine engine, HookIO io, HookInput input, PrintWriter out) throws IOException {
        RunSummary summary = engine.executeRaw(input.hooks(), input.data(), engine.getDefaultOptions());
        io.print(out, summary);
        if (summary.blocked()) {
            return GateCommandLine.EXIT_BLOCKED;
        }
        return summary.hasFailures() ? GateCommandLine.EXIT_ERROR : GateCommandLine.EXIT_OK;
    }
}
