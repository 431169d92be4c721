package com.tiergate.cli;

import com.tiergate.priority.PriorityClassifier;
import com.tiergate.priority.TierGroups;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * CLI command: tiergate classify [FILE]
 */
@Command(name = "classify", mixinStandardHelpOptions = true, exitCodeOnInvalidInput = 1,
        description = "Print the hooks grouped by tier")
class ClassifyCommand extends HookCommand {

    private final PriorityClassifier classifier;

    ClassifyCommand(PriorityClassifier classifier, HookIO io) {
        super(io);
        this.classifier = classifier;
    }

    @Override
    protected int execute(HookInput input, PrintWriter out) throws IOException {
        io.print(out, TierGroups.partition(classifier.classifyAll(input.hooks())).asLabelMap());
        return GateCommandLine.EXIT_OK;
    }
}
