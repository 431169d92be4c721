package com.tiergate.cli;

import com.tiergate.priority.TaskValidator;
import com.tiergate.priority.ValidationReport;
import picocli.CommandLine.Command;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

/**
 * CLI command: tiergate validate [FILE]
 * <p>
 * Prints one report per hook. Exit 1 if any hook is invalid.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, exitCodeOnInvalidInput = 1,
        description = "Check hook definitions")
class ValidateCommand extends HookCommand {

    private final TaskValidator validator;

    ValidateCommand(TaskValidator validator, HookIO io) {
        super(io);
        this.validator = validator;
    }

    @Override
    protected int execute(HookInput input, PrintWriter out) throws IOException {
        List<ValidationReport> reports = validator.validateAll(input.hooks());
        io.print(out, reports);
        return reports.stream().allMatch(ValidationReport::valid)
                ? GateCommandLine.EXIT_OK
                : GateCommandLine.EXIT_ERROR;
    }
}
