package com.tiergate.cli;

import com.tiergate.config.GateConfig;
import com.tiergate.engine.ValidationEngine;
import com.tiergate.priority.TaskValidator;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import picocli.CommandLine;

import java.io.InputStream;
import java.io.PrintWriter;
import java.util.Arrays;

/**
 * Bridges picocli with the Spring Boot lifecycle.
 *
 * <pre>
 * tiergate [run] [FILE]     run the hooks and print the summary
 * tiergate classify [FILE]  print the hooks grouped by tier
 * tiergate validate [FILE]  print a validation report per hook
 * tiergate stats            print task catalog statistics
 * </pre>
 *
 * Output is JSON on stdout; diagnostics go to stderr.
 */
public class GateCommandLine implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_BLOCKED = 2;

    private final GateConfig config;
    private final ValidationEngine engine;
    private final TaskValidator validator;
    private int exitCode;

    public GateCommandLine(GateConfig config, ValidationEngine engine, TaskValidator validator) {
        this.config = config;
        this.engine = engine;
        this.validator = validator;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args, System.in, new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Parse and run one command.
     *
     * @return Process exit code
     */
    public int execute(String[] args, InputStream in, PrintWriter out, PrintWriter err) {
        HookIO io = new HookIO(in);
        CommandLine commandLine = new CommandLine(new GateCommand(engine, io))
                .addSubcommand(new RunCommand(engine, io))
                .addSubcommand(new ClassifyCommand(engine.getClassifier(), io))
                .addSubcommand(new ValidateCommand(validator, io))
                .addSubcommand(new StatsCommand(config, io));
        commandLine.setOut(out);
        commandLine.setErr(err);
        return commandLine.execute(withoutSpringProperties(args));
    }

    /**
     * Drop {@code --some.property=value} arguments; Spring Boot consumes those.
     */
    private static String[] withoutSpringProperties(String[] args) {
        return Arrays.stream(args)
                .filter(arg -> !(arg.startsWith("--") && arg.contains(".") && arg.contains("=")))
                .toArray(String[]::new);
    }
}
