package com.tiergate.cli;

import com.tiergate.exception.GateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.util.concurrent.Callable;

/**
 * Base for commands that read a hook document. Input and engine problems are reported
 * on stderr with exit code 1.
 */
abstract class HookCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HookCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILE",
            description = "Input JSON file; stdin when omitted or -")
    String file;

    protected final HookIO io;

    protected HookCommand(HookIO io) {
        this.io = io;
    }

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            return execute(io.read(file), spec.commandLine().getOut());
        } catch (NoSuchFileException e) {
            err.println("Input file not found: " + e.getFile());
        } catch (IOException e) {
            err.println("Failed to read input: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            err.println("Invalid input: " + e.getMessage());
        } catch (GateException e) {
            log.error("Run aborted", e);
            err.println("Run aborted: " + e.getMessage());
        }
        err.flush();
        return GateCommandLine.EXIT_ERROR;
    }

    protected abstract int execute(HookInput input, PrintWriter out) throws IOException;
}
