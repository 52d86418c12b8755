package org.corvo.engine.cli;

import org.corvo.engine.error.ErrorReport;
import org.corvo.engine.execution.CorvoInterpreter;
import org.corvo.engine.execution.InterpreterOptions;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Command-line entry point: runs one Corvo program file.
 *
 * Usage: corvo &lt;program.corvo&gt; [--while-limit=N] [--sandbox]
 *
 * Exit codes: 0 when the program runs to completion, 1 when it ends with a
 * Corvo error (written to standard error), 2 for usage errors or an
 * unreadable program file.
 */
public final class CorvoMain {

    public static final int EXIT_OK = 0;
    public static final int EXIT_PROGRAM_ERROR = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: corvo <program.corvo> [--while-limit=N] [--sandbox]";

    private CorvoMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, System.in));
    }

    /**
     * Runs the command line against the given streams.
     *
     * @return The process exit code
     */
    public static int run(String[] args, PrintStream out, PrintStream err, InputStream in) {
        String programFile = null;
        InterpreterOptions options = InterpreterOptions.defaults();
        Integer whileLimit = null;

        for (String arg : args) {
            if (arg.equals("--sandbox")) {
                options = InterpreterOptions.sandboxed();
            } else if (arg.startsWith("--while-limit=")) {
                String value = arg.substring("--while-limit=".length());
                try {
                    whileLimit = Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    err.println("Invalid while limit: " + value);
                    return EXIT_USAGE;
                }
                if (whileLimit < 0) {
                    err.println("Invalid while limit: " + value);
                    return EXIT_USAGE;
                }
            } else if (arg.startsWith("--")) {
                err.println("Unknown option: " + arg);
                err.println(USAGE);
                return EXIT_USAGE;
            } else if (programFile == null) {
                programFile = arg;
            } else {
                err.println(USAGE);
                return EXIT_USAGE;
            }
        }
        if (programFile == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (whileLimit != null) {
            options = options.withWhileIterationLimit(whileLimit);
        }

        String source;
        try {
            source = Files.readString(Path.of(programFile), StandardCharsets.UTF_8);
        } catch (IOException | InvalidPathException e) {
            err.println("Cannot read program file " + programFile + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        BufferedReader input = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        CorvoInterpreter interpreter = new CorvoInterpreter(options, out, err, input);
        Optional<ErrorReport> error = interpreter.run(source);
        if (error.isPresent()) {
            err.println(error.get().format());
            return EXIT_PROGRAM_ERROR;
        }
        return EXIT_OK;
    }
}
