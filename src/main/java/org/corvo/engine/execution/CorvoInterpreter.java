package org.corvo.engine.execution;

import org.corvo.engine.error.CorvoRuntimeException;
import org.corvo.engine.error.ErrorReport;
import org.corvo.engine.error.ErrorReporter;
import org.corvo.lang.dsl.CorvoParseException;
import org.corvo.lang.dsl.CorvoParser;
import org.corvo.lang.dsl.CorvoProgram;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs Corvo programs: parse, then execute against a fresh
 * {@link Environment}.
 *
 * Every run starts from an empty environment; nothing carries over between
 * runs. Console streams are supplied by the caller.
 */
public final class CorvoInterpreter {

    private final InterpreterOptions options;
    private final PrintStream out;
    private final PrintStream diagnostics;
    private final BufferedReader in;

    public CorvoInterpreter(InterpreterOptions options, PrintStream out, PrintStream diagnostics,
            BufferedReader in) {
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.out = Objects.requireNonNull(out, "Output stream cannot be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "Diagnostics stream cannot be null");
        this.in = Objects.requireNonNull(in, "Input reader cannot be null");
    }

    /**
     * Parses and executes a program.
     *
     * @param source The program text
     * @return The environment as the program left it
     * @throws CorvoParseException   if the program does not parse; nothing runs
     * @throws CorvoRuntimeException if a statement fails; the run stops there
     */
    public Environment execute(String source) {
        return execute(CorvoParser.parse(source));
    }

    /**
     * Executes an already parsed program.
     */
    public Environment execute(CorvoProgram program) {
        Environment environment = new Environment();
        StatementExecutor executor = new StatementExecutor(environment, options, out, diagnostics, in);
        try {
            executor.executeAll(program.statements());
        } finally {
            out.flush();
        }
        return environment;
    }

    /**
     * Parses and executes a program, reporting any failure instead of
     * throwing it.
     *
     * @return The error that ended the run, or empty on success
     */
    public Optional<ErrorReport> run(String source) {
        try {
            execute(source);
            return Optional.empty();
        } catch (RuntimeException | StackOverflowError e) {
            return Optional.of(ErrorReporter.report(e));
        }
    }

    /**
     * Runs a program with output and warnings captured in memory and no
     * standard input.
     */
    public static CapturedRun runCaptured(String source, InterpreterOptions options) {
        ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
        ByteArrayOutputStream diagnosticsBuffer = new ByteArrayOutputStream();
        try (PrintStream capturedOut = new PrintStream(outBuffer, true, StandardCharsets.UTF_8);
                PrintStream capturedDiagnostics = new PrintStream(diagnosticsBuffer, true, StandardCharsets.UTF_8)) {
            CorvoInterpreter interpreter = new CorvoInterpreter(options, capturedOut, capturedDiagnostics,
                    new BufferedReader(new StringReader("")));
            Optional<ErrorReport> error = interpreter.run(source);
            return new CapturedRun(
                    outBuffer.toString(StandardCharsets.UTF_8),
                    diagnosticsBuffer.toString(StandardCharsets.UTF_8),
                    error);
        }
    }
}
