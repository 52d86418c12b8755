package org.corvo.engine.error;

import org.corvo.lang.dsl.CorvoParseException;

/**
 * Converts failures from parsing or running a program into
 * {@link ErrorReport}s.
 *
 * A stack overflow means the program nests deeper than the interpreter can
 * follow and is reported as {@link ErrorKind#INVALID_ARGUMENT}. Anything else
 * that is not a Corvo error is reported as {@link ErrorKind#INTERNAL} so that
 * callers always get a message instead of a stack trace.
 */
public final class ErrorReporter {

    public static final String TOO_DEEP_MESSAGE =
            "The program nests too deeply to run; split long expressions or deep nesting into steps";

    private ErrorReporter() {
        // Static utility class
    }

    public static ErrorReport report(Throwable failure) {
        if (failure instanceof CorvoParseException parseError) {
            return new ErrorReport(ErrorKind.SYNTAX, parseError.getLine(), parseError.getMessage());
        }
        if (failure instanceof CorvoRuntimeException runtimeError) {
            return new ErrorReport(runtimeError.kind(), runtimeError.getLine(), runtimeError.getMessage());
        }
        if (failure instanceof StackOverflowError) {
            return new ErrorReport(ErrorKind.INVALID_ARGUMENT, -1, TOO_DEEP_MESSAGE);
        }
        String detail = failure.getMessage() != null ? failure.getMessage() : "no details";
        return new ErrorReport(ErrorKind.INTERNAL, -1, failure.getClass().getSimpleName() + ": " + detail);
    }
}
