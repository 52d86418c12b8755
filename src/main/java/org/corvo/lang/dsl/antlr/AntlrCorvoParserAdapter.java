package org.corvo.lang.dsl.antlr;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.corvo.lang.dsl.CorvoParseException;
import org.corvo.lang.dsl.CorvoProgram;

import java.util.Arrays;

/**
 * ANTLR-based Corvo parser using the CorvoGrammar lexer and parser.
 *
 * The first lexer or parser error aborts the parse with a
 * {@link CorvoParseException}, so a program with a syntax error is never
 * partially built.
 */
public final class AntlrCorvoParserAdapter {

    private AntlrCorvoParserAdapter() {
        // Static utility class
    }

    /**
     * Parses Corvo source text into a program.
     *
     * @param source The program text
     * @return The program's statements
     * @throws CorvoParseException if parsing fails
     */
    public static CorvoProgram parse(String source) {
        CorvoGrammarParser.ProgramContext tree = parseTree(source);
        return new CorvoProgramBuilder().buildProgram(tree);
    }

    /**
     * Parses Corvo source text and returns the raw ANTLR parse tree.
     *
     * @param source The program text
     * @return The untyped parse tree
     * @throws CorvoParseException if parsing fails
     */
    public static CorvoGrammarParser.ProgramContext parseTree(String source) {
        CorvoGrammarLexer lexer = new CorvoGrammarLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorListener());

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        CorvoGrammarParser parser = new CorvoGrammarParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ErrorListener());

        return parser.program();
    }

    /**
     * Renders the raw parse tree in LISP form, for debugging grammar changes.
     */
    public static String describe(String source) {
        return parseTree(source).toStringTree(Arrays.asList(CorvoGrammarParser.ruleNames));
    }

    /**
     * Error listener that converts ANTLR errors to CorvoParseException.
     */
    private static class ErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            throw new CorvoParseException(msg, line, charPositionInLine);
        }
    }
}
