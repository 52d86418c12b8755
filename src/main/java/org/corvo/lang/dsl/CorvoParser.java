package org.corvo.lang.dsl;

import org.corvo.lang.dsl.antlr.AntlrCorvoParserAdapter;

/**
 * Entry point for turning Corvo source text into a syntax tree.
 *
 * The grammar-driven front end sits behind this single method, so the
 * evaluator only ever sees {@link CorvoProgram}.
 */
public final class CorvoParser {

    private CorvoParser() {
        // Static utility class
    }

    /**
     * Parses a complete program.
     *
     * @param source The program text
     * @return The program's top-level statements
     * @throws CorvoParseException if the text does not match the grammar; no
     *                             part of the program is returned in that case
     */
    public static CorvoProgram parse(String source) {
        return AntlrCorvoParserAdapter.parse(source);
    }
}
