package org.corvo.lang.dsl;

import java.util.List;

/**
 * A parsed program: the ordered top-level statements.
 */
public record CorvoProgram(List<CorvoStatement> statements) {

    public CorvoProgram {
        statements = List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
