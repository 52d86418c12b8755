package org.corvo.lang.dsl;

import java.util.List;
import java.util.Objects;

/**
 * Named, parameterless block: section NAME is [ ... ]
 */
public record SectionDefinition(
        String name,
        List<CorvoStatement> body,
        int line) implements CorvoStatement {

    public SectionDefinition {
        Objects.requireNonNull(name, "Section name cannot be null");
        body = List.copyOf(body);
    }

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitSectionDefinition(this);
    }
}
