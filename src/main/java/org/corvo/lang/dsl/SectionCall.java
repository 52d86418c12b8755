package org.corvo.lang.dsl;

/**
 * Runs a previously defined section: NAME
 */
public record SectionCall(
        String name,
        int line) implements CorvoStatement {

    @Override
    public <T> T accept(StatementVisitor<T> visitor) {
        return visitor.visitSectionCall(this);
    }
}
