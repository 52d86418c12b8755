package org.corvo.lang.dsl;

/**
 * Sealed interface representing statements of a Corvo program.
 *
 * Statements are built once by the tree builder and never change afterwards.
 * Every nested body (if, loops, sections) is an ordered list of statements,
 * whether it was written in block form or single-line form.
 */
public sealed interface CorvoStatement
        permits Assignment, Display, Ask, IfStatement, WhileLoop, RepeatLoop, ForEachLoop,
        SectionDefinition, SectionCall, ListAppend, ListRemove, FileWrite, FileRead,
        CsvRead, CsvWrite, CsvSetCell {

    /**
     * @return The 1-based source line the statement starts on
     */
    int line();

    <T> T accept(StatementVisitor<T> visitor);
}
