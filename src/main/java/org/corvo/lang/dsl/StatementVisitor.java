package org.corvo.lang.dsl;

/**
 * Visitor interface for executing or inspecting statements.
 *
 * @param <T> The return type of the visitor methods
 */
public interface StatementVisitor<T> {

    T visitAssignment(Assignment assignment);

    T visitDisplay(Display display);

    T visitAsk(Ask ask);

    T visitIf(IfStatement ifStatement);

    T visitWhile(WhileLoop whileLoop);

    T visitRepeat(RepeatLoop repeatLoop);

    T visitForEach(ForEachLoop forEachLoop);

    T visitSectionDefinition(SectionDefinition definition);

    T visitSectionCall(SectionCall call);

    T visitListAppend(ListAppend append);

    T visitListRemove(ListRemove remove);

    T visitFileWrite(FileWrite write);

    T visitFileRead(FileRead read);

    T visitCsvRead(CsvRead read);

    T visitCsvWrite(CsvWrite write);

    /**
     * Visit an in-place edit of one table cell.
     */
    T visitCsvSetCell(CsvSetCell setCell);
}
