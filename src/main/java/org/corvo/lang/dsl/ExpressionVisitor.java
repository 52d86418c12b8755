package org.corvo.lang.dsl;

/**
 * Visitor interface for traversing expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitLiteral(Literal literal);

    T visitVariableReference(VariableReference reference);

    /**
     * Visit an arithmetic, comparison or logical operation.
     */
    T visitBinaryOperation(BinaryOperation operation);

    T visitListLiteral(ListLiteral listLiteral);

    /**
     * Visit a 1-based element lookup: list at n.
     */
    T visitIndexAccess(IndexAccess indexAccess);

    T visitListCount(ListCount count);

    T visitTextLength(TextLength length);

    T visitColumnAccess(ColumnAccess columnAccess);

    T visitCellAccess(CellAccess cellAccess);
}
