package org.corvo.lang.dsl;

/**
 * Sealed interface representing expressions in the Corvo syntax tree.
 *
 * Type hierarchy:
 * CorvoExpression
 * ├── Literal (number or string constant)
 * ├── VariableReference
 * ├── BinaryOperation (arithmetic, comparison, and/or)
 * ├── ListLiteral
 * ├── IndexAccess (list at n)
 * ├── ListCount (count of ...)
 * ├── TextLength (length of ...)
 * ├── ColumnAccess (get column n from table)
 * └── CellAccess (get row r column c from table)
 */
public sealed interface CorvoExpression
        permits Literal, VariableReference, BinaryOperation, ListLiteral, IndexAccess,
        ListCount, TextLength, ColumnAccess, CellAccess {

    <T> T accept(ExpressionVisitor<T> visitor);
}
