package org.corvo.engine.execution;

import org.corvo.engine.error.InvalidArgumentException;
import org.corvo.engine.error.InvalidIndexException;
import org.corvo.engine.error.TypeMismatchException;
import org.corvo.engine.value.ListValue;
import org.corvo.engine.value.NumberValue;
import org.corvo.engine.value.StringValue;
import org.corvo.engine.value.TableValue;
import org.corvo.engine.value.Value;
import org.corvo.lang.dsl.BinaryOperation;
import org.corvo.lang.dsl.BinaryOperator;
import org.corvo.lang.dsl.CellAccess;
import org.corvo.lang.dsl.ColumnAccess;
import org.corvo.lang.dsl.CorvoExpression;
import org.corvo.lang.dsl.ExpressionVisitor;
import org.corvo.lang.dsl.IndexAccess;
import org.corvo.lang.dsl.ListCount;
import org.corvo.lang.dsl.ListLiteral;
import org.corvo.lang.dsl.Literal;
import org.corvo.lang.dsl.TextLength;
import org.corvo.lang.dsl.VariableReference;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates expressions against an {@link Environment}.
 *
 * Two entry points:
 * - {@link #evaluate(CorvoExpression)} for anything that produces a value
 * - {@link #test(CorvoExpression)} for the conditions of if and while
 *
 * Comparisons and and/or only exist as conditions; using one where a value
 * is expected is a type mismatch. All positions (at, row, column) are
 * 1-based.
 */
public final class ExpressionEvaluator implements ExpressionVisitor<Value> {

    private final Environment environment;

    public ExpressionEvaluator(Environment environment) {
        this.environment = environment;
    }

    public Value evaluate(CorvoExpression expression) {
        return expression.accept(this);
    }

    /**
     * Evaluates a condition. and/or short-circuit.
     *
     * @throws TypeMismatchException if the expression is not a condition, or
     *                               its operands cannot be compared
     */
    public boolean test(CorvoExpression condition) {
        if (!(condition instanceof BinaryOperation operation) || !operation.operator().isCondition()) {
            throw new TypeMismatchException("Expected a condition such as 'x is greater than 3' but found "
                    + describe(condition));
        }
        switch (operation.operator()) {
            case AND:
                return test(operation.left()) && test(operation.right());
            case OR:
                return test(operation.left()) || test(operation.right());
            default:
                return compare(operation.operator(), evaluate(operation.left()), evaluate(operation.right()));
        }
    }

    // ========================================
    // OPERATORS
    // ========================================

    @Override
    public Value visitBinaryOperation(BinaryOperation operation) {
        BinaryOperator op = operation.operator();
        if (op.isCondition()) {
            throw new TypeMismatchException("'" + op.keyword()
                    + "' can only be used in the condition of an if or while");
        }
        Value left = evaluate(operation.left());
        Value right = evaluate(operation.right());

        if (op == BinaryOperator.PLUS && (left instanceof StringValue || right instanceof StringValue)) {
            return StringValue.of(left.displayText() + right.displayText());
        }
        NumberValue l = requireNumber(op, left, right, left);
        NumberValue r = requireNumber(op, left, right, right);
        switch (op) {
            case PLUS:
                return l.plus(r);
            case MINUS:
                return l.minus(r);
            case TIMES:
                return l.times(r);
            case DIVIDE:
                if (r.isZero()) {
                    throw new InvalidArgumentException("Cannot divide " + l.displayText() + " by zero");
                }
                return l.dividedBy(r);
            default:
                throw new IllegalStateException("Unhandled operator: " + op);
        }
    }

    private static NumberValue requireNumber(BinaryOperator op, Value left, Value right, Value operand) {
        if (operand instanceof NumberValue number) {
            return number;
        }
        throw new TypeMismatchException("Cannot use '" + op.keyword() + "' with "
                + left.kind().displayName() + " and " + right.kind().displayName());
    }

    private static boolean compare(BinaryOperator op, Value left, Value right) {
        int order;
        if (left instanceof NumberValue l && right instanceof NumberValue r) {
            order = l.compareTo(r);
        } else if (left instanceof StringValue l && right instanceof StringValue r) {
            order = l.value().compareTo(r.value());
        } else {
            throw new TypeMismatchException("Cannot compare " + left.kind().displayName() + " with "
                    + right.kind().displayName() + " using '" + op.keyword() + "'");
        }
        switch (op) {
            case IS_EQUAL:
                return order == 0;
            case IS_GREATER_THAN:
                return order > 0;
            case IS_LESS_THAN:
                return order < 0;
            default:
                throw new IllegalStateException("Not a comparison: " + op);
        }
    }

    // ========================================
    // VALUES
    // ========================================

    @Override
    public Value visitLiteral(Literal literal) {
        return literal.value();
    }

    @Override
    public Value visitVariableReference(VariableReference reference) {
        return environment.lookup(reference.name());
    }

    @Override
    public Value visitListLiteral(ListLiteral listLiteral) {
        List<Value> elements = new ArrayList<>(listLiteral.elements().size());
        for (CorvoExpression element : listLiteral.elements()) {
            elements.add(evaluate(element));
        }
        return new ListValue(elements);
    }

    // ========================================
    // LIST AND TABLE ACCESS
    // ========================================

    @Override
    public Value visitIndexAccess(IndexAccess indexAccess) {
        Value source = evaluate(indexAccess.source());
        Value index = evaluate(indexAccess.index());
        if (source instanceof ListValue list) {
            return list.get(position(index, list.size(), "position", "the list"));
        }
        if (source instanceof TableValue table) {
            return ListValue.ofStrings(table.row(position(index, table.rowCount(), "row", "the table")));
        }
        throw new TypeMismatchException("'at' needs a List or Table but found " + source.kind().displayName());
    }

    @Override
    public Value visitListCount(ListCount count) {
        Value source = evaluate(count.source());
        if (source instanceof ListValue list) {
            return NumberValue.of(list.size());
        }
        if (source instanceof TableValue table) {
            return NumberValue.of(table.rowCount());
        }
        throw new TypeMismatchException("'count of' needs a List or Table but found "
                + source.kind().displayName());
    }

    @Override
    public Value visitTextLength(TextLength length) {
        String text = evaluate(length.operand()).displayText();
        return NumberValue.of(text.codePointCount(0, text.length()));
    }

    @Override
    public Value visitColumnAccess(ColumnAccess columnAccess) {
        TableValue table = requireTable(evaluate(columnAccess.table()), "get column");
        int column = position(evaluate(columnAccess.column()), table.columnCount(), "column", "the table");
        return ListValue.ofStrings(table.column(column));
    }

    @Override
    public Value visitCellAccess(CellAccess cellAccess) {
        TableValue table = requireTable(evaluate(cellAccess.table()), "get row ... column");
        int row = position(evaluate(cellAccess.row()), table.rowCount(), "row", "the table");
        int column = position(evaluate(cellAccess.column()), table.columnCount(), "column", "the table");
        return StringValue.of(table.cell(row, column));
    }

    static TableValue requireTable(Value value, String construct) {
        if (value instanceof TableValue table) {
            return table;
        }
        throw new TypeMismatchException("'" + construct + "' needs a Table but found " + value.kind().displayName());
    }

    /**
     * Converts a 1-based position into a 0-based index.
     *
     * @param index  The position value
     * @param size   Number of valid positions
     * @param what   Name of the position for messages (row, column, ...)
     * @param holder Name of the container for messages
     * @throws TypeMismatchException if the position is not a Number
     * @throws InvalidIndexException if it is not a whole number in 1..size
     */
    static int position(Value index, int size, String what, String holder) {
        if (!(index instanceof NumberValue number)) {
            throw new TypeMismatchException("A " + what + " must be a Number but found "
                    + index.kind().displayName());
        }
        if (!number.isIntegral()) {
            throw new InvalidIndexException(capitalize(what) + " " + number.displayText() + " is not a whole number");
        }
        if (number.compareTo(NumberValue.of(1)) < 0 || number.compareTo(NumberValue.of(size)) > 0) {
            String valid = size == 0 ? ", which is empty" : " (1 to " + size + ")";
            throw new InvalidIndexException(capitalize(what) + " " + number.displayText()
                    + " is out of range for " + holder + valid);
        }
        return number.value().intValue() - 1;
    }

    private static String capitalize(String word) {
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    private static String describe(CorvoExpression expression) {
        if (expression instanceof Literal literal) {
            return "the value " + literal.value();
        }
        if (expression instanceof VariableReference reference) {
            return "the variable '" + reference.name() + "'";
        }
        return "an expression";
    }
}
