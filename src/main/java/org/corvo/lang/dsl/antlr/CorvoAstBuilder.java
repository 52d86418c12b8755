package org.corvo.lang.dsl.antlr;

import org.antlr.v4.runtime.Token;
import org.corvo.engine.value.NumberValue;
import org.corvo.engine.value.StringValue;
import org.corvo.lang.dsl.BinaryOperation;
import org.corvo.lang.dsl.BinaryOperator;
import org.corvo.lang.dsl.CellAccess;
import org.corvo.lang.dsl.ColumnAccess;
import org.corvo.lang.dsl.CorvoExpression;
import org.corvo.lang.dsl.CorvoParseException;
import org.corvo.lang.dsl.IndexAccess;
import org.corvo.lang.dsl.ListCount;
import org.corvo.lang.dsl.ListLiteral;
import org.corvo.lang.dsl.Literal;
import org.corvo.lang.dsl.TextLength;
import org.corvo.lang.dsl.VariableReference;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that converts expression and condition parse trees to
 * {@link CorvoExpression} nodes.
 *
 * Grammar structure:
 * - condition: condition AND condition | condition OR condition
 * | expression comparator expression
 * - expression: expression (TIMES | DIVIDED_BY) expression
 * | expression (PLUS | MINUS) expression | primary
 * - primary: literals, list literals, variable references and the built-in
 * accessors (at, count of, length of, get column, get row ... column)
 */
public class CorvoAstBuilder extends CorvoGrammarBaseVisitor<CorvoExpression> {

    // ========================================
    // CONDITIONS
    // ========================================

    @Override
    public CorvoExpression visitAndCondition(CorvoGrammarParser.AndConditionContext ctx) {
        return new BinaryOperation(BinaryOperator.AND, visit(ctx.condition(0)), visit(ctx.condition(1)));
    }

    @Override
    public CorvoExpression visitOrCondition(CorvoGrammarParser.OrConditionContext ctx) {
        return new BinaryOperation(BinaryOperator.OR, visit(ctx.condition(0)), visit(ctx.condition(1)));
    }

    @Override
    public CorvoExpression visitComparison(CorvoGrammarParser.ComparisonContext ctx) {
        CorvoGrammarParser.ComparatorContext comparator = ctx.comparator();
        BinaryOperator op;
        if (comparator.IS_EQUAL_TO() != null) {
            op = BinaryOperator.IS_EQUAL;
        } else if (comparator.IS_GREATER_THAN() != null) {
            op = BinaryOperator.IS_GREATER_THAN;
        } else {
            op = BinaryOperator.IS_LESS_THAN;
        }
        return new BinaryOperation(op, visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    // ========================================
    // ARITHMETIC
    // ========================================

    @Override
    public CorvoExpression visitMultiplicative(CorvoGrammarParser.MultiplicativeContext ctx) {
        BinaryOperator op = ctx.TIMES() != null ? BinaryOperator.TIMES : BinaryOperator.DIVIDE;
        return new BinaryOperation(op, visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public CorvoExpression visitAdditive(CorvoGrammarParser.AdditiveContext ctx) {
        BinaryOperator op = ctx.PLUS() != null ? BinaryOperator.PLUS : BinaryOperator.MINUS;
        return new BinaryOperation(op, visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public CorvoExpression visitPrimaryExpression(CorvoGrammarParser.PrimaryExpressionContext ctx) {
        return visit(ctx.primary());
    }

    // ========================================
    // PRIMARY
    // ========================================

    @Override
    public CorvoExpression visitNumberLiteral(CorvoGrammarParser.NumberLiteralContext ctx) {
        return new Literal(NumberValue.parse(ctx.NUMBER().getText()));
    }

    @Override
    public CorvoExpression visitStringLiteral(CorvoGrammarParser.StringLiteralContext ctx) {
        return new Literal(StringValue.of(unescape(ctx.STRING().getSymbol())));
    }

    @Override
    public CorvoExpression visitListLiteral(CorvoGrammarParser.ListLiteralContext ctx) {
        List<CorvoExpression> elements = new ArrayList<>();
        for (CorvoGrammarParser.ExpressionContext elementCtx : ctx.expression()) {
            elements.add(visit(elementCtx));
        }
        return new ListLiteral(elements);
    }

    @Override
    public CorvoExpression visitVariableReference(CorvoGrammarParser.VariableReferenceContext ctx) {
        return new VariableReference(ctx.IDENTIFIER().getText());
    }

    @Override
    public CorvoExpression visitIndexAccess(CorvoGrammarParser.IndexAccessContext ctx) {
        return new IndexAccess(visit(ctx.primary(0)), visit(ctx.primary(1)));
    }

    @Override
    public CorvoExpression visitCountOf(CorvoGrammarParser.CountOfContext ctx) {
        return new ListCount(visit(ctx.primary()));
    }

    @Override
    public CorvoExpression visitLengthOf(CorvoGrammarParser.LengthOfContext ctx) {
        return new TextLength(visit(ctx.primary()));
    }

    @Override
    public CorvoExpression visitColumnAccess(CorvoGrammarParser.ColumnAccessContext ctx) {
        return new ColumnAccess(visit(ctx.primary()), visit(ctx.expression()));
    }

    @Override
    public CorvoExpression visitCellAccess(CorvoGrammarParser.CellAccessContext ctx) {
        return new CellAccess(visit(ctx.primary()), visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public CorvoExpression visitParenthesized(CorvoGrammarParser.ParenthesizedContext ctx) {
        return visit(ctx.expression());
    }

    /**
     * Strips the surrounding quotes and resolves \" \\ \n \t escapes.
     */
    static String unescape(Token token) {
        String quoted = token.getText();
        String body = quoted.substring(1, quoted.length() - 1);
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case '"', '\\' -> sb.append(next);
                default -> throw new CorvoParseException("unknown escape sequence '\\" + next + "' in " + quoted,
                        token.getLine(), token.getCharPositionInLine());
            }
        }
        return sb.toString();
    }
}
