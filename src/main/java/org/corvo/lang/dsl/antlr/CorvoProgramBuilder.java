package org.corvo.lang.dsl.antlr;

import org.antlr.v4.runtime.ParserRuleContext;
import org.corvo.lang.dsl.Ask;
import org.corvo.lang.dsl.Assignment;
import org.corvo.lang.dsl.CorvoExpression;
import org.corvo.lang.dsl.CorvoProgram;
import org.corvo.lang.dsl.CorvoStatement;
import org.corvo.lang.dsl.CsvRead;
import org.corvo.lang.dsl.CsvSetCell;
import org.corvo.lang.dsl.CsvWrite;
import org.corvo.lang.dsl.Display;
import org.corvo.lang.dsl.FileRead;
import org.corvo.lang.dsl.FileWrite;
import org.corvo.lang.dsl.ForEachLoop;
import org.corvo.lang.dsl.IfStatement;
import org.corvo.lang.dsl.ListAppend;
import org.corvo.lang.dsl.ListRemove;
import org.corvo.lang.dsl.RepeatLoop;
import org.corvo.lang.dsl.SectionCall;
import org.corvo.lang.dsl.SectionDefinition;
import org.corvo.lang.dsl.WhileLoop;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that builds {@link CorvoStatement} nodes from the parse tree.
 *
 * Performs shape normalization only:
 * - bracket blocks become ordered statement lists
 * - the single-line form of a body becomes a one-statement list, so
 * "repeat 3 loops display x" and "repeat 3 loops : [ display x ]" build the
 * same RepeatLoop
 * - expressions and conditions are delegated to {@link CorvoAstBuilder}
 */
public class CorvoProgramBuilder extends CorvoGrammarBaseVisitor<CorvoStatement> {

    private final CorvoAstBuilder expressions = new CorvoAstBuilder();

    /**
     * Builds the top-level statement sequence.
     */
    public CorvoProgram buildProgram(CorvoGrammarParser.ProgramContext ctx) {
        return new CorvoProgram(buildStatements(ctx.statement()));
    }

    private List<CorvoStatement> buildStatements(List<CorvoGrammarParser.StatementContext> contexts) {
        List<CorvoStatement> statements = new ArrayList<>(contexts.size());
        for (CorvoGrammarParser.StatementContext statementCtx : contexts) {
            statements.add(visit(statementCtx));
        }
        return statements;
    }

    private List<CorvoStatement> buildBlock(CorvoGrammarParser.BlockContext ctx) {
        return buildStatements(ctx.statement());
    }

    private List<CorvoStatement> buildBody(CorvoGrammarParser.BodyContext ctx) {
        if (ctx.block() != null) {
            return buildBlock(ctx.block());
        }
        return List.of(visit(ctx.statement()));
    }

    private CorvoExpression expression(ParserRuleContext ctx) {
        return expressions.visit(ctx);
    }

    private static int line(ParserRuleContext ctx) {
        return ctx.getStart().getLine();
    }

    @Override
    public CorvoStatement visitStatement(CorvoGrammarParser.StatementContext ctx) {
        // statement is a pure alternation; its single child is the concrete form
        return visit(ctx.getChild(0));
    }

    // ========================================
    // VARIABLES AND CONSOLE
    // ========================================

    @Override
    public CorvoStatement visitAssignment(CorvoGrammarParser.AssignmentContext ctx) {
        return new Assignment(ctx.IDENTIFIER().getText(), expression(ctx.expression()), line(ctx));
    }

    @Override
    public CorvoStatement visitDisplay(CorvoGrammarParser.DisplayContext ctx) {
        return new Display(expression(ctx.expression()), line(ctx));
    }

    @Override
    public CorvoStatement visitAsk(CorvoGrammarParser.AskContext ctx) {
        return new Ask(expression(ctx.expression()), ctx.IDENTIFIER().getText(), line(ctx));
    }

    // ========================================
    // CONTROL FLOW
    // ========================================

    @Override
    public CorvoStatement visitConditional(CorvoGrammarParser.ConditionalContext ctx) {
        List<CorvoStatement> thenBlock = buildBody(ctx.body(0));
        List<CorvoStatement> elseBlock = ctx.OTHERWISE() != null ? buildBody(ctx.body(1)) : List.of();
        return new IfStatement(expression(ctx.condition()), thenBlock, elseBlock, line(ctx));
    }

    @Override
    public CorvoStatement visitRepeatLoop(CorvoGrammarParser.RepeatLoopContext ctx) {
        return new RepeatLoop(expression(ctx.expression()), buildBody(ctx.body()), line(ctx));
    }

    @Override
    public CorvoStatement visitWhileLoop(CorvoGrammarParser.WhileLoopContext ctx) {
        return new WhileLoop(expression(ctx.condition()), buildBody(ctx.body()), line(ctx));
    }

    @Override
    public CorvoStatement visitForEachLoop(CorvoGrammarParser.ForEachLoopContext ctx) {
        return new ForEachLoop(ctx.IDENTIFIER().getText(), expression(ctx.expression()),
                buildBody(ctx.body()), line(ctx));
    }

    @Override
    public CorvoStatement visitSectionDefinition(CorvoGrammarParser.SectionDefinitionContext ctx) {
        return new SectionDefinition(ctx.IDENTIFIER().getText(), buildBlock(ctx.block()), line(ctx));
    }

    @Override
    public CorvoStatement visitSectionCall(CorvoGrammarParser.SectionCallContext ctx) {
        return new SectionCall(ctx.IDENTIFIER().getText(), line(ctx));
    }

    // ========================================
    // LISTS
    // ========================================

    @Override
    public CorvoStatement visitListAppend(CorvoGrammarParser.ListAppendContext ctx) {
        // append VALUE to LIST
        return new ListAppend(expression(ctx.expression(1)), expression(ctx.expression(0)), line(ctx));
    }

    @Override
    public CorvoStatement visitListRemove(CorvoGrammarParser.ListRemoveContext ctx) {
        // remove VALUE from LIST
        return new ListRemove(expression(ctx.expression(1)), expression(ctx.expression(0)), line(ctx));
    }

    // ========================================
    // FILES AND CSV
    // ========================================

    @Override
    public CorvoStatement visitFileWrite(CorvoGrammarParser.FileWriteContext ctx) {
        return new FileWrite(expression(ctx.expression(0)), expression(ctx.expression(1)), line(ctx));
    }

    @Override
    public CorvoStatement visitFileRead(CorvoGrammarParser.FileReadContext ctx) {
        return new FileRead(expression(ctx.expression()), ctx.IDENTIFIER().getText(), line(ctx));
    }

    @Override
    public CorvoStatement visitCsvRead(CorvoGrammarParser.CsvReadContext ctx) {
        return new CsvRead(expression(ctx.expression()), ctx.IDENTIFIER().getText(), line(ctx));
    }

    @Override
    public CorvoStatement visitCsvWrite(CorvoGrammarParser.CsvWriteContext ctx) {
        return new CsvWrite(expression(ctx.expression(0)), expression(ctx.expression(1)), line(ctx));
    }

    @Override
    public CorvoStatement visitCsvSetCell(CorvoGrammarParser.CsvSetCellContext ctx) {
        return new CsvSetCell(
                expression(ctx.expression(0)),
                expression(ctx.expression(1)),
                expression(ctx.expression(2)),
                expression(ctx.expression(3)),
                line(ctx));
    }
}
