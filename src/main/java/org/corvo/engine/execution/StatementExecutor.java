package org.corvo.engine.execution;

import org.corvo.engine.error.CorvoRuntimeException;
import org.corvo.engine.error.ErrorReporter;
import org.corvo.engine.error.FileAccessException;
import org.corvo.engine.error.InvalidArgumentException;
import org.corvo.engine.error.TypeMismatchException;
import org.corvo.engine.value.ListValue;
import org.corvo.engine.value.NumberValue;
import org.corvo.engine.value.StringValue;
import org.corvo.engine.value.TableValue;
import org.corvo.engine.value.Value;
import org.corvo.lang.dsl.Ask;
import org.corvo.lang.dsl.Assignment;
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
import org.corvo.lang.dsl.StatementVisitor;
import org.corvo.lang.dsl.WhileLoop;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.List;

/**
 * Executes statements in order against one {@link Environment}.
 *
 * Any failure aborts the current statement and, by propagating, every
 * enclosing block up to the program boundary. The line of the innermost
 * failing statement is recorded on the exception on the way out.
 */
public final class StatementExecutor implements StatementVisitor<Void> {

    /**
     * Nesting limit for section calls, so that a section calling itself
     * fails with a Corvo error instead of exhausting the Java stack.
     */
    public static final int MAX_SECTION_DEPTH = 1000;

    private final InterpreterOptions options;
    private final PrintStream out;
    private final PrintStream diagnostics;
    private final BufferedReader in;
    private final ProgramFiles files;

    private Environment environment;
    private ExpressionEvaluator evaluator;
    private int sectionDepth;

    public StatementExecutor(Environment environment, InterpreterOptions options,
            PrintStream out, PrintStream diagnostics, BufferedReader in) {
        this.options = options;
        this.out = out;
        this.diagnostics = diagnostics;
        this.in = in;
        this.files = new ProgramFiles(options);
        enterScope(environment);
    }

    /**
     * Runs statements in order, stopping at the first failure.
     */
    public void executeAll(List<CorvoStatement> statements) {
        for (CorvoStatement statement : statements) {
            execute(statement);
        }
    }

    public void execute(CorvoStatement statement) {
        try {
            statement.accept(this);
        } catch (CorvoRuntimeException e) {
            throw e.atLine(statement.line());
        } catch (StackOverflowError e) {
            throw new InvalidArgumentException(ErrorReporter.TOO_DEEP_MESSAGE).atLine(statement.line());
        }
    }

    private void enterScope(Environment scope) {
        this.environment = scope;
        this.evaluator = new ExpressionEvaluator(scope);
    }

    // ========================================
    // VARIABLES AND CONSOLE
    // ========================================

    @Override
    public Void visitAssignment(Assignment assignment) {
        environment.assign(assignment.name(), evaluator.evaluate(assignment.value()));
        return null;
    }

    @Override
    public Void visitDisplay(Display display) {
        out.println(evaluator.evaluate(display.value()).displayText());
        return null;
    }

    @Override
    public Void visitAsk(Ask ask) {
        String prompt = requireString(evaluator.evaluate(ask.prompt()), "ask");
        out.print(prompt);
        out.flush();
        String answer;
        try {
            answer = in.readLine();
        } catch (IOException e) {
            throw new FileAccessException("Cannot read the answer to \"" + prompt + "\": " + e.getMessage(), e);
        }
        if (answer == null) {
            throw new FileAccessException("No input left to answer \"" + prompt + "\"");
        }
        environment.assign(ask.target(), StringValue.of(answer.strip()));
        return null;
    }

    // ========================================
    // CONTROL FLOW
    // ========================================

    @Override
    public Void visitIf(IfStatement ifStatement) {
        if (evaluator.test(ifStatement.condition())) {
            executeAll(ifStatement.thenBlock());
        } else {
            executeAll(ifStatement.elseBlock());
        }
        return null;
    }

    @Override
    public Void visitWhile(WhileLoop whileLoop) {
        long iterations = 0;
        while (evaluator.test(whileLoop.condition())) {
            if (options.hasWhileLimit() && iterations >= options.whileIterationLimit()) {
                diagnostics.println("Warning: while loop on line " + whileLoop.line() + " stopped after "
                        + options.whileIterationLimit() + " iterations");
                break;
            }
            executeAll(whileLoop.body());
            iterations++;
        }
        return null;
    }

    @Override
    public Void visitRepeat(RepeatLoop repeatLoop) {
        Value count = evaluator.evaluate(repeatLoop.count());
        if (!(count instanceof NumberValue number)) {
            throw new TypeMismatchException("'repeat' needs a Number of times but found "
                    + count.kind().displayName());
        }
        if (number.isNegative()) {
            throw new InvalidArgumentException("Cannot repeat " + number.displayText() + " times");
        }
        BigDecimal times = number.truncated();
        if (times.compareTo(BigDecimal.valueOf(Long.MAX_VALUE)) > 0) {
            throw new InvalidArgumentException("Cannot repeat " + number.displayText() + " times");
        }
        long limit = times.longValue();
        for (long i = 0; i < limit; i++) {
            executeAll(repeatLoop.body());
        }
        return null;
    }

    @Override
    public Void visitForEach(ForEachLoop forEachLoop) {
        Value source = evaluator.evaluate(forEachLoop.list());
        if (!(source instanceof ListValue list)) {
            throw new TypeMismatchException("'for each' needs a List but found " + source.kind().displayName());
        }
        // iterate over the elements present at loop entry
        List<Value> elements = list.snapshot();
        Environment outer = environment;
        Environment loopScope = outer.newLoopScope();
        enterScope(loopScope);
        try {
            for (Value element : elements) {
                loopScope.define(forEachLoop.itemName(), element);
                executeAll(forEachLoop.body());
            }
        } finally {
            enterScope(outer);
        }
        return null;
    }

    @Override
    public Void visitSectionDefinition(SectionDefinition definition) {
        environment.defineSection(definition.name(), definition.body());
        return null;
    }

    @Override
    public Void visitSectionCall(SectionCall call) {
        List<CorvoStatement> body = environment.section(call.name());
        if (sectionDepth >= MAX_SECTION_DEPTH) {
            throw new InvalidArgumentException("Section '" + call.name() + "' is nested more than "
                    + MAX_SECTION_DEPTH + " calls deep; does it call itself forever?");
        }
        sectionDepth++;
        try {
            executeAll(body);
        } finally {
            sectionDepth--;
        }
        return null;
    }

    // ========================================
    // LISTS
    // ========================================

    @Override
    public Void visitListAppend(ListAppend append) {
        ListValue list = requireList(evaluator.evaluate(append.list()), "append");
        list.append(evaluator.evaluate(append.value()));
        return null;
    }

    @Override
    public Void visitListRemove(ListRemove remove) {
        ListValue list = requireList(evaluator.evaluate(remove.list()), "remove");
        Value value = evaluator.evaluate(remove.value());
        if (!list.removeFirst(value)) {
            throw new InvalidArgumentException("Cannot remove " + value + " because it is not in the list "
                    + list.displayText());
        }
        return null;
    }

    // ========================================
    // FILES AND CSV
    // ========================================

    @Override
    public Void visitFileWrite(FileWrite write) {
        // content is fully converted before the file is opened
        String content = evaluator.evaluate(write.content()).displayText();
        String path = requireString(evaluator.evaluate(write.path()), "write ... to");
        files.writeText(path, content);
        return null;
    }

    @Override
    public Void visitFileRead(FileRead read) {
        String path = requireString(evaluator.evaluate(read.path()), "read from");
        environment.assign(read.target(), StringValue.of(files.readText(path)));
        return null;
    }

    @Override
    public Void visitCsvRead(CsvRead read) {
        String path = requireString(evaluator.evaluate(read.path()), "read csv");
        environment.assign(read.target(), CsvCodec.parse(files.readText(path)));
        return null;
    }

    @Override
    public Void visitCsvWrite(CsvWrite write) {
        TableValue table = ExpressionEvaluator.requireTable(evaluator.evaluate(write.table()), "write ... to csv");
        String path = requireString(evaluator.evaluate(write.path()), "write ... to csv");
        files.writeText(path, CsvCodec.format(table));
        return null;
    }

    @Override
    public Void visitCsvSetCell(CsvSetCell setCell) {
        TableValue table = ExpressionEvaluator.requireTable(evaluator.evaluate(setCell.table()), "set ... row");
        Value row = evaluator.evaluate(setCell.row());
        Value column = evaluator.evaluate(setCell.column());
        String content = evaluator.evaluate(setCell.value()).displayText();
        table.setCell(
                ExpressionEvaluator.position(row, table.rowCount(), "row", "the table"),
                ExpressionEvaluator.position(column, table.columnCount(), "column", "the table"),
                content);
        return null;
    }

    private static String requireString(Value value, String construct) {
        if (value instanceof StringValue string) {
            return string.value();
        }
        throw new TypeMismatchException("'" + construct + "' needs a String but found " + value.kind().displayName());
    }

    private static ListValue requireList(Value value, String construct) {
        if (value instanceof ListValue list) {
            return list;
        }
        throw new TypeMismatchException("'" + construct + "' needs a List but found " + value.kind().displayName());
    }
}
