package org.corvo.engine.execution;

import org.corvo.engine.error.ErrorKind;
import org.corvo.engine.error.ErrorReport;
import org.corvo.engine.value.NumberValue;
import org.corvo.engine.value.StringValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs small programs end to end and checks what they display.
 */
class StatementExecutorTest {

    private static CapturedRun run(String source) {
        return CorvoInterpreter.runCaptured(source, InterpreterOptions.defaults());
    }

    private static String[] lines(String source) {
        CapturedRun run = run(source);
        assertTrue(run.succeeded(), () -> "Program failed: " + run.error().orElseThrow().format());
        return run.outputLines();
    }

    private static ErrorReport failure(String source) {
        CapturedRun run = run(source);
        assertFalse(run.succeeded(), "Expected the program to fail");
        return run.error().orElseThrow();
    }

    @Nested
    @DisplayName("Variables and display")
    class VariableTests {

        @Test
        void assignAndDisplay() {
            assertArrayEquals(new String[]{"8", "Hello World"}, lines("""
                    the total is 5 plus 3
                    display total
                    the greeting is "Hello" plus " " plus "World"
                    display greeting
                    """));
        }

        @Test
        void reassignmentReplacesKind() {
            assertArrayEquals(new String[]{"[1, 2]"}, lines("""
                    the x is "text"
                    the x is [1, 2]
                    display x
                    """));
        }

        @Test
        void undefinedVariableStopsTheRun() {
            var error = failure("""
                    display "before"
                    display total
                    display "after"
                    """);
            assertEquals(ErrorKind.UNDEFINED_VARIABLE, error.kind());
            assertEquals(2, error.line());
            assertEquals("Undefined variable on line 2: 'total' has not been given a value yet", error.format());
            assertArrayEquals(new String[]{"before"}, run("display \"before\"\ndisplay total").outputLines());
        }

        @Test
        void executeReturnsFinalEnvironment() {
            var out = new ByteArrayOutputStream();
            var interpreter = new CorvoInterpreter(InterpreterOptions.defaults(),
                    new PrintStream(out, true, StandardCharsets.UTF_8), System.err,
                    new BufferedReader(new StringReader("")));
            Environment environment = interpreter.execute("the a is 2\nthe b is a times a");
            assertEquals(NumberValue.of(4), environment.lookup("b"));
        }
    }

    @Nested
    @DisplayName("Conditionals")
    class ConditionalTests {

        @Test
        void otherwiseBranch() {
            assertArrayEquals(new String[]{"minor"}, lines("""
                    the age is 12
                    if age is greater than 17 then : [
                        display "adult"
                    ] otherwise : [
                        display "minor"
                    ]
                    """));
        }

        @Test
        void noBranchTaken() {
            assertEquals(0, lines("if 1 is greater than 2 then display \"never\"").length);
        }
    }

    @Nested
    @DisplayName("Loops")
    class LoopTests {

        @Test
        void repeatRunsBodyNTimes() {
            assertArrayEquals(new String[]{"Hi", "Hi", "Hi"}, lines("repeat 3 loops display \"Hi\""));
            assertEquals(0, lines("repeat 0 loops display \"Hi\"").length);
        }

        @Test
        void repeatTruncatesFractions() {
            assertEquals(2, lines("repeat 2.7 loops display \"x\"").length);
        }

        @Test
        void repeatRejectsNegativeAndText() {
            assertEquals(ErrorKind.INVALID_ARGUMENT, failure("repeat -1 loops display \"x\"").kind());
            assertEquals(ErrorKind.TYPE_MISMATCH, failure("repeat \"3\" loops display \"x\"").kind());
        }

        @Test
        void whileLoop() {
            assertArrayEquals(new String[]{"0", "1", "2"}, lines("""
                    the i is 0
                    while i is less than 3 do : [
                        display i
                        the i is i plus 1
                    ]
                    """));
        }

        @Test
        void whileLimitWarnsAndContinues() {
            CapturedRun run = CorvoInterpreter.runCaptured("""
                    the i is 0
                    while i is less than 100 do : [
                        the i is i plus 1
                    ]
                    display i
                    """, InterpreterOptions.defaults().withWhileIterationLimit(5));
            assertTrue(run.succeeded());
            assertArrayEquals(new String[]{"5"}, run.outputLines());
            assertTrue(run.diagnostics().contains("while loop on line 2 stopped after 5 iterations"),
                    run.diagnostics());
        }

        @Test
        void forEachSeesElementsPresentAtEntry() {
            assertArrayEquals(new String[]{"1", "2", "3", "6"}, lines("""
                    the nums is [1, 2, 3]
                    for each n in nums : [
                        append n to nums
                        display n
                    ]
                    display count of nums
                    """));
        }

        @Test
        void forEachItemIsLocalButOtherAssignmentsPersist() {
            assertArrayEquals(new String[]{"6", "3"}, lines("""
                    the total is 0
                    for each n in [1, 2, 3] : [
                        the total is total plus n
                        the last is n
                    ]
                    display total
                    display last
                    """));
            var error = failure("for each n in [1] display n\ndisplay n");
            assertEquals(ErrorKind.UNDEFINED_VARIABLE, error.kind());
            assertEquals(2, error.line());
        }

        @Test
        void forEachNeedsAList() {
            assertEquals(ErrorKind.TYPE_MISMATCH, failure("for each c in \"abc\" display c").kind());
        }

        @Test
        void errorInsideLoopReportsInnermostLine() {
            var error = failure("""
                    the nums is [1, 0]
                    for each n in nums : [
                        display 10 divided by n
                    ]
                    """);
            assertEquals(ErrorKind.INVALID_ARGUMENT, error.kind());
            assertEquals(3, error.line());
        }
    }

    @Nested
    @DisplayName("Sections")
    class SectionTests {

        @Test
        void defineAndCall() {
            assertArrayEquals(new String[]{"Hello", "Hello"}, lines("""
                    section greet is : [
                        display "Hello"
                    ]
                    greet
                    greet
                    """));
        }

        @Test
        void sectionsShareVariables() {
            assertArrayEquals(new String[]{"2"}, lines("""
                    section bump is [ the counter is counter plus 1 ]
                    the counter is 0
                    bump
                    bump
                    display counter
                    """));
        }

        @Test
        void laterDefinitionWins() {
            assertArrayEquals(new String[]{"one", "two"}, lines("""
                    section say is [ display "one" ]
                    say
                    section say is [ display "two" ]
                    say
                    """));
        }

        @Test
        void callBeforeDefinitionFails() {
            var error = failure("greet\nsection greet is [ display \"hi\" ]");
            assertEquals(ErrorKind.UNDEFINED_SECTION, error.kind());
            assertEquals(1, error.line());
        }

        @Test
        void runawayRecursionIsReported() {
            var error = failure("section forever is [ forever ]\nforever");
            assertEquals(ErrorKind.INVALID_ARGUMENT, error.kind());
            assertTrue(error.message().contains("'forever'"), error.message());
        }
    }

    @Nested
    @DisplayName("Lists")
    class ListTests {

        @Test
        void appendAndRemove() {
            assertArrayEquals(new String[]{"[1, 3, 4]"}, lines("""
                    the nums is [1, 2, 3]
                    append 4 to nums
                    remove 2 from nums
                    display nums
                    """));
        }

        @Test
        void removeOnlyFirstMatch() {
            assertArrayEquals(new String[]{"[\"b\", \"a\"]"}, lines("""
                    the letters is ["a", "b", "a"]
                    remove "a" from letters
                    display letters
                    """));
        }

        @Test
        void removeMissingValue() {
            var error = failure("the nums is [1]\nremove 5 from nums");
            assertEquals(ErrorKind.INVALID_ARGUMENT, error.kind());
            assertEquals(2, error.line());
        }

        @Test
        void appendToUnassignedName() {
            assertEquals(ErrorKind.UNDEFINED_VARIABLE, failure("append 1 to nums").kind());
        }

        @Test
        void appendToText() {
            assertEquals(ErrorKind.TYPE_MISMATCH, failure("the s is \"abc\"\nappend 1 to s").kind());
        }

        @Test
        void listContainingItself() {
            assertArrayEquals(new String[]{"[1, [...]]", "x[1, [...]]", "2", "[1]"}, lines("""
                    the a is [1]
                    append a to a
                    display a
                    display "x" plus a
                    display count of a
                    remove a from a
                    display a
                    """));
        }

        @Test
        void removeMissingValueFromListContainingItself() {
            var error = failure("""
                    the a is [1]
                    append a to a
                    remove [5] from a
                    """);
            assertEquals(ErrorKind.INVALID_ARGUMENT, error.kind());
            assertEquals(3, error.line());
            assertTrue(error.message().endsWith("[1, [...]]"), error.message());
        }

        @Test
        void assignmentSharesTheList() {
            assertArrayEquals(new String[]{"[1, 2]"}, lines("""
                    the a is [1]
                    the b is a
                    append 2 to b
                    display a
                    """));
        }
    }

    @Nested
    @DisplayName("Ask")
    class AskTests {

        private String runWithInput(String source, String input) {
            var out = new ByteArrayOutputStream();
            var interpreter = new CorvoInterpreter(InterpreterOptions.defaults(),
                    new PrintStream(out, true, StandardCharsets.UTF_8), System.err,
                    new BufferedReader(new StringReader(input)));
            interpreter.execute(source);
            return out.toString(StandardCharsets.UTF_8);
        }

        @Test
        void storesStrippedAnswer() {
            String output = runWithInput("ask \"Name? \" remember as name\ndisplay \"Hello \" plus name",
                    "  Ada  \n");
            assertEquals("Name? Hello Ada", output.strip());
        }

        @Test
        void answerIsAlwaysText() {
            var out = new ByteArrayOutputStream();
            var interpreter = new CorvoInterpreter(InterpreterOptions.defaults(),
                    new PrintStream(out, true, StandardCharsets.UTF_8), System.err,
                    new BufferedReader(new StringReader("42\n")));
            Environment environment = interpreter.execute("ask \"Age? \" remember as age");
            assertEquals(StringValue.of("42"), environment.lookup("age"));
        }

        @Test
        void noInputLeft() {
            assertEquals(ErrorKind.FILE_ACCESS, failure("ask \"Name? \" remember as name").kind());
        }

        @Test
        void promptMustBeText() {
            assertEquals(ErrorKind.TYPE_MISMATCH, failure("ask 5 remember as name").kind());
        }
    }

    @Test
    @DisplayName("Expressions nested beyond the stack are reported, not thrown")
    void deeplyNestedExpression() {
        var error = failure("display 1" + " plus 1".repeat(200_000));
        assertEquals(ErrorKind.INVALID_ARGUMENT, error.kind());
        assertTrue(error.message().contains("nests too deeply"), error.message());
    }

    @Test
    @DisplayName("Every run starts from an empty environment")
    void runsAreIndependent() {
        assertTrue(run("the x is 1").succeeded());
        assertEquals(ErrorKind.UNDEFINED_VARIABLE, failure("display x").kind());
    }
}
