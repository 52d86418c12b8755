package org.corvo.engine.value;

import org.corvo.engine.error.MalformedCsvException;
import org.corvo.engine.error.TypeMismatchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    @Nested
    @DisplayName("NumberValue")
    class NumberValueTests {

        @ParameterizedTest(name = "{0} displays as {1}")
        @CsvSource({
                "10, 10",
                "2.50, 2.5",
                "-3, -3",
                "0.000, 0",
                "-0.0, 0",
                "1E+3, 1000",
                "0.125, 0.125"
        })
        void canonicalText(String literal, String expected) {
            assertEquals(expected, NumberValue.parse(literal).displayText());
        }

        @Test
        void equalityIgnoresScale() {
            assertEquals(NumberValue.parse("2.0"), NumberValue.of(2));
            assertEquals(NumberValue.parse("2.0").hashCode(), NumberValue.of(2).hashCode());
            assertNotEquals(NumberValue.of(2), NumberValue.parse("2.01"));
        }

        @Test
        void arithmetic() {
            assertEquals(NumberValue.of(8), NumberValue.of(5).plus(NumberValue.of(3)));
            assertEquals(NumberValue.of(-1), NumberValue.of(2).minus(NumberValue.of(3)));
            assertEquals(NumberValue.parse("7.5"), NumberValue.parse("2.5").times(NumberValue.of(3)));
            assertEquals(NumberValue.parse("3.5"), NumberValue.of(7).dividedBy(NumberValue.of(2)));
        }

        @Test
        void repeatingDivisionIsRounded() {
            assertEquals("0.3333333333333333", NumberValue.of(1).dividedBy(NumberValue.of(3)).displayText());
        }

        @Test
        void integralAndTruncation() {
            assertTrue(NumberValue.parse("4.00").isIntegral());
            assertFalse(NumberValue.parse("4.5").isIntegral());
            assertEquals(0, NumberValue.parse("2.9").truncated().compareTo(java.math.BigDecimal.valueOf(2)));
            assertEquals(0, NumberValue.parse("-2.9").truncated().compareTo(java.math.BigDecimal.valueOf(-2)));
        }
    }

    @Nested
    @DisplayName("ListValue")
    class ListValueTests {

        @Test
        void displayQuotesStrings() {
            var list = ListValue.of(NumberValue.of(1), StringValue.of("two"), NumberValue.parse("3.50"));
            assertEquals("[1, \"two\", 3.5]", list.displayText());
            assertEquals("[]", new ListValue().displayText());
        }

        @Test
        void nestedListDisplay() {
            var list = ListValue.of(ListValue.of(NumberValue.of(1)), StringValue.of("x"));
            assertEquals("[[1], \"x\"]", list.displayText());
        }

        @Test
        void removeFirstUsesValueEquality() {
            var list = ListValue.of(NumberValue.of(1), NumberValue.of(2), NumberValue.of(2));
            assertTrue(list.removeFirst(NumberValue.parse("2.0")));
            assertEquals(ListValue.of(NumberValue.of(1), NumberValue.of(2)), list);
            assertFalse(list.removeFirst(StringValue.of("2")));
        }

        @Test
        void snapshotIsUnaffectedByAppend() {
            var list = ListValue.of(NumberValue.of(1));
            var snapshot = list.snapshot();
            list.append(NumberValue.of(2));
            assertEquals(1, snapshot.size());
            assertEquals(2, list.size());
        }

        @Test
        void selfContainingListsCompareAndHash() {
            var a = ListValue.of(NumberValue.of(1));
            a.append(a);
            var b = ListValue.of(NumberValue.of(1));
            b.append(b);
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
            assertEquals("[1, [...]]", a.displayText());
            assertNotEquals(a, ListValue.of(NumberValue.of(1), ListValue.of(NumberValue.of(2))));
        }

        @Test
        void elementsViewIsReadOnly() {
            var list = ListValue.of(NumberValue.of(1));
            assertThrows(UnsupportedOperationException.class, () -> list.elements().add(NumberValue.of(2)));
        }
    }

    @Nested
    @DisplayName("TableValue")
    class TableValueTests {

        private TableValue sample() {
            return new TableValue(List.of(
                    List.of("name", "age"),
                    List.of("Ada", "36"),
                    List.of("Alan", "41")));
        }

        @Test
        void dimensions() {
            var table = sample();
            assertEquals(3, table.rowCount());
            assertEquals(2, table.columnCount());
            assertEquals("Alan", table.cell(2, 0));
        }

        @Test
        void raggedRowsAreRejected() {
            var e = assertThrows(MalformedCsvException.class,
                    () -> new TableValue(List.of(List.of("a", "b"), List.of("c"))));
            assertTrue(e.getMessage().contains("Row 2"), e.getMessage());
        }

        @Test
        void setCellDoesNotLeakIntoCopies() {
            var table = sample();
            var before = table.row(1);
            table.setCell(1, 1, "37");
            assertEquals(List.of("Ada", "36"), before);
            assertEquals("37", table.cell(1, 1));
        }

        @Test
        void column() {
            assertEquals(List.of("age", "36", "41"), sample().column(1));
        }

        @Test
        void tableCannotBeDisplayed() {
            assertThrows(TypeMismatchException.class, () -> sample().displayText());
        }
    }

    @Test
    void kindsAndNone() {
        assertEquals("none", NoneValue.INSTANCE.displayText());
        assertEquals(ValueKind.NONE, NoneValue.INSTANCE.kind());
        assertEquals("Number", NumberValue.of(1).kind().displayName());
        assertEquals("hi", StringValue.of("hi").displayText());
    }
}
