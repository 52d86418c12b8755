package org.corvo.engine.value;

import org.corvo.engine.error.MalformedCsvException;
import org.corvo.engine.error.TypeMismatchException;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory CSV data: a rectangular grid of String cells.
 *
 * Every row has {@link #columnCount()} cells. Cell edits replace a cell in
 * place and never change the shape of the table. Indices are 0-based here.
 */
public final class TableValue implements Value {

    private final List<List<String>> rows;
    private final int columnCount;

    /**
     * Creates a table from rows of cells.
     *
     * @param rows The rows, each an ordered list of cells
     * @throws MalformedCsvException if rows have differing column counts
     */
    public TableValue(List<List<String>> rows) {
        this.rows = new ArrayList<>(rows.size());
        int width = rows.isEmpty() ? 0 : rows.get(0).size();
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            if (row.size() != width) {
                throw new MalformedCsvException("Row " + (i + 1) + " has " + row.size()
                        + " columns but row 1 has " + width);
            }
            this.rows.add(new ArrayList<>(row));
        }
        this.columnCount = width;
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columnCount;
    }

    public String cell(int row, int column) {
        return rows.get(row).get(column);
    }

    public void setCell(int row, int column, String content) {
        rows.get(row).set(column, content);
    }

    /**
     * @return Copy of the given row
     */
    public List<String> row(int row) {
        return List.copyOf(rows.get(row));
    }

    /**
     * @return The cells of the given column, top to bottom
     */
    public List<String> column(int column) {
        List<String> cells = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            cells.add(row.get(column));
        }
        return cells;
    }

    /**
     * @return Deep copy of all rows
     */
    public List<List<String>> rows() {
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copy.add(List.copyOf(row));
        }
        return copy;
    }

    @Override
    public ValueKind kind() {
        return ValueKind.TABLE;
    }

    @Override
    public String displayText() {
        throw new TypeMismatchException(
                "A Table cannot be displayed directly; use 'get column' or 'get row ... column' first");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TableValue other && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return rows.hashCode();
    }

    @Override
    public String toString() {
        return "Table(" + rows.size() + "x" + columnCount + ")";
    }
}
