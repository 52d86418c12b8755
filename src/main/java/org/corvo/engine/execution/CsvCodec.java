package org.corvo.engine.execution;

import org.corvo.engine.error.MalformedCsvException;
import org.corvo.engine.value.TableValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Plain comma-separated text to and from {@link TableValue}.
 *
 * One row per line, cells split on every comma, no quoting. A trailing line
 * break ends the last row rather than starting an empty one, and a carriage
 * return before a line break is dropped. Cells that contain a comma or a
 * line break are rejected on write since they could not be read back.
 */
public final class CsvCodec {

    private CsvCodec() {
        // Static utility class
    }

    /**
     * @throws MalformedCsvException if rows have differing column counts
     */
    public static TableValue parse(String text) {
        List<List<String>> rows = new ArrayList<>();
        if (text.isEmpty()) {
            return new TableValue(rows);
        }
        String[] lines = text.split("\n", -1);
        int lineCount = lines[lines.length - 1].isEmpty() ? lines.length - 1 : lines.length;
        for (int i = 0; i < lineCount; i++) {
            String line = lines[i];
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            rows.add(Arrays.asList(line.split(",", -1)));
        }
        return new TableValue(rows);
    }

    /**
     * Renders each row as comma-joined cells followed by a line break.
     *
     * @throws MalformedCsvException if a cell contains a comma or line break
     */
    public static String format(TableValue table) {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < table.rowCount(); r++) {
            for (int c = 0; c < table.columnCount(); c++) {
                String cell = table.cell(r, c);
                if (cell.indexOf(',') >= 0 || cell.indexOf('\n') >= 0 || cell.indexOf('\r') >= 0) {
                    throw new MalformedCsvException("Cell at row " + (r + 1) + ", column " + (c + 1)
                            + " contains a comma or line break and cannot be written as CSV: \"" + cell + "\"");
                }
                if (c > 0) {
                    sb.append(',');
                }
                sb.append(cell);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
