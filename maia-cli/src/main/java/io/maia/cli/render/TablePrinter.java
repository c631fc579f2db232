package io.maia.cli.render;

import java.util.List;
import java.util.Map;

/**
 * Prints rows of named cells as separator-delimited lines. Cells missing from a row print as empty fields.
 */
public final class TablePrinter {

    private TablePrinter() {
    }

    public static void print(StringBuilder out, List<String> columns, List<Map<String, String>> rows,
                             boolean header, String separator) {
        if (header) {
            out.append(String.join(separator, columns)).append('\n');
        }
        for (Map<String, String> row : rows) {
            for (int i = 0; i < columns.size(); i++) {
                if (i > 0) {
                    out.append(separator);
                }
                var value = row.get(columns.get(i));
                if (value != null) {
                    out.append(value);
                }
            }
            out.append('\n');
        }
    }
}
