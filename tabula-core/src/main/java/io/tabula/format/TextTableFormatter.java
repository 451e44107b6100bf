package io.tabula.format;

import io.tabula.core.TabulaConfiguration;
import io.tabula.frame.Series;
import io.tabula.frame.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a table as aligned plain text:
 * <pre>
 * name | value
 * -----|------
 * A    | 10
 * B    | 20
 * </pre>
 * Column widths fit the header and every value of the column, including rows beyond the limit.
 * Reads the table only.
 */
public final class TextTableFormatter {

    private static final String COLUMN_SEPARATOR = " | ";
    private static final String RULE_SEPARATOR = "-|-";

    private final int defaultRows;

    public TextTableFormatter() {
        this(TabulaConfiguration.defaults());
    }

    public TextTableFormatter(TabulaConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.defaultRows = configuration.displayRows();
    }

    public String format(Table table) {
        return format(table, defaultRows);
    }

    /**
     * @param maxRows number of rows to render; 0 or more than the table holds renders every row
     */
    public String format(Table table, int maxRows) {
        if (table == null) {
            throw new IllegalArgumentException("table required");
        }
        if (maxRows < 0) {
            throw new IllegalArgumentException("maxRows must not be negative");
        }
        List<String> names = table.columnNames();
        List<Series> columns = new ArrayList<>(names.size());
        int[] widths = new int[names.size()];
        for (int c = 0; c < names.size(); c++) {
            Series series = table.column(names.get(c));
            columns.add(series);
            int width = names.get(c).length();
            for (int r = 0; r < series.length(); r++) {
                width = Math.max(width, series.values().get(r).toString().length());
            }
            widths[c] = width;
        }

        int rows = maxRows == 0 ? table.length() : Math.min(maxRows, table.length());
        StringBuilder out = new StringBuilder();
        appendLine(out, names, widths, COLUMN_SEPARATOR);
        List<String> rules = new ArrayList<>(names.size());
        for (int width : widths) {
            rules.add("-".repeat(width));
        }
        appendLine(out, rules, widths, RULE_SEPARATOR);
        for (int r = 0; r < rows; r++) {
            List<String> cells = new ArrayList<>(columns.size());
            for (Series series : columns) {
                cells.add(series.values().get(r).toString());
            }
            appendLine(out, cells, widths, COLUMN_SEPARATOR);
        }
        return out.toString();
    }

    private static void appendLine(StringBuilder out, List<String> cells, int[] widths, String separator) {
        for (int c = 0; c < cells.size(); c++) {
            if (c > 0) {
                out.append(separator);
            }
            String cell = cells.get(c);
            out.append(cell).append(" ".repeat(widths[c] - cell.length()));
        }
        out.append('\n');
    }
}
