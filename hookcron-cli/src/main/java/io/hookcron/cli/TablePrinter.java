package io.hookcron.cli;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Prints rows as left-aligned columns separated by two spaces. Rows are buffered until
 * {@link #print()} so that the column widths fit the longest value.
 */
class TablePrinter
{
    private static final String SEPARATOR = "  ";

    private final PrintStream out;
    private final List<List<String>> rows = new ArrayList<>();

    TablePrinter(PrintStream out)
    {
        this.out = out;
    }

    void row(String... values)
    {
        rows.add(ImmutableList.copyOf(values));
    }

    void print()
    {
        int[] widths = columnWidths();
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>();
            for (int i = 0; i < widths.length; i++) {
                String value = i < row.size() ? row.get(i) : "";
                // the last column is not padded
                cells.add(i == widths.length - 1 ? value : Strings.padEnd(value, widths[i], ' '));
            }
            out.println(Joiner.on(SEPARATOR).join(cells));
        }
    }

    private int[] columnWidths()
    {
        int columns = rows.stream().mapToInt(List::size).max().orElse(0);
        int[] widths = new int[columns];
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }
        return widths;
    }
}
