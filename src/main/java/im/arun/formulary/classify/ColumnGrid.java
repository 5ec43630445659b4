package im.arun.formulary.classify;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Column layout a data line is read against. Columns span the header cell (or the cell
 * of the first data line when the table has no header) from its left to its right edge.
 */
public final class ColumnGrid {
    private final List<Column> columns;
    private final boolean implicit;

    private ColumnGrid(List<Column> columns, boolean implicit) {
        this.columns = Collections.unmodifiableList(columns);
        this.implicit = implicit;
    }

    /**
     * Grid taken from a column header line; repeated labels get a numeric suffix.
     */
    public static ColumnGrid fromHeader(TextLine headerLine) {
        List<Column> columns = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        for (TextCell cell : headerLine.getCells()) {
            String label = cell.getText().trim();
            int occurrence = seen.merge(label, 1, Integer::sum);
            String name = occurrence == 1 ? label : label + " " + occurrence;
            columns.add(new Column(name, cell.getX(), cell.getEndX()));
        }
        return new ColumnGrid(columns, false);
    }

    /**
     * Grid inferred from the first data line of a table printed without a header.
     */
    public static ColumnGrid implicitFrom(TextLine dataLine) {
        List<Column> columns = new ArrayList<>();
        int index = 1;
        for (TextCell cell : dataLine.getCells()) {
            columns.add(new Column("Column " + index++, cell.getX(), cell.getEndX()));
        }
        return new ColumnGrid(columns, true);
    }

    public List<Column> getColumns() {
        return columns;
    }

    public boolean isImplicit() {
        return implicit;
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.getName());
        }
        return names;
    }

    /**
     * Reads a data line into column/value pairs.
     *
     * @param line      data line
     * @param tolerance how far (points) a cell may start left of its column anchor, or
     *                  right of the end of its column label
     * @param lenient   coerce misaligned cells instead of rejecting the line
     * @return the parsed row, or the reason the line does not fit this grid
     */
    public RowParse parse(TextLine line, float tolerance, boolean lenient) {
        List<TextCell> cells = line.getCells();
        if (!lenient && cells.size() > columns.size()) {
            return RowParse.rejected(cells.size() + " cells for " + columns.size() + " columns");
        }

        String[] values = new String[columns.size()];
        for (TextCell cell : cells) {
            String text = cell.getText().trim();
            int index = columnIndexFor(cell.getX(), tolerance);
            if (index < 0) {
                if (!lenient) {
                    return RowParse.rejected("cell '" + text + "' starts left of column '" + columns.get(0).getName() + "'");
                }
                index = 0;
            } else if (!lenient && !columns.get(index).accepts(cell.getX(), tolerance)) {
                return RowParse.rejected(String.format(Locale.ROOT, "cell '%s' at x=%.1f lies outside column '%s' (%.1f-%.1f)",
                    text, cell.getX(), columns.get(index).getName(), columns.get(index).getX(), columns.get(index).getEndX()));
            }
            if (values[index] != null) {
                if (!lenient) {
                    return RowParse.rejected("cells '" + values[index] + "' and '" + text
                        + "' both fall into column '" + columns.get(index).getName() + "'");
                }
                values[index] = values[index] + " " + text;
            } else {
                values[index] = text;
            }
        }

        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i).getName(), values[i] == null ? "" : values[i]);
        }
        return RowParse.accepted(row);
    }

    private int columnIndexFor(float x, float tolerance) {
        int index = -1;
        for (int i = 0; i < columns.size(); i++) {
            if (x >= columns.get(i).getX() - tolerance) {
                index = i;
            }
        }
        return index;
    }

    @Value
    public static class Column {
        String name;
        float x;
        float endX;

        /**
         * Whether a cell starting at {@code cellX} sits under this column. Numbers are often
         * right-aligned, so the right bound is the end of the label rather than its start.
         */
        boolean accepts(float cellX, float tolerance) {
            return cellX >= x - tolerance && cellX <= endX + tolerance;
        }
    }

    /**
     * Outcome of reading one line against the grid.
     */
    @Value
    public static class RowParse {
        Map<String, String> row;
        String problem;

        static RowParse accepted(Map<String, String> row) {
            return new RowParse(row, null);
        }

        static RowParse rejected(String problem) {
            return new RowParse(null, problem);
        }

        public boolean isAccepted() {
            return row != null;
        }
    }
}
