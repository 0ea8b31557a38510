package io.emzed.storage;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the visible columns of a table as left aligned text.
 */
final class TablePrinter {

    private static final int MIN_WIDTH = 8;

    private final Table table;

    TablePrinter(Table table) {
        this.table = table;
    }

    String render(int maxLines) {
        List<Integer> visible = new ArrayList<>();
        List<String> formats = table.getColFormats();
        for (int i = 0; i < formats.size(); i++) {
            if (formats.get(i) != null) {
                visible.add(i);
            }
        }
        List<String> names = table.getColNames();
        List<Class<?>> types = table.getColTypes();

        int[] widths = new int[visible.size()];
        for (int k = 0; k < visible.size(); k++) {
            int column = visible.get(k);
            int width = Math.max(MIN_WIDTH, names.get(column).length());
            for (int row = 0; row < table.numRows(); row++) {
                String cell = table.formatValue(column, table.row(row).get(column));
                width = Math.max(width, cell == null ? 1 : cell.length());
            }
            widths[k] = width;
        }

        StringBuilder out = new StringBuilder();
        List<String> header = new ArrayList<>();
        List<String> typeNames = new ArrayList<>();
        List<String> rule = new ArrayList<>();
        for (int column : visible) {
            header.add(names.get(column));
            typeNames.add(types.get(column).getSimpleName());
            rule.add("------");
        }
        line(out, header, widths);
        line(out, typeNames, widths);
        line(out, rule, widths);

        int numRows = table.numRows();
        if (numRows > maxLines) {
            int half = maxLines / 2;
            for (int row = 0; row < half; row++) {
                line(out, cells(row, visible), widths);
            }
            out.append("...\n");
            for (int row = numRows - half - 1; row < numRows; row++) {
                line(out, cells(row, visible), widths);
            }
        } else {
            for (int row = 0; row < numRows; row++) {
                line(out, cells(row, visible), widths);
            }
        }
        return out.toString();
    }

    private List<String> cells(int row, List<Integer> visible) {
        List<Object> values = table.row(row);
        List<String> cells = new ArrayList<>(visible.size());
        for (int column : visible) {
            cells.add(table.formatValue(column, values.get(column)));
        }
        return cells;
    }

    private static void line(StringBuilder out, List<String> cells, int[] widths) {
        for (int k = 0; k < cells.size(); k++) {
            String cell = cells.get(k) == null ? "-" : cells.get(k);
            out.append(cell);
            out.append(" ".repeat(Math.max(0, widths[k] - cell.length() + 1)));
        }
        out.append('\n');
    }
}
