package io.emzed.interchange;

import io.emzed.core.MetaKey;
import io.emzed.core.ShapeMismatchException;
import io.emzed.core.converter.ColumnTypes;
import io.emzed.core.converter.TypeConverterRegistry;
import io.emzed.storage.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts between tables and {@link ColumnarFrame}s or row matrices.
 * Floating point {@code NaN} is read and written as missing value.
 */
public final class FrameConverter {

    private static final Map<Class<?>, String> DEFAULT_FORMATS = Map.of(
            Integer.class, "%d",
            Long.class, "%d",
            Double.class, "%f",
            Float.class, "%f",
            String.class, "%s",
            Boolean.class, "%s");

    private FrameConverter() {
    }

    public static ColumnarFrame toFrame(Table table) {
        ColumnarFrame.Builder builder = ColumnarFrame.builder();
        for (String name : table.getColNames()) {
            builder.column(name, withoutNaN(table.columnValues(name)));
        }
        return builder.build();
    }

    public static Table fromFrame(ColumnarFrame frame) {
        return fromFrame(frame, null, null, Map.of(), Map.of());
    }

    /**
     * Builds a table from {@code frame}.
     *
     * @param types   column types by name, values are converted to them; missing names get the
     *                common type of their values
     * @param formats formats keyed by column name or by type; a name entry wins over a type entry,
     *                unlisted columns get {@code %d}, {@code %f} or {@code %s} by type and
     *                {@code Object} columns are hidden
     */
    public static Table fromFrame(ColumnarFrame frame, String title, Map<MetaKey, ?> meta,
                                  Map<String, Class<?>> types, Map<?, String> formats) {
        if (frame == null) {
            throw new IllegalArgumentException("frame required");
        }
        List<String> names = frame.columnNames();
        List<List<Object>> columns = new ArrayList<>(names.size());
        for (String name : names) {
            columns.add(withoutNaN(frame.column(name)));
        }
        return build(names, columns, frame.numRows(), types, formats, title, meta);
    }

    /**
     * Builds a table from rows of values, one list per row.
     */
    public static Table fromMatrix(List<? extends List<?>> rows, List<String> names, Map<String, Class<?>> types,
                                   Map<?, String> formats, String title, Map<MetaKey, ?> meta) {
        if (rows == null || names == null) {
            throw new IllegalArgumentException("rows and names required");
        }
        List<List<Object>> columns = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            columns.add(new ArrayList<>(rows.size()));
        }
        for (List<?> row : rows) {
            if (row.size() != names.size()) {
                throw ShapeMismatchException.of("row length", names.size(), row.size());
            }
            for (int i = 0; i < names.size(); i++) {
                columns.get(i).add(isNaN(row.get(i)) ? null : row.get(i));
            }
        }
        return build(names, columns, rows.size(), types, formats, title, meta);
    }

    private static Table build(List<String> names, List<List<Object>> columns, int numRows,
                               Map<String, Class<?>> types, Map<?, String> formats, String title,
                               Map<MetaKey, ?> meta) {
        Map<String, Class<?>> givenTypes = types == null ? Map.of() : types;
        Map<?, String> givenFormats = formats == null ? Map.of() : formats;
        List<Class<?>> columnTypes = new ArrayList<>(names.size());
        List<String> columnFormats = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            Class<?> type = givenTypes.get(name);
            if (type == null) {
                type = ColumnTypes.commonTypeFor(columns.get(i));
            }
            columnTypes.add(type);
            columnFormats.add(formatFor(name, type, givenFormats));
        }
        TypeConverterRegistry registry = TypeConverterRegistry.getInstance();
        List<List<Object>> rows = new ArrayList<>(numRows);
        for (int r = 0; r < numRows; r++) {
            List<Object> row = new ArrayList<>(names.size());
            for (int i = 0; i < columns.size(); i++) {
                row.add(registry.coerce(columnTypes.get(i), columns.get(i).get(r)));
            }
            rows.add(row);
        }
        return Table.createPostfixed(names, columnTypes, columnFormats, rows, title, meta);
    }

    private static String formatFor(String name, Class<?> type, Map<?, String> formats) {
        if (formats.containsKey(name)) {
            return formats.get(name);
        }
        if (formats.containsKey(type)) {
            return formats.get(type);
        }
        if (type == Object.class) {
            return null;
        }
        return DEFAULT_FORMATS.getOrDefault(type, "%s");
    }

    private static List<Object> withoutNaN(List<Object> values) {
        List<Object> cleaned = new ArrayList<>(values.size());
        for (Object value : values) {
            cleaned.add(isNaN(value) ? null : value);
        }
        return cleaned;
    }

    private static boolean isNaN(Object value) {
        return value instanceof Double d && d.isNaN() || value instanceof Float f && f.isNaN();
    }
}
