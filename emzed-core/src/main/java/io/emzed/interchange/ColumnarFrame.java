package io.emzed.interchange;

import io.emzed.core.ShapeMismatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column oriented data frame: named columns of equal length, in insertion order.
 * Missing values are {@code null}.
 */
public final class ColumnarFrame {

    private final Map<String, List<Object>> columns;
    private final int numRows;

    private ColumnarFrame(Map<String, List<Object>> columns, int numRows) {
        this.columns = columns;
        this.numRows = numRows;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ColumnarFrame of(Map<String, ? extends List<?>> columns) {
        Builder builder = builder();
        columns.forEach(builder::column);
        return builder.build();
    }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public List<Object> column(String name) {
        List<Object> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("no column " + name);
        }
        return values;
    }

    public int numColumns() {
        return columns.size();
    }

    public int numRows() {
        return numRows;
    }

    @Override
    public String toString() {
        return "ColumnarFrame{columns=" + columns.keySet() + ", rows=" + numRows + "}";
    }

    public static final class Builder {
        private final Map<String, List<Object>> columns = new LinkedHashMap<>();
        private Integer numRows;

        private Builder() {
        }

        /**
         * Adds a column; all columns must have the same length.
         */
        public Builder column(String name, List<?> values) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("name required");
            }
            if (values == null) {
                throw new IllegalArgumentException("values required");
            }
            if (columns.containsKey(name)) {
                throw new IllegalArgumentException("duplicate column " + name);
            }
            if (numRows != null && numRows != values.size()) {
                throw ShapeMismatchException.of("length of column " + name, numRows, values.size());
            }
            numRows = values.size();
            columns.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
            return this;
        }

        public ColumnarFrame build() {
            return new ColumnarFrame(Collections.unmodifiableMap(new LinkedHashMap<>(columns)),
                    numRows == null ? 0 : numRows);
        }
    }
}
