package io.emzed.kernel;

import io.emzed.core.ShapeMismatchException;

import java.util.List;

/**
 * Handle to a column of a table, returned by {@code Table.column(name)}.
 * Builds expressions referring to the column and reads its current values.
 */
public final class ColumnHandle implements ExpressionBuilder {

    private final TableView table;
    private final String name;
    private final Class<?> type;

    public ColumnHandle(TableView table, String name, Class<?> type) {
        if (table == null) {
            throw new IllegalArgumentException("table required");
        }
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name required");
        }
        this.table = table;
        this.name = name;
        this.type = type == null ? Object.class : type;
    }

    public String name() {
        return name;
    }

    public Class<?> type() {
        return type;
    }

    @Override
    public Expression expression() {
        return new Expression.ColumnRef(table.ref(), name, type);
    }

    /**
     * Current values of the column, one per row.
     */
    public List<Object> values() {
        return table.columnValues(name);
    }

    public <T> List<T> values(Class<T> valueType) {
        return values().stream().map(valueType::cast).toList();
    }

    /**
     * Returns the single distinct value of the column.
     *
     * @throws ShapeMismatchException if the column holds more than one distinct value or is empty
     */
    public Object uniqueValue() {
        List<Object> distinct = values().stream().distinct().toList();
        if (distinct.size() != 1) {
            throw ShapeMismatchException.of("distinct values in column " + name, 1, distinct.size());
        }
        return distinct.get(0);
    }

    @Override
    public String toString() {
        return "ColumnHandle{" + name + ":" + type.getSimpleName() + "}";
    }
}
