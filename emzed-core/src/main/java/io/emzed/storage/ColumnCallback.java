package io.emzed.storage;

import java.util.List;

/**
 * Computes the value of a new column for one row.
 */
@FunctionalInterface
public interface ColumnCallback {

    /**
     * @param table the table the column is added to
     * @param row   unmodifiable view of the current row
     * @param name  name of the new column
     */
    Object compute(Table table, List<Object> row, String name);
}
