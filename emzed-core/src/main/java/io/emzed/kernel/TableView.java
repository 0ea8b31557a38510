package io.emzed.kernel;

import io.emzed.core.MetaKey;
import io.emzed.core.TableRef;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read access to a table as needed by joins and expression evaluation.
 */
public interface TableView {

    TableRef ref();

    String title();

    List<String> getColNames();

    List<Class<?>> getColTypes();

    List<String> getColFormats();

    int numRows();

    /**
     * Returns an unmodifiable view of row {@code index}.
     */
    List<Object> row(int index);

    /**
     * Returns the values of column {@code name}, one per row.
     */
    List<Object> columnValues(String name);

    Map<MetaKey, Object> meta();

    /**
     * Builds column data for those {@code needed} columns which belong to this table.
     */
    Map<String, ColumnData> columnContext(Set<ColumnKey> needed);
}
