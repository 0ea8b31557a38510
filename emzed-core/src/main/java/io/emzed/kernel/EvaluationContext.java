package io.emzed.kernel;

import io.emzed.core.SchemaException;
import io.emzed.core.TableRef;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Column data per table, keyed by table identity.
 */
public final class EvaluationContext {

    private final Map<TableRef, Map<String, ColumnData>> tables = new HashMap<>();

    public EvaluationContext put(TableRef table, Map<String, ColumnData> columns) {
        if (table == null) {
            throw new IllegalArgumentException("table required");
        }
        tables.put(table, Collections.unmodifiableMap(columns));
        return this;
    }

    public boolean contains(TableRef table) {
        return tables.containsKey(table);
    }

    public ColumnData lookup(TableRef table, String name) {
        Map<String, ColumnData> columns = tables.get(table);
        if (columns == null) {
            throw new SchemaException("table " + table + " is not part of the evaluation context,"
                    + " expression refers to column " + name + " of a foreign table");
        }
        ColumnData data = columns.get(name);
        if (data == null) {
            throw new SchemaException("column " + name + " of " + table + " not in evaluation context");
        }
        return data;
    }
}
