package io.emzed.kernel;

import io.emzed.core.TableRef;

/**
 * A column of a specific table, as referenced by an expression.
 */
public record ColumnKey(TableRef table, String name) {
    public ColumnKey {
        if (table == null) {
            throw new IllegalArgumentException("table required");
        }
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name required");
        }
    }
}
