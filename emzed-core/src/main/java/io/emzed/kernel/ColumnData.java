package io.emzed.kernel;

import java.util.List;

/**
 * Column values handed to expression evaluation.
 *
 * @param values column values, one per row (or a single value for a one-row context)
 * @param sorted {@code true} if the values are known to be sorted ascending, else {@code null}
 * @param type   declared column type
 */
public record ColumnData(List<Object> values, Boolean sorted, Class<?> type) {
    public ColumnData {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        if (type == null) {
            throw new IllegalArgumentException("type required");
        }
    }
}
