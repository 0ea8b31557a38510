package io.emzed.query;

import io.emzed.kernel.RowKey;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups row positions by the values of key columns.
 */
public final class RowGrouping {

    private RowGrouping() {
    }

    /**
     * Row positions per distinct key, in order of first appearance; positions inside a group
     * keep the row order.
     *
     * @param rows       the rows
     * @param keyColumns positions of the key columns inside each row
     */
    public static List<List<Integer>> groups(List<? extends List<?>> rows, int[] keyColumns) {
        Map<RowKey, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            groups.computeIfAbsent(key(rows.get(i), keyColumns), k -> new ArrayList<>()).add(i);
        }
        return new ArrayList<>(groups.values());
    }

    /**
     * Positions of the first occurrence of every distinct full row, in row order.
     */
    public static List<Integer> firstOccurrences(List<? extends List<?>> rows) {
        Set<RowKey> seen = new HashSet<>();
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (seen.add(RowKey.of(rows.get(i)))) {
                positions.add(i);
            }
        }
        return positions;
    }

    private static RowKey key(List<?> row, int[] keyColumns) {
        List<Object> values = new ArrayList<>(keyColumns.length);
        for (int column : keyColumns) {
            values.add(row.get(column));
        }
        return RowKey.of(values);
    }
}
