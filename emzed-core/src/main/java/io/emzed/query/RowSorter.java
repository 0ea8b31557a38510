package io.emzed.query;

import io.emzed.kernel.CellComparator;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Stable sort of rows on composite keys.
 */
public final class RowSorter {

    private RowSorter() {
    }

    /**
     * Computes the permutation which sorts {@code rows} by the values at {@code keyColumns}.
     * Rows with equal keys keep their relative order, for both directions.
     *
     * @return {@code p} such that sorted row {@code i} is {@code rows.get(p[i])}
     */
    public static int[] permutation(List<? extends List<?>> rows, int[] keyColumns, boolean ascending) {
        Comparator<Integer> byKeys = (a, b) -> {
            List<?> left = rows.get(a);
            List<?> right = rows.get(b);
            for (int column : keyColumns) {
                int c = CellComparator.INSTANCE.compare(left.get(column), right.get(column));
                if (c != 0) {
                    return ascending ? c : -c;
                }
            }
            return 0;
        };
        Integer[] order = new Integer[rows.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        // Arrays.sort on objects is a stable merge sort
        Arrays.sort(order, byKeys);
        return Arrays.stream(order).mapToInt(Integer::intValue).toArray();
    }
}
