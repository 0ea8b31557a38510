package io.emzed.kernel;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * Total order over cell values.
 * <p>
 * {@code null} sorts first, numbers compare by value regardless of their boxed type,
 * lists compare element wise, mutually comparable values by their natural order, and
 * everything else by class name and then string form.
 */
public final class CellComparator implements Comparator<Object> {

    public static final CellComparator INSTANCE = new CellComparator();

    private CellComparator() {
    }

    @Override
    @SuppressWarnings({"unchecked", "rawtypes"})
    public int compare(Object a, Object b) {
        if (a == b) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        if (a instanceof Number x && b instanceof Number y) {
            return compareNumbers(x, y);
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            return compareLists(x, y);
        }
        if (a.getClass() == b.getClass() && a instanceof Comparable c) {
            return c.compareTo(b);
        }
        int byClass = a.getClass().getName().compareTo(b.getClass().getName());
        if (byClass != 0) {
            return byClass;
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    private int compareLists(List<?> x, List<?> y) {
        int n = Math.min(x.size(), y.size());
        for (int i = 0; i < n; i++) {
            int c = compare(x.get(i), y.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(x.size(), y.size());
    }

    private static int compareNumbers(Number x, Number y) {
        if (isIntegral(x) && isIntegral(y)) {
            return Long.compare(x.longValue(), y.longValue());
        }
        if (x instanceof BigDecimal || y instanceof BigDecimal) {
            return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString()));
        }
        return Double.compare(x.doubleValue(), y.doubleValue());
    }

    static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte;
    }

    /**
     * Value equality that treats numbers of different boxed types as equal when their
     * values are.
     */
    public static boolean valuesEqual(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number x && b instanceof Number y) {
            return compareNumbers(x, y) == 0;
        }
        return a.equals(b);
    }

    /**
     * Truth value of a cell: {@code null} and {@code false} are false, numbers are true if
     * non-zero, strings and collections if non-empty, anything else is true.
     */
    public static boolean isTrue(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof java.util.Collection<?> c) {
            return !c.isEmpty();
        }
        return true;
    }
}
