package io.emzed.kernel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Hash key over cell values with value semantics: numbers equal by value compare equal
 * ({@code 1}, {@code 1L} and {@code 1.0} give the same key), lists and maps compare element wise.
 */
public final class RowKey {

    private final List<Object> parts;
    private final int hash;

    private RowKey(List<Object> parts) {
        this.parts = parts;
        this.hash = parts.hashCode();
    }

    public static RowKey of(List<?> values) {
        List<Object> parts = new ArrayList<>(values.size());
        for (Object value : values) {
            parts.add(normalize(value));
        }
        return new RowKey(parts);
    }

    private static Object normalize(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof Double) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 0x1p63) {
                return (long) d;
            }
            return d;
        }
        if (value instanceof List<?> list) {
            return of(list);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), normalize(v)));
            return sorted;
        }
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return parts.equals(((RowKey) obj).parts);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "RowKey" + parts;
    }
}
