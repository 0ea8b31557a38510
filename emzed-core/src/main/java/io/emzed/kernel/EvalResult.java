package io.emzed.kernel;

import java.util.List;

/**
 * Result of evaluating an {@link Expression}: either a single broadcastable value or one
 * value per row.
 */
public record EvalResult(List<Object> values, Boolean sorted, Class<?> type) {
    public EvalResult {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        if (type == null) {
            type = Object.class;
        }
    }

    public int size() {
        return values.size();
    }

    public boolean isScalar() {
        return values.size() == 1;
    }

    /**
     * Returns the value at {@code index}, broadcasting scalar results.
     */
    public Object get(int index) {
        return isScalar() ? values.get(0) : values.get(index);
    }
}
