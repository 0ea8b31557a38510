package io.emzed.kernel;

import io.emzed.core.ColumnTypeException;

import java.util.List;

/**
 * Reductions over the non-null values of a column.
 * All functions except {@link #COUNT} give {@code null} for an empty input.
 */
public enum AggregateFunction {
    COUNT,
    SUM,
    MIN,
    MAX,
    MEAN,
    STD;

    public Object apply(List<Object> values) {
        List<Object> present = values.stream().filter(v -> v != null).toList();
        if (this == COUNT) {
            return present.size();
        }
        if (present.isEmpty()) {
            return null;
        }
        return switch (this) {
            case MIN -> present.stream().min(CellComparator.INSTANCE).orElse(null);
            case MAX -> present.stream().max(CellComparator.INSTANCE).orElse(null);
            case SUM -> sum(present);
            case MEAN -> mean(present);
            case STD -> std(present);
            default -> throw new IllegalStateException("unexpected aggregate " + this);
        };
    }

    Class<?> resultType(Class<?> operandType) {
        return switch (this) {
            case COUNT -> Integer.class;
            case MIN, MAX -> operandType;
            case SUM -> operandType == Integer.class || operandType == Long.class ? Long.class : Double.class;
            case MEAN, STD -> Double.class;
        };
    }

    private static Object sum(List<Object> values) {
        boolean integral = values.stream().allMatch(CellComparator::isIntegral);
        if (integral) {
            long total = 0;
            for (Object value : values) {
                total += ((Number) value).longValue();
            }
            return total;
        }
        double total = 0.0;
        for (Object value : values) {
            total += number(value);
        }
        return total;
    }

    private static double mean(List<Object> values) {
        double total = 0.0;
        for (Object value : values) {
            total += number(value);
        }
        return total / values.size();
    }

    private static double std(List<Object> values) {
        double mean = mean(values);
        double squares = 0.0;
        for (Object value : values) {
            double d = number(value) - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / values.size());
    }

    private static double number(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new ColumnTypeException("numeric value required, got " + value.getClass().getSimpleName());
    }
}
