package io.emzed.kernel;

import io.emzed.core.ColumnTypeException;

/**
 * Operators combining two cell values.
 * <p>
 * Arithmetic yields {@code null} if either side is {@code null}. Ordering comparisons
 * involving {@code null} are false; {@code EQ} treats two {@code null}s as equal.
 * Logical operators use {@link CellComparator#isTrue(Object)}.
 */
public enum BinaryOperator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    AND("&"),
    OR("|");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isArithmetic() {
        return this == ADD || this == SUB || this == MUL || this == DIV;
    }

    public Object apply(Object left, Object right) {
        return switch (this) {
            case ADD, SUB, MUL, DIV -> arithmetic(left, right);
            case EQ -> CellComparator.valuesEqual(left, right);
            case NE -> !CellComparator.valuesEqual(left, right);
            case LT -> left != null && right != null && CellComparator.INSTANCE.compare(left, right) < 0;
            case LE -> left != null && right != null && CellComparator.INSTANCE.compare(left, right) <= 0;
            case GT -> left != null && right != null && CellComparator.INSTANCE.compare(left, right) > 0;
            case GE -> left != null && right != null && CellComparator.INSTANCE.compare(left, right) >= 0;
            case AND -> CellComparator.isTrue(left) && CellComparator.isTrue(right);
            case OR -> CellComparator.isTrue(left) || CellComparator.isTrue(right);
        };
    }

    /**
     * Result type for the given operand types, {@code null} if it depends on the values.
     */
    Class<?> resultType(Class<?> left, Class<?> right) {
        if (!isArithmetic()) {
            return Boolean.class;
        }
        if (this == ADD && left == String.class && right == String.class) {
            return String.class;
        }
        if (this != DIV && isIntegralType(left) && isIntegralType(right)) {
            return left == Long.class || right == Long.class ? Long.class : Integer.class;
        }
        if (isNumericType(left) && isNumericType(right)) {
            return Double.class;
        }
        return null;
    }

    private Object arithmetic(Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (this == ADD && left instanceof String l && right instanceof String r) {
            return l + r;
        }
        if (!(left instanceof Number l) || !(right instanceof Number r)) {
            throw new ColumnTypeException("operator " + symbol + " not supported for "
                    + left.getClass().getSimpleName() + " and " + right.getClass().getSimpleName());
        }
        if (this != DIV && CellComparator.isIntegral(l) && CellComparator.isIntegral(r)) {
            long a = l.longValue();
            long b = r.longValue();
            long result = switch (this) {
                case ADD -> a + b;
                case SUB -> a - b;
                default -> a * b;
            };
            if (l instanceof Long || r instanceof Long || (int) result != result) {
                return result;
            }
            return (int) result;
        }
        double a = l.doubleValue();
        double b = r.doubleValue();
        return switch (this) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            default -> a / b;
        };
    }

    private static boolean isIntegralType(Class<?> type) {
        return type == Integer.class || type == Long.class;
    }

    private static boolean isNumericType(Class<?> type) {
        return isIntegralType(type) || type == Double.class || type == Float.class;
    }
}
