package io.emzed.kernel;

/**
 * Static factories for expressions.
 */
public final class Expressions {

    private static final Expression.Literal TRUE = new Expression.Literal(Boolean.TRUE);

    private Expressions() {
    }

    /**
     * Returns {@code value} as expression: builders give their expression, anything else is
     * wrapped as a literal.
     */
    public static Expression of(Object value) {
        if (value instanceof ExpressionBuilder builder) {
            return builder.expression();
        }
        return new Expression.Literal(value);
    }

    public static Expression.Literal value(Object value) {
        return new Expression.Literal(value);
    }

    public static Expression alwaysTrue() {
        return TRUE;
    }

    public static Expression and(Object first, Object... more) {
        Expression result = of(first);
        for (Object next : more) {
            result = result.and(next);
        }
        return result;
    }

    public static Expression or(Object first, Object... more) {
        Expression result = of(first);
        for (Object next : more) {
            result = result.or(next);
        }
        return result;
    }
}
