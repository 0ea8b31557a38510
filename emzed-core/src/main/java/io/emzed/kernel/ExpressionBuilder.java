package io.emzed.kernel;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builder methods shared by expressions and column handles.
 * <p>
 * Operands which are not expressions are wrapped as literals, so
 * {@code t.column("mz").ge(100.0).and(t.column("rt").lt(20))} builds
 * {@code ((mz >= 100.0) & (rt < 20))}.
 */
public interface ExpressionBuilder {

    Expression expression();

    default Expression add(Object other) {
        return binary(BinaryOperator.ADD, other);
    }

    default Expression sub(Object other) {
        return binary(BinaryOperator.SUB, other);
    }

    default Expression mul(Object other) {
        return binary(BinaryOperator.MUL, other);
    }

    default Expression div(Object other) {
        return binary(BinaryOperator.DIV, other);
    }

    default Expression eq(Object other) {
        return binary(BinaryOperator.EQ, other);
    }

    default Expression ne(Object other) {
        return binary(BinaryOperator.NE, other);
    }

    default Expression lt(Object other) {
        return binary(BinaryOperator.LT, other);
    }

    default Expression le(Object other) {
        return binary(BinaryOperator.LE, other);
    }

    default Expression gt(Object other) {
        return binary(BinaryOperator.GT, other);
    }

    default Expression ge(Object other) {
        return binary(BinaryOperator.GE, other);
    }

    default Expression and(Object other) {
        return binary(BinaryOperator.AND, other);
    }

    default Expression or(Object other) {
        return binary(BinaryOperator.OR, other);
    }

    /**
     * {@code lower <= this <= upper}.
     */
    default Expression between(Object lower, Object upper) {
        return ge(lower).and(le(upper));
    }

    /**
     * {@code |this - value| <= tolerance}.
     */
    default Expression approxEqual(Object value, Object tolerance) {
        return between(Expressions.of(value).sub(tolerance), Expressions.of(value).add(tolerance));
    }

    default Expression not() {
        return new Expression.UnaryOp("not", v -> !CellComparator.isTrue(v), false, Boolean.class, expression());
    }

    default Expression neg() {
        return new Expression.UnaryOp("neg", v -> BinaryOperator.SUB.apply(0, v), true, null, expression());
    }

    default Expression abs() {
        return new Expression.UnaryOp("abs", v -> {
            if (v instanceof Number n && CellComparator.isIntegral(n)) {
                long a = Math.abs(n.longValue());
                return v instanceof Long || a > Integer.MAX_VALUE ? (Object) a : (Object) (int) a;
            }
            return Math.abs(((Number) v).doubleValue());
        }, true, null, expression());
    }

    default Expression isNone() {
        return new Expression.UnaryOp("isNone", Objects::isNull, false, Boolean.class, expression());
    }

    default Expression isNotNone() {
        return new Expression.UnaryOp("isNotNone", Objects::nonNull, false, Boolean.class, expression());
    }

    default Expression isIn(Collection<?> candidates) {
        List<?> copy = List.copyOf(candidates);
        return new Expression.UnaryOp("isIn", v -> copy.stream().anyMatch(c -> CellComparator.valuesEqual(c, v)),
                false, Boolean.class, expression());
    }

    default Expression startsWith(String prefix) {
        return new Expression.UnaryOp("startsWith", v -> v.toString().startsWith(prefix), true,
                Boolean.class, expression());
    }

    default Expression contains(String part) {
        return new Expression.UnaryOp("contains", v -> v.toString().contains(part), true,
                Boolean.class, expression());
    }

    /**
     * Applies {@code function} to every non-null value; {@code null} stays {@code null}.
     */
    default Expression apply(Function<Object, Object> function) {
        return apply(function, true);
    }

    default Expression apply(Function<Object, Object> function, boolean ignoreNones) {
        return new Expression.UnaryOp("apply", function, ignoreNones, null, expression());
    }

    default Expression.Aggregate count() {
        return new Expression.Aggregate(AggregateFunction.COUNT, expression(), null);
    }

    default Expression.Aggregate sum() {
        return new Expression.Aggregate(AggregateFunction.SUM, expression(), null);
    }

    default Expression.Aggregate min() {
        return new Expression.Aggregate(AggregateFunction.MIN, expression(), null);
    }

    default Expression.Aggregate max() {
        return new Expression.Aggregate(AggregateFunction.MAX, expression(), null);
    }

    default Expression.Aggregate mean() {
        return new Expression.Aggregate(AggregateFunction.MEAN, expression(), null);
    }

    default Expression.Aggregate std() {
        return new Expression.Aggregate(AggregateFunction.STD, expression(), null);
    }

    private Expression binary(BinaryOperator operator, Object other) {
        return new Expression.BinaryOp(operator, expression(), Expressions.of(other));
    }
}
