package io.emzed.kernel;

import io.emzed.core.ShapeMismatchException;
import io.emzed.core.TableRef;
import io.emzed.core.converter.ColumnTypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable expression tree over column references and literals.
 * <p>
 * Evaluation is lazy: trees are built through {@link ExpressionBuilder} methods and only
 * evaluated by table operations against an {@link EvaluationContext}. Results are either a
 * single value, which broadcasts, or one value per row of the referenced columns.
 */
public sealed interface Expression extends ExpressionBuilder permits Expression.Literal, Expression.ColumnRef,
        Expression.UnaryOp, Expression.BinaryOp, Expression.Aggregate {

    EvalResult evaluate(EvaluationContext context);

    /**
     * Columns this expression reads; contexts only need to materialize these.
     */
    Set<ColumnKey> neededColumns();

    @Override
    default Expression expression() {
        return this;
    }

    record Literal(Object value) implements Expression {
        @Override
        public EvalResult evaluate(EvaluationContext context) {
            Class<?> type = value == null ? Object.class : value.getClass();
            return new EvalResult(Collections.singletonList(value), null, type);
        }

        @Override
        public Set<ColumnKey> neededColumns() {
            return Set.of();
        }

        @Override
        public String toString() {
            return value instanceof String s ? "'" + s + "'" : String.valueOf(value);
        }
    }

    record ColumnRef(TableRef table, String name, Class<?> type) implements Expression {
        public ColumnRef {
            if (table == null) {
                throw new IllegalArgumentException("table required");
            }
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("name required");
            }
            if (type == null) {
                type = Object.class;
            }
        }

        @Override
        public EvalResult evaluate(EvaluationContext context) {
            ColumnData data = context.lookup(table, name);
            return new EvalResult(data.values(), data.sorted(), data.type());
        }

        @Override
        public Set<ColumnKey> neededColumns() {
            return Set.of(new ColumnKey(table, name));
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Applies a function to each value of the operand.
     *
     * @param symbol      name used in {@link #toString()}
     * @param function    the function
     * @param ignoreNones if true, {@code null} values are passed through without calling the function
     * @param type        declared result type, or {@code null} to infer it from the results
     */
    record UnaryOp(String symbol, Function<Object, Object> function, boolean ignoreNones, Class<?> type,
                   Expression operand) implements Expression {
        public UnaryOp {
            if (function == null) {
                throw new IllegalArgumentException("function required");
            }
            if (operand == null) {
                throw new IllegalArgumentException("operand required");
            }
        }

        @Override
        public EvalResult evaluate(EvaluationContext context) {
            EvalResult input = operand.evaluate(context);
            List<Object> values = new ArrayList<>(input.size());
            for (Object value : input.values()) {
                values.add(value == null && ignoreNones ? null : function.apply(value));
            }
            Class<?> resultType = type != null ? type : ColumnTypes.commonTypeFor(values);
            return new EvalResult(values, null, widenIntegers(values, resultType));
        }

        @Override
        public Set<ColumnKey> neededColumns() {
            return operand.neededColumns();
        }

        @Override
        public String toString() {
            return symbol + "(" + operand + ")";
        }
    }

    record BinaryOp(BinaryOperator operator, Expression left, Expression right) implements Expression {
        public BinaryOp {
            if (operator == null) {
                throw new IllegalArgumentException("operator required");
            }
            if (left == null || right == null) {
                throw new IllegalArgumentException("left and right required");
            }
        }

        @Override
        public EvalResult evaluate(EvaluationContext context) {
            EvalResult l = left.evaluate(context);
            EvalResult r = right.evaluate(context);
            int size = broadcastSize(l.size(), r.size(), this);
            List<Object> values = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                values.add(operator.apply(l.get(i), r.get(i)));
            }
            Class<?> resultType = operator.resultType(l.type(), r.type());
            if (resultType == null) {
                resultType = ColumnTypes.commonTypeFor(values);
            }
            return new EvalResult(values, sortedFlag(l, r), widenIntegers(values, resultType));
        }

        // shifting a sorted column by a constant keeps it sorted
        private Boolean sortedFlag(EvalResult l, EvalResult r) {
            if (operator == BinaryOperator.ADD || operator == BinaryOperator.SUB) {
                if (right instanceof Literal) {
                    return l.sorted();
                }
                if (operator == BinaryOperator.ADD && left instanceof Literal) {
                    return r.sorted();
                }
            }
            return null;
        }

        @Override
        public Set<ColumnKey> neededColumns() {
            Set<ColumnKey> needed = new HashSet<>(left.neededColumns());
            needed.addAll(right.neededColumns());
            return needed;
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.symbol() + " " + right + ")";
        }
    }

    /**
     * Reduces the operand to one value, or to one value per group when {@code groupBy} is set.
     * Grouped results are spread back to the rows of each group.
     */
    record Aggregate(AggregateFunction function, Expression operand, Expression groupBy) implements Expression {
        public Aggregate {
            if (function == null) {
                throw new IllegalArgumentException("function required");
            }
            if (operand == null) {
                throw new IllegalArgumentException("operand required");
            }
        }

        @Override
        public EvalResult evaluate(EvaluationContext context) {
            EvalResult input = operand.evaluate(context);
            Class<?> resultType = function.resultType(input.type());
            if (groupBy == null) {
                return new EvalResult(Collections.singletonList(function.apply(input.values())), null, resultType);
            }
            EvalResult keys = groupBy.evaluate(context);
            int size = broadcastSize(input.size(), keys.size(), this);
            List<RowKey> rowKeys = new ArrayList<>(size);
            Map<RowKey, List<Object>> groups = new LinkedHashMap<>();
            for (int i = 0; i < size; i++) {
                RowKey key = RowKey.of(Collections.singletonList(keys.get(i)));
                rowKeys.add(key);
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(input.get(i));
            }
            Map<RowKey, Object> reduced = new LinkedHashMap<>();
            groups.forEach((key, values) -> reduced.put(key, function.apply(values)));
            List<Object> values = new ArrayList<>(size);
            for (RowKey key : rowKeys) {
                values.add(reduced.get(key));
            }
            return new EvalResult(values, null, resultType);
        }

        @Override
        public Set<ColumnKey> neededColumns() {
            Set<ColumnKey> needed = new HashSet<>(operand.neededColumns());
            if (groupBy != null) {
                needed.addAll(groupBy.neededColumns());
            }
            return needed;
        }

        public Aggregate groupBy(ExpressionBuilder keys) {
            return new Aggregate(function, operand, keys.expression());
        }

        @Override
        public String toString() {
            String base = function.name().toLowerCase() + "(" + operand + ")";
            return groupBy == null ? base : base + ".groupBy(" + groupBy + ")";
        }
    }

    /**
     * Integer arithmetic widens single results to {@code Long} on overflow; the other
     * results of an integral column follow so that the column keeps one type.
     */
    private static Class<?> widenIntegers(List<Object> values, Class<?> type) {
        if (type != Integer.class && type != Long.class) {
            return type;
        }
        if (values.stream().noneMatch(Long.class::isInstance)) {
            return type;
        }
        values.replaceAll(v -> v instanceof Integer i ? (Object) i.longValue() : v);
        return Long.class;
    }

    private static int broadcastSize(int left, int right, Expression where) {
        if (left == right || right == 1) {
            return left;
        }
        if (left == 1) {
            return right;
        }
        throw new ShapeMismatchException("operand sizes " + left + " and " + right
                + " do not match in " + where);
    }
}
