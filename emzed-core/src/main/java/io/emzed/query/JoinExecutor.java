package io.emzed.query;

import io.emzed.core.EmzedConfiguration;
import io.emzed.core.ShapeMismatchException;
import io.emzed.kernel.ColumnData;
import io.emzed.kernel.ColumnKey;
import io.emzed.kernel.EvalResult;
import io.emzed.kernel.EvaluationContext;
import io.emzed.kernel.Expression;
import io.emzed.kernel.TableView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.emzed.kernel.CellComparator.isTrue;

/**
 * Nested loop join of two tables on an arbitrary condition.
 * <p>
 * The condition is evaluated once per left row, with the left table bound to the values of
 * that row and the right table bound to its full columns. A single value result matches all
 * or none of the right rows, otherwise the result is the match mask over the right rows.
 */
public final class JoinExecutor {

    private static final Logger log = LoggerFactory.getLogger(JoinExecutor.class);

    private final EmzedConfiguration configuration;

    public JoinExecutor(EmzedConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
    }

    /**
     * Returns the concatenated rows of all matching pairs. For a left join, left rows without
     * partner are emitted once with {@code null} for every right column.
     */
    public List<List<Object>> join(TableView left, TableView right, Expression condition, boolean leftJoin) {
        if (left == null || right == null) {
            throw new IllegalArgumentException("left and right required");
        }
        if (condition == null) {
            throw new IllegalArgumentException("condition required");
        }
        Set<ColumnKey> needed = condition.neededColumns();
        Map<String, ColumnData> rightColumns = right.columnContext(needed);

        List<String> leftNames = left.getColNames();
        List<Class<?>> leftTypes = left.getColTypes();
        List<String> neededLeft = new ArrayList<>();
        for (ColumnKey key : needed) {
            if (key.table().equals(left.ref())) {
                neededLeft.add(key.name());
            }
        }

        int leftRows = left.numRows();
        int rightRows = right.numRows();
        int rightWidth = right.getColNames().size();
        List<Object> nullFiller = Collections.nCopies(rightWidth, null);

        log.debug("join {} x {} rows on {}", leftRows, rightRows, condition);
        ProgressLog progress = new ProgressLog(leftRows, configuration.progressStep());

        List<List<Object>> result = new ArrayList<>();
        for (int i = 0; i < leftRows; i++) {
            List<Object> leftRow = left.row(i);
            Map<String, ColumnData> leftColumns = new HashMap<>();
            for (String name : neededLeft) {
                int index = leftNames.indexOf(name);
                if (index >= 0) {
                    leftColumns.put(name, new ColumnData(Collections.singletonList(leftRow.get(index)),
                            null, leftTypes.get(index)));
                }
            }
            EvaluationContext context = new EvaluationContext()
                    .put(left.ref(), leftColumns)
                    .put(right.ref(), rightColumns);
            EvalResult matches = condition.evaluate(context);

            boolean matched = false;
            if (matches.isScalar() && rightRows != 1) {
                if (isTrue(matches.get(0))) {
                    for (int j = 0; j < rightRows; j++) {
                        result.add(concat(leftRow, right.row(j)));
                    }
                    matched = true;
                }
            } else {
                if (matches.size() != rightRows) {
                    throw ShapeMismatchException.of("join condition result size", rightRows, matches.size());
                }
                for (int j = 0; j < rightRows; j++) {
                    if (isTrue(matches.get(j))) {
                        result.add(concat(leftRow, right.row(j)));
                        matched = true;
                    }
                }
            }
            if (leftJoin && !matched) {
                result.add(concat(leftRow, nullFiller));
            }
            progress.step(i + 1);
        }
        log.debug("join produced {} rows", result.size());
        return result;
    }

    private static List<Object> concat(List<Object> left, List<Object> right) {
        List<Object> row = new ArrayList<>(left.size() + right.size());
        row.addAll(left);
        row.addAll(right);
        return row;
    }

    /**
     * Logs every time another {@code step} percent of the left rows are processed.
     */
    private static final class ProgressLog {
        private final int total;
        private final int step;
        private int nextPercent;

        ProgressLog(int total, int step) {
            this.total = total;
            this.step = step;
            this.nextPercent = step;
        }

        void step(int done) {
            if (total == 0) {
                return;
            }
            int percent = (int) (100L * done / total);
            if (percent >= nextPercent) {
                log.info("join {}% done", percent);
                while (nextPercent <= percent) {
                    nextPercent += step;
                }
            }
        }
    }
}
