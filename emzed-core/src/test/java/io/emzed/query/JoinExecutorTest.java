package io.emzed.query;

import io.emzed.core.EmzedConfiguration;
import io.emzed.kernel.Expressions;
import io.emzed.logging.RecordingSlf4jServiceProvider;
import io.emzed.storage.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JoinExecutorTest {

    private final JoinExecutor executor = new JoinExecutor(EmzedConfiguration.defaults());

    private final Table left = Table.toTable("id", List.of(1, 2, 3));
    private final Table right = new Table(List.of("id", "name"), types(Integer.class, String.class),
            List.of("%d", "%s"), List.of(List.of(2, "x"), List.of(3, "y"), List.of(3, "z")));

    private static List<Class<?>> types(Class<?>... types) {
        return List.of(types);
    }

    @BeforeEach
    void clearLog() {
        RecordingSlf4jServiceProvider.clear();
    }

    @Test
    void shouldEmitMatchingPairsInLeftThenRightOrder() {
        List<List<Object>> rows = executor.join(left, right, left.column("id").eq(right.column("id")), false);

        assertThat(rows).containsExactly(
                List.of(2, 2, "x"),
                List.of(3, 3, "y"),
                List.of(3, 3, "z"));
    }

    @Test
    void shouldPadUnmatchedLeftRows() {
        List<List<Object>> rows = executor.join(left, right, left.column("id").eq(right.column("id")), true);

        assertThat(rows).hasSize(4);
        assertThat(rows.get(0)).containsExactly(1, null, null);
    }

    @Test
    void shouldMatchAllRightRowsForTrueValue() {
        assertThat(executor.join(left, right, Expressions.alwaysTrue(), false)).hasSize(9);
    }

    @Test
    void shouldMatchNothingForFalseValue() {
        assertThat(executor.join(left, right, Expressions.of(false), false)).isEmpty();
        assertThat(executor.join(left, right, Expressions.of(false), true))
                .containsExactly(Arrays.asList(1, null, null), Arrays.asList(2, null, null),
                        Arrays.asList(3, null, null));
    }

    @Test
    void shouldEvaluateSingleValueAgainstSingleRightRow() {
        Table single = Table.toTable("name", List.of("only"));

        assertThat(executor.join(left, single, left.column("id").gt(1), false))
                .containsExactly(List.of(2, "only"), List.of(3, "only"));
    }

    @Test
    @DisplayName("Should emit nothing for a true value and an empty right table, also for left joins")
    void shouldEmitNothingForEmptyRightTable() {
        Table empty = right.buildEmptyClone();

        assertThat(executor.join(left, empty, Expressions.alwaysTrue(), true)).isEmpty();
        assertThat(executor.join(left, empty, left.column("id").eq(empty.column("id")), true)).hasSize(3);
    }

    @Test
    void shouldLogProgress() {
        JoinExecutor halfSteps = new JoinExecutor(EmzedConfiguration.builder().progressStep(50).build());
        Table four = Table.toTable("id", List.of(1, 2, 3, 4));

        halfSteps.join(four, right, Expressions.alwaysTrue(), false);

        assertThat(RecordingSlf4jServiceProvider.events())
                .filteredOn(line -> line.startsWith("INFO JoinExecutor"))
                .containsExactly("INFO JoinExecutor - join 50% done", "INFO JoinExecutor - join 100% done");
    }

    @Test
    void shouldRequireCondition() {
        assertThatThrownBy(() -> executor.join(left, right, null, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
