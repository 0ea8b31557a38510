package io.emzed.query;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RowGroupingTest {

    private static final List<List<Object>> ROWS = List.of(
            Arrays.asList("b", 1, 10.0),
            Arrays.asList("a", 2L, 20.0),
            Arrays.asList("b", 1.0, 30.0),
            Arrays.asList(null, 1, 40.0),
            Arrays.asList("a", 2, 20.0));

    @Test
    void shouldGroupInOrderOfFirstAppearance() {
        assertThat(RowGrouping.groups(ROWS, new int[]{0}))
                .containsExactly(List.of(0, 2), List.of(1, 4), List.of(3));
    }

    @Test
    void shouldGroupNumericKeysByValue() {
        assertThat(RowGrouping.groups(ROWS, new int[]{1}))
                .containsExactly(List.of(0, 2, 3), List.of(1, 4));
    }

    @Test
    void shouldGroupOnCompositeKeys() {
        assertThat(RowGrouping.groups(ROWS, new int[]{0, 1}))
                .containsExactly(List.of(0, 2), List.of(1, 4), List.of(3));
    }

    @Test
    void shouldFindFirstOccurrenceOfDistinctRows() {
        assertThat(RowGrouping.firstOccurrences(ROWS)).containsExactly(0, 1, 2, 3);
    }

    @Test
    void shouldHandleNoRows() {
        assertThat(RowGrouping.groups(List.of(), new int[]{0})).isEmpty();
        assertThat(RowGrouping.firstOccurrences(List.of())).isEmpty();
    }
}
