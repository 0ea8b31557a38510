package io.emzed.query;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RowSorterTest {

    private static final List<List<Object>> ROWS = List.of(
            Arrays.asList(2, "b"),
            Arrays.asList(1, "a"),
            Arrays.asList(null, "c"),
            Arrays.asList(2, "a"),
            Arrays.asList(1.5, "d"));

    @Test
    void shouldSortAscendingWithNullsFirst() {
        assertThat(RowSorter.permutation(ROWS, new int[]{0}, true)).containsExactly(2, 1, 4, 0, 3);
    }

    @Test
    void shouldKeepOrderOfEqualKeysWhenDescending() {
        assertThat(RowSorter.permutation(ROWS, new int[]{0}, false)).containsExactly(0, 3, 4, 1, 2);
    }

    @Test
    void shouldBreakTiesWithFurtherKeys() {
        assertThat(RowSorter.permutation(ROWS, new int[]{0, 1}, true)).containsExactly(2, 1, 4, 3, 0);
    }

    @Test
    void shouldSortEmptyInput() {
        assertThat(RowSorter.permutation(List.of(), new int[]{0}, true)).isEmpty();
    }
}
