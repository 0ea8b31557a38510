package io.emzed.kernel;

import io.emzed.core.ShapeMismatchException;
import io.emzed.storage.Table;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnHandleTest {

    @Test
    void shouldReadCurrentValues() {
        Table t = Table.toTable("a", List.of(1, 2));
        ColumnHandle a = t.column("a");

        t.setValue(0, "a", 5);

        assertThat(t.column("a").values()).containsExactly(5, 2);
        assertThat(t.column("a").values(Integer.class)).containsExactly(5, 2);
        assertThat(a.name()).isEqualTo("a");
        assertThat(a.type()).isEqualTo(Integer.class);
    }

    @Test
    void shouldReturnUniqueValue() {
        Table t = Table.toTable("a", List.of(7, 7));

        assertThat(t.column("a").uniqueValue()).isEqualTo(7);
    }

    @Test
    void shouldRejectNonUniqueValues() {
        Table t = Table.toTable("a", List.of(7, 8));

        assertThatThrownBy(() -> t.column("a").uniqueValue())
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("expected 1 but got 2");
    }
}
