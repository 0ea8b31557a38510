package io.emzed.interchange;

import io.emzed.core.MetaKey;
import io.emzed.core.SchemaException;
import io.emzed.core.ShapeMismatchException;
import io.emzed.storage.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameConverterTest {

    private static List<Class<?>> types(Class<?>... types) {
        return List.of(types);
    }

    private static ColumnarFrame peaks() {
        return ColumnarFrame.builder()
                .column("id", List.of(1, 2, 3))
                .column("mz", Arrays.asList(100.0, Double.NaN, 300.0))
                .column("name", Arrays.asList("a", null, "c"))
                .build();
    }

    @Test
    void shouldBuildTableWithDefaultFormats() {
        Table t = FrameConverter.fromFrame(peaks());

        assertThat(t.getColNames()).containsExactly("id", "mz", "name");
        assertThat(t.getColTypes()).containsExactly(Integer.class, Double.class, String.class);
        assertThat(t.getColFormats()).containsExactly("%d", "%f", "%s");
        assertThat(t.title()).isNull();
    }

    @Test
    @DisplayName("Should read NaN as missing value")
    void shouldReadNaNAsNone() {
        Table t = FrameConverter.fromFrame(peaks());

        assertThat(t.columnValues("mz")).containsExactly(100.0, null, 300.0);
    }

    @Test
    void shouldPreferFormatsByNameOverFormatsByType() {
        Map<Object, String> formats = new LinkedHashMap<>();
        formats.put(Double.class, "%.1f");
        formats.put(Integer.class, "%03d");
        formats.put("id", "%5d");

        Table t = FrameConverter.fromFrame(peaks(), "peaks", Map.of(MetaKey.of("source"), "test"), Map.of(),
                formats);

        assertThat(t.getColFormats()).containsExactly("%5d", "%.1f", "%s");
        assertThat(t.title()).isEqualTo("peaks");
        assertThat(t.getMeta("source")).isEqualTo("test");
    }

    @Test
    void shouldConvertToGivenTypes() {
        Table t = FrameConverter.fromFrame(peaks(), null, null, Map.of("id", Double.class), null);

        assertThat(t.getColTypes()).containsExactly(Double.class, Double.class, String.class);
        assertThat(t.columnValues("id")).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void shouldHideObjectColumns() {
        ColumnarFrame frame = ColumnarFrame.builder()
                .column("mixed", Arrays.asList(1, "x"))
                .column("missing", Arrays.asList(null, null))
                .build();

        Table t = FrameConverter.fromFrame(frame);

        assertThat(t.getColTypes()).containsExactly(Object.class, Object.class);
        assertThat(t.getColFormats()).containsExactly(null, null);
        assertThat(t.getVisibleCols()).isEmpty();
    }

    @Test
    void shouldWriteMissingValuesAsNull() {
        Table t = new Table(List.of("v", "mz"), types(Integer.class, Double.class), List.of("%d", "%.2f"),
                List.of(Arrays.asList(1, Double.NaN), Arrays.asList(null, 2.0)));

        ColumnarFrame frame = FrameConverter.toFrame(t);

        assertThat(frame.columnNames()).containsExactly("v", "mz");
        assertThat(frame.numRows()).isEqualTo(2);
        assertThat(frame.column("v")).containsExactly(1, null);
        assertThat(frame.column("mz")).containsExactly(null, 2.0);
    }

    @Test
    void shouldKeepJoinPostfixes() {
        Table left = Table.toTable("id", List.of(1));
        Table joined = left.join(Table.toTable("id", List.of(2)));

        Table rebuilt = FrameConverter.fromFrame(FrameConverter.toFrame(joined));

        assertThat(rebuilt.getColNames()).containsExactly("id", "id__0");
        assertThat(rebuilt.row(0)).containsExactly(1, 2);
    }

    @Test
    void shouldRejectInvalidPostfixes() {
        ColumnarFrame frame = ColumnarFrame.builder().column("id__x", List.of(1)).build();

        assertThatThrownBy(() -> FrameConverter.fromFrame(frame)).isInstanceOf(SchemaException.class);
    }

    @Test
    void shouldBuildTableFromRows() {
        Table t = FrameConverter.fromMatrix(
                List.of(List.of(1, "a"), List.of(2L, "b")),
                List.of("n", "name"),
                Map.of(), Map.of("n", "%4d"), "matrix", null);

        assertThat(t.getColTypes()).containsExactly(Long.class, String.class);
        assertThat(t.columnValues("n")).containsExactly(1L, 2L);
        assertThat(t.getColFormats()).containsExactly("%4d", "%s");
        assertThat(t.title()).isEqualTo("matrix");
    }

    @Test
    void shouldRejectRowsOfWrongLength() {
        assertThatThrownBy(() -> FrameConverter.fromMatrix(
                List.of(List.of(1, 2), List.of(3)), List.of("a", "b"), null, null, null, null))
                .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void shouldRejectColumnsOfDifferentLength() {
        ColumnarFrame.Builder builder = ColumnarFrame.builder().column("a", List.of(1, 2));

        assertThatThrownBy(() -> builder.column("b", List.of(1)))
                .isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> builder.column("a", List.of(3, 4)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("duplicate column a");
    }

    @Test
    void shouldKeepColumnOrderOfMaps() {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("z", List.of(1));
        columns.put("a", List.of("x"));

        ColumnarFrame frame = ColumnarFrame.of(columns);

        assertThat(frame.columnNames()).containsExactly("z", "a");
        assertThat(frame.numColumns()).isEqualTo(2);
    }
}
