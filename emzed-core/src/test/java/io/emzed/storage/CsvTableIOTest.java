package io.emzed.storage;

import io.emzed.core.ArgumentException;
import io.emzed.core.EmzedConfiguration;
import io.emzed.core.LoadException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvTableIOTest {

    @TempDir
    Path tempDir;

    private static List<Class<?>> types(Class<?>... types) {
        return List.of(types);
    }

    private Path write(String name, String... lines) throws IOException {
        Path path = tempDir.resolve(name);
        Files.write(path, List.of(lines), StandardCharsets.UTF_8);
        return path;
    }

    @Nested
    class Store {

        private final Table table = new Table(
                List.of("id", "name", "hidden"),
                types(Integer.class, String.class, Double.class),
                Arrays.asList("%d", "%s", null),
                List.of(
                        Arrays.asList(1, "a;b", 0.5),
                        Arrays.asList(2, null, 1.5),
                        Arrays.asList(3, "say \"hi\"", null)));

        @Test
        void shouldWriteVisibleColumnsWithQuoting() throws IOException {
            Path written = table.storeCsv(tempDir.resolve("t.csv"));

            assertThat(written).isEqualTo(tempDir.resolve("t.csv"));
            assertThat(Files.readAllLines(written, StandardCharsets.UTF_8)).containsExactly(
                    "id; name",
                    "1; \"a;b\"",
                    "2; None",
                    "3; \"say \"\"hi\"\"\"");
        }

        @Test
        void shouldWriteHiddenColumnsOnRequest() throws IOException {
            Path written = table.storeCsv(tempDir.resolve("all.csv"), false);

            assertThat(Files.readAllLines(written, StandardCharsets.UTF_8))
                    .first().isEqualTo("id; name; hidden");
            assertThat(Files.readAllLines(written, StandardCharsets.UTF_8))
                    .last().isEqualTo("3; \"say \"\"hi\"\"\"; None");
        }

        @Test
        void shouldNotOverwriteExistingFiles() throws IOException {
            Path path = write("t.csv", "existing");

            Path first = table.storeCsv(path);
            Path second = table.storeCsv(path);

            assertThat(first).hasFileName("t.csv.1");
            assertThat(second).hasFileName("t.csv.2");
            assertThat(Files.readAllLines(path)).containsExactly("existing");
        }

        @Test
        void shouldRejectOtherExtensions() {
            assertThatThrownBy(() -> table.storeCsv(tempDir.resolve("t.txt")))
                    .isInstanceOf(ArgumentException.class)
                    .hasMessageContaining("wrong file type extension");
        }

        @Test
        void shouldReadBackWhatWasWritten() {
            Table loaded = Table.loadCsv(table.storeCsv(tempDir.resolve("t.csv")));

            assertThat(loaded.getColNames()).containsExactly("id", "name");
            assertThat(loaded.getColTypes()).containsExactly(Integer.class, String.class);
            assertThat(loaded.columnValues("name")).containsExactly("a;b", null, "say \"hi\"");
        }
    }

    @Nested
    class Load {

        @Test
        void shouldConvertCellsAndGuessTypes() throws IOException {
            Path path = write("peaks.csv",
                    "id; mz; peak area; name",
                    "1; 100,5; 3000000000; first",
                    "2; None; 12; None",
                    "3; 2e3; 7; third");

            Table t = Table.loadCsv(path);

            assertThat(t.getColNames()).containsExactly("id", "mz", "peak_area", "name");
            assertThat(t.getColTypes()).containsExactly(Integer.class, Double.class, Long.class, String.class);
            assertThat(t.row(0)).containsExactly(1, 100.5, 3000000000L, "first");
            assertThat(t.row(1)).containsExactly(2, null, 12L, null);
            assertThat(t.getValue(2, "mz")).isEqualTo(2000.0);
            assertThat(t.getColFormats()).containsExactly("%d", "%.5f", "%d", "%s");
        }

        @Test
        void shouldSetTitleAndOrigin() throws IOException {
            Path path = write("peaks.csv", "a", "1");

            Table t = Table.loadCsv(path);

            assertThat(t.title()).isEqualTo("peaks.csv");
            assertThat(t.getMeta(Table.LOADED_FROM)).isEqualTo(path.toAbsolutePath().toString());
        }

        @Test
        void shouldWidenMixedNumbers() throws IOException {
            Table t = Table.loadCsv(write("t.csv", "v", "1", "2.5"));

            assertThat(t.getColTypes()).containsExactly(Double.class);
            assertThat(t.columnValues("v")).containsExactly(1.0, 2.5);
        }

        @Test
        void shouldKeepNoneStringsOnRequest() throws IOException {
            Path path = write("t.csv", "a, b", "None, 1");
            CsvTableIO io = new CsvTableIO(EmzedConfiguration.defaults());

            Table t = io.loadCsv(path, ",", true, Map.of("b", "%03d"));

            assertThat(t.row(0)).containsExactly("None", 1);
            assertThat(t.getColFormats()).containsExactly("%s", "%03d");
        }

        @Test
        void shouldUseConfiguredSeparator() throws IOException {
            Path path = write("t.csv", "a,b", "1,\"x, y\"");
            CsvTableIO io = new CsvTableIO(EmzedConfiguration.builder().csvSeparator(",").build());

            Table t = io.loadCsv(path);

            assertThat(t.row(0)).containsExactly(1, "x, y");
        }

        @Test
        void shouldFailOnEmptyFile() throws IOException {
            Path path = write("empty.csv");

            assertThatThrownBy(() -> Table.loadCsv(path))
                    .isInstanceOf(LoadException.class)
                    .hasMessageContaining("is empty");
        }

        @Test
        void shouldFailOnMissingFile() {
            assertThatThrownBy(() -> Table.loadCsv(tempDir.resolve("missing.csv")))
                    .isInstanceOf(LoadException.class);
        }
    }

    @Test
    void shouldSplitQuotedFields() {
        assertThat(CsvTableIO.split("a; \"b; c\"; \"d\"\"e\"", ";"))
                .containsExactly("a", "b; c", "d\"e");
    }

    @Test
    void shouldConvertCellsToTheBestType() {
        assertThat(CsvTableIO.bestConvert("42")).isEqualTo(42);
        assertThat(CsvTableIO.bestConvert("-7")).isEqualTo(-7);
        assertThat(CsvTableIO.bestConvert("12345678901")).isEqualTo(12345678901L);
        assertThat(CsvTableIO.bestConvert("1.5")).isEqualTo(1.5);
        assertThat(CsvTableIO.bestConvert(".5")).isEqualTo(0.5);
        assertThat(CsvTableIO.bestConvert("1,5")).isEqualTo(1.5);
        assertThat(CsvTableIO.bestConvert("abc")).isEqualTo("abc");
        assertThat(CsvTableIO.bestConvert("")).isEqualTo("");
    }
}
