package io.emzed.storage;

import io.emzed.core.Blob;
import io.emzed.core.EmzedException;
import io.emzed.core.LoadException;
import io.emzed.core.MetaKey;
import io.emzed.logging.RecordingSlf4jServiceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableStoreTest {

    @TempDir
    Path tempDir;

    private static List<Class<?>> types(Class<?>... types) {
        return List.of(types);
    }

    private static Table spectra() {
        Table peaks = Table.toTable("mz", List.of(100.0, 200.0));
        return new Table(
                List.of("id", "count", "mz", "name", "ok", "tags", "raw", "peaks", "day"),
                types(Integer.class, Long.class, Double.class, String.class, Boolean.class, List.class, Blob.class,
                        Table.class, LocalDate.class),
                Arrays.asList("%d", "%d", "%.5f", "%s", "%s", "%s", null, "%s", "%s"),
                List.of(
                        Arrays.asList(1, 10L, 100.5, "first", true, List.of(1, 2), new Blob(new byte[]{1, 2}, "raw"),
                                peaks, LocalDate.of(2020, 1, 31)),
                        Arrays.asList(2, null, null, null, false, List.of(), new Blob(new byte[]{1, 2}, "raw"),
                                null, null)),
                "spectra", Map.of(MetaKey.of("instrument"), "orbitrap"));
    }

    @BeforeEach
    void clearLog() {
        RecordingSlf4jServiceProvider.clear();
    }

    @Test
    @DisplayName("Should restore schema, title, meta and cells")
    void shouldRoundTripTables() {
        Table original = spectra();
        Path path = original.store(tempDir.resolve("spectra.table"));

        Table loaded = Table.load(path);

        assertThat(loaded.getColNames()).isEqualTo(original.getColNames());
        assertThat(loaded.getColTypes()).isEqualTo(original.getColTypes());
        assertThat(loaded.getColFormats()).isEqualTo(original.getColFormats());
        assertThat(loaded.title()).isEqualTo("spectra");
        assertThat(loaded.getMeta("instrument")).isEqualTo("orbitrap");
        assertThat(loaded.getMeta(Table.LOADED_FROM)).isEqualTo(path.toAbsolutePath().toString());
        assertThat(loaded.version()).isEqualTo(TableStore.VERSION);
        assertThat(loaded.row(0).subList(0, 7)).isEqualTo(original.row(0).subList(0, 7));
        assertThat(loaded.row(1)).isEqualTo(original.row(1));
        assertThat(loaded.getValue(0, "day")).isEqualTo(LocalDate.of(2020, 1, 31));
        assertThat(((Table) loaded.getValue(0, "peaks")).uniqueId())
                .isEqualTo(((Table) original.getValue(0, "peaks")).uniqueId());
    }

    @Test
    @DisplayName("Should restore blobs inside tables nested in tables")
    void shouldRoundTripNestedTablesWithBlobs() {
        Table inner = new Table(List.of("raw"), types(Blob.class), Arrays.asList((String) null),
                List.of(List.of(new Blob(new byte[]{7, 8, 9}, "scan"))));
        Table middle = new Table(List.of("inner"), types(Table.class), List.of("%s"),
                List.of(List.of(inner), List.of(inner)));
        Table outer = new Table(List.of("middle"), types(Table.class), List.of("%s"), List.of(List.of(middle)));

        Table loaded = Table.load(outer.store(tempDir.resolve("nested.table")));

        Table loadedMiddle = (Table) loaded.getValue(0, "middle");
        assertThat(loadedMiddle.numRows()).isEqualTo(2);
        Table loadedInner = (Table) loadedMiddle.getValue(1, "inner");
        assertThat(loadedInner.getValue(0, "raw")).isEqualTo(new Blob(new byte[]{7, 8, 9}, "scan"));
        assertThat(loadedInner.uniqueId()).isEqualTo(inner.uniqueId());
    }

    @Test
    void shouldKeepIntegerAndLongCellsApart() {
        Table loaded = Table.load(spectra().store(tempDir.resolve("t.table")));

        assertThat(loaded.getValue(0, "id")).isInstanceOf(Integer.class);
        assertThat(loaded.getValue(0, "count")).isInstanceOf(Long.class);
    }

    @Test
    @DisplayName("Should share one instance for equal blobs after loading")
    void shouldCompressBlobs() {
        Table loaded = Table.load(spectra().store(tempDir.resolve("t.table")));

        assertThat(loaded.getValue(0, "raw")).isSameAs(loaded.getValue(1, "raw"));
    }

    @Test
    void shouldRefuseToOverwriteUnlessForced() {
        Table t = spectra();
        Path path = t.store(tempDir.resolve("t.table"));

        assertThatThrownBy(() -> t.store(path))
                .isInstanceOf(EmzedException.class)
                .hasMessageContaining("exists");

        t.setTitle("changed");
        t.store(path, true);

        assertThat(Table.load(path).title()).isEqualTo("changed");
    }

    @Test
    void shouldStoreJoinProvenance() {
        Table left = Table.toTable("a", List.of(1));
        Table right = Table.toTable("b", List.of(2));
        Table joined = left.join(right);

        Table loaded = Table.load(joined.store(tempDir.resolve("joined.table")));

        assertThat(loaded.getColNames()).containsExactly("a", "b__0");
        assertThat(loaded.meta()).containsKeys(left.ref(), right.ref());
    }

    @Test
    void shouldNotStoreCachedUniqueId() throws IOException {
        Table t = spectra();
        t.uniqueId();
        Path path = t.store(tempDir.resolve("t.table"));

        assertThat(new String(Files.readAllBytes(path), StandardCharsets.ISO_8859_1)).doesNotContain(Table.UNIQUE_ID);
    }

    @Test
    void shouldRejectValuesThatCanNotBeSerialized() {
        Table t = new Table(List.of("thing"), types(Object.class), Arrays.asList("%s"),
                List.of(List.of(new Object())));
        Path path = tempDir.resolve("t.table");

        assertThatThrownBy(() -> t.store(path))
                .isInstanceOf(EmzedException.class)
                .hasMessageContaining("java.lang.Object");
        assertThat(path).doesNotExist();
    }

    @Test
    @DisplayName("Should read attribute map payloads with header")
    void shouldLoadLegacyAttributeMap() throws IOException {
        Path path = tempDir.resolve("legacy.table");
        byte[] header = "emzed_version=1.3.8\n".getBytes(StandardCharsets.US_ASCII);
        Files.write(path, concat(header, legacyPayload("_colNames")));

        Table loaded = Table.load(path);

        assertThat(loaded.version()).isEqualTo("1.3.8");
        assertThat(loaded.getColNames()).containsExactly("id", "mz");
        assertThat(loaded.getColTypes()).containsExactly(Integer.class, Double.class);
        assertThat(loaded.title()).isEqualTo("old");
        assertThat(loaded.row(0)).containsExactly(1, 100.0);
    }

    @Test
    void shouldLoadLegacyAttributeMapWithoutHeader() throws IOException {
        Path path = tempDir.resolve("older.table");
        Files.write(path, legacyPayload("colNames"));

        Table loaded = Table.load(path);

        assertThat(loaded.version()).isNull();
        assertThat(loaded.row(1)).containsExactly(2, null);
    }

    @Test
    @DisplayName("Should report every failed reader")
    void shouldFailOnGarbage() throws IOException {
        Path path = tempDir.resolve("garbage.table");
        Files.write(path, "emzed_version=2.0.2\nthis is not a table".getBytes(StandardCharsets.US_ASCII));

        assertThatThrownBy(() -> Table.load(path))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("garbage.table")
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(3));
    }

    @Test
    void shouldFailOnMissingColumnAttributes() throws IOException {
        Path path = tempDir.resolve("partial.table");
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            packer.packMapHeader(1);
            packer.packString("title");
            packer.packString("no columns");
            Files.write(path, packer.toByteArray());
        }

        assertThatThrownBy(() -> Table.load(path))
                .isInstanceOf(LoadException.class)
                .satisfies(e -> assertThat(e.getSuppressed()[0]).hasMessageContaining("internal mismatch"));
    }

    @Test
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> Table.load(tempDir.resolve("missing.table")))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("can not read");
    }

    @Test
    void shouldLogStoreAndLoad() {
        Path path = spectra().store(tempDir.resolve("t.table"));
        Table.load(path);

        assertThat(RecordingSlf4jServiceProvider.events())
                .anyMatch(line -> line.startsWith("INFO TableStore - stored table with 2 rows to "))
                .anyMatch(line -> line.startsWith("INFO TableStore - loaded table with 2 rows from ")
                        && line.endsWith("version 2.0.2"));
    }

    private static byte[] legacyPayload(String namesKey) throws IOException {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            packer.packMapHeader(6);
            packer.packString(namesKey);
            packer.packArrayHeader(2).packString("id").packString("mz");
            packer.packString("colTypes");
            packer.packArrayHeader(2).packString("int").packString("float");
            packer.packString("colFormats");
            packer.packArrayHeader(2).packString("%d").packString("%.2f");
            packer.packString("title");
            packer.packString("old");
            packer.packString("version");
            packer.packString("1.3.8");
            packer.packString("rows");
            packer.packArrayHeader(2);
            packer.packArrayHeader(2).packLong(1).packDouble(100.0);
            packer.packArrayHeader(2).packLong(2).packNil();
            return packer.toByteArray();
        }
    }

    private static byte[] concat(byte[] first, byte[] second) {
        byte[] result = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, result, first.length, second.length);
        return result;
    }
}
