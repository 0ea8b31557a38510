package io.emzed.storage;

import io.emzed.core.EmzedConfiguration;
import io.emzed.core.EmzedException;
import io.emzed.core.LoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Binary table files.
 * <p>
 * A file starts with the header line {@code emzed_version=<major>.<minor>.<patch>} followed by a
 * MessagePack payload array {@code [names, typeNames, formats, title, meta, rows]}. Loading
 * tries, in order, the payload array, the attribute map payload of older versions, and an
 * attribute map spanning the whole file for files without header.
 */
public final class TableStore {

    private static final Logger log = LoggerFactory.getLogger(TableStore.class);

    public static final String VERSION = "2.0.2";

    static final String HEADER_PREFIX = "emzed_version=";

    private final EmzedConfiguration configuration;

    public TableStore(EmzedConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
    }

    /**
     * Writes {@code table} to {@code path}.
     *
     * @throws EmzedException if the file exists and {@code forceOverwrite} is false, or on I/O errors
     */
    public void store(Table table, Path path, boolean forceOverwrite) {
        if (table == null || path == null) {
            throw new IllegalArgumentException("table and path required");
        }
        if (!forceOverwrite && Files.exists(path)) {
            throw new EmzedException("file " + path + " exists, use forceOverwrite to replace it");
        }
        if (configuration.compressOnStore()) {
            table.compressEmbeddedValues();
        }
        try {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            bytes.write((HEADER_PREFIX + VERSION + "\n").getBytes(StandardCharsets.US_ASCII));
            try (TablePacker packer = new TablePacker()) {
                bytes.write(packer.packTable(table).toByteArray());
            }
            Files.write(path, bytes.toByteArray());
        } catch (IOException e) {
            throw new EmzedException("on storing table to " + path, e);
        }
        log.info("stored table with {} rows to {}", table.numRows(), path);
    }

    /**
     * Reads a table and records the file version and {@code meta["loaded_from"]}.
     *
     * @throws LoadException if no reader can make sense of the file; the failures of the
     *                       individual readers are attached as suppressed exceptions
     */
    public Table load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path required");
        }
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new LoadException("can not read " + path, e);
        }
        int newline = indexOfNewline(content);
        String version = null;
        byte[] payload = content;
        if (startsWithHeader(content) && newline > 0) {
            version = new String(content, HEADER_PREFIX.length(), newline - HEADER_PREFIX.length(),
                    StandardCharsets.US_ASCII).trim();
            payload = Arrays.copyOfRange(content, newline + 1, content.length);
        }

        List<Reader> readers = List.of(
                new Reader("payload array", version != null ? payload : null, TableUnpacker::unpackTable),
                new Reader("attribute map", version != null ? payload : null, TableUnpacker::unpackAttributeMap),
                new Reader("attribute map without header", content, TableUnpacker::unpackAttributeMap));

        LoadException failure = new LoadException("can not load table from " + path);
        for (Reader reader : readers) {
            if (reader.bytes() == null) {
                continue;
            }
            try (TableUnpacker unpacker = new TableUnpacker(reader.bytes())) {
                Table table = reader.action().read(unpacker);
                table.setVersion(version);
                table.putMeta(Table.LOADED_FROM, path.toAbsolutePath().toString());
                if (configuration.compressOnStore()) {
                    table.compressEmbeddedValues();
                }
                table.configure(configuration);
                log.info("loaded table with {} rows from {}, version {}", table.numRows(), path, version);
                return table;
            } catch (IOException | RuntimeException e) {
                log.debug("reading {} as {} failed: {}", path, reader.name(), e.toString());
                failure.addSuppressed(e);
            }
        }
        throw failure;
    }

    private static boolean startsWithHeader(byte[] content) {
        byte[] prefix = HEADER_PREFIX.getBytes(StandardCharsets.US_ASCII);
        return content.length >= prefix.length
                && Arrays.equals(content, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static int indexOfNewline(byte[] content) {
        // the header is short, older files may not have one at all
        int limit = Math.min(content.length, 64);
        for (int i = 0; i < limit; i++) {
            if (content[i] == '\n') {
                return i;
            }
        }
        return -1;
    }

    @FunctionalInterface
    private interface ReadAction {
        Table read(TableUnpacker unpacker) throws IOException;
    }

    private record Reader(String name, byte[] bytes, ReadAction action) {
    }
}
