package io.emzed.storage;

import io.emzed.core.ArgumentException;
import io.emzed.core.EmzedConfiguration;
import io.emzed.core.EmzedException;
import io.emzed.core.LoadException;
import io.emzed.core.MetaKey;
import io.emzed.core.converter.ColumnTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * CSV export and import. The export is lossy: cells are written with {@code String.valueOf},
 * missing values as {@code None}.
 */
public final class CsvTableIO {

    private static final Logger log = LoggerFactory.getLogger(CsvTableIO.class);

    static final String NONE = "None";
    private static final String OUTPUT_SEPARATOR = "; ";
    private static final char QUOTE = '"';
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern COMMA_DECIMAL = Pattern.compile("[+-]?\\d*,\\d+");
    private static final Pattern SPACES = Pattern.compile(" +");

    private final EmzedConfiguration configuration;

    public CsvTableIO(EmzedConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
    }

    /**
     * Writes {@code table} to {@code path}, which must end with {@code .csv}. If the file exists,
     * {@code path.1}, {@code path.2}, ... are tried.
     *
     * @return the path written
     */
    public Path storeCsv(Table table, Path path, boolean onlyVisibleColumns) {
        if (table == null || path == null) {
            throw new IllegalArgumentException("table and path required");
        }
        if (!path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new ArgumentException(path + " has wrong file type extension");
        }
        Path target = path;
        for (int i = 1; Files.exists(target); i++) {
            log.debug("{} exists", target);
            target = path.resolveSibling(path.getFileName() + "." + i);
        }
        List<String> names = onlyVisibleColumns ? table.getVisibleCols() : table.getColNames();
        log.info("write {}", target);
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            List<String> header = new ArrayList<>(names.size());
            for (String name : names) {
                header.add(escape(name));
            }
            writer.write(String.join(OUTPUT_SEPARATOR, header));
            writer.newLine();
            for (List<Object> row : table) {
                List<String> cells = new ArrayList<>(names.size());
                for (String name : names) {
                    Object value = table.getValue(row, name);
                    cells.add(value == null ? NONE : escape(String.valueOf(value)));
                }
                writer.write(String.join(OUTPUT_SEPARATOR, cells));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new EmzedException("on writing csv file " + target, e);
        }
        return target;
    }

    public Table loadCsv(Path path) {
        return loadCsv(path, configuration.csvSeparator(), configuration.keepNoneStrings(), Map.of());
    }

    /**
     * Reads a CSV file with header line. Cells are converted to {@code Integer}, {@code Long},
     * {@code Double} (also with decimal comma) or kept as string; column types are the common type
     * of their values.
     *
     * @param separator column separator
     * @param keepNone  keep {@code None} cells as string instead of reading them as missing values
     * @param formats   formats overriding the guessed ones, by column name
     */
    public Table loadCsv(Path path, String separator, boolean keepNone, Map<String, String> formats) {
        if (path == null) {
            throw new IllegalArgumentException("path required");
        }
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator required");
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LoadException("can not read " + path, e);
        }
        if (lines.isEmpty()) {
            throw new LoadException(path + " is empty");
        }
        List<String> names = new ArrayList<>();
        for (String field : split(lines.get(0), separator)) {
            names.add(SPACES.matcher(field.trim()).replaceAll("_"));
        }
        List<List<Object>> rows = new ArrayList<>();
        for (String line : lines.subList(1, lines.size())) {
            if (line.isBlank()) {
                continue;
            }
            List<Object> row = new ArrayList<>();
            for (String field : split(line, separator)) {
                String cell = field.trim();
                row.add(!keepNone && NONE.equals(cell) ? null : bestConvert(cell));
            }
            rows.add(row);
        }

        List<Class<?>> types = new ArrayList<>(names.size());
        List<String> columnFormats = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            List<Object> column = new ArrayList<>(rows.size());
            for (List<Object> row : rows) {
                column.add(i < row.size() ? row.get(i) : null);
            }
            List<Object> converted = ColumnTypes.convertToCommonType(column);
            for (int r = 0; r < rows.size(); r++) {
                if (i < rows.get(r).size()) {
                    rows.get(r).set(i, converted.get(r));
                }
            }
            Class<?> type = ColumnTypes.commonTypeFor(converted);
            types.add(type);
            String name = names.get(i);
            columnFormats.add(formats.containsKey(name) ? formats.get(name) : ColumnFormats.guess(name, type));
        }

        Map<MetaKey, Object> meta = new HashMap<>();
        meta.put(Table.LOADED_FROM_KEY, path.toAbsolutePath().toString());
        Table table = Table.create(names, types, columnFormats, rows, path.getFileName().toString(), meta);
        table.configure(configuration);
        log.debug("loaded {} rows from {}", rows.size(), path);
        return table;
    }

    static Object bestConvert(String value) {
        if (DECIMAL.matcher(value).matches()) {
            if (value.indexOf('.') < 0 && value.indexOf('e') < 0 && value.indexOf('E') < 0) {
                try {
                    return Integer.valueOf(value);
                } catch (NumberFormatException e) {
                    try {
                        return Long.valueOf(value);
                    } catch (NumberFormatException tooLong) {
                        return Double.valueOf(value);
                    }
                }
            }
            return Double.valueOf(value);
        }
        if (COMMA_DECIMAL.matcher(value).matches()) {
            return Double.valueOf(value.replace(',', '.'));
        }
        return value;
    }

    static List<String> split(String line, String separator) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == QUOTE && i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                    field.append(QUOTE);
                    i += 2;
                    continue;
                }
                if (c == QUOTE) {
                    quoted = false;
                } else {
                    field.append(c);
                }
                i++;
            } else if (c == QUOTE && field.toString().isBlank()) {
                field.setLength(0);
                quoted = true;
                i++;
            } else if (line.startsWith(separator, i)) {
                fields.add(field.toString());
                field.setLength(0);
                i += separator.length();
            } else {
                field.append(c);
                i++;
            }
        }
        fields.add(field.toString());
        return fields;
    }

    private static String escape(String value) {
        if (value.indexOf(';') < 0 && value.indexOf(QUOTE) < 0 && value.indexOf('\n') < 0) {
            return value;
        }
        StringBuilder escaped = new StringBuilder(value.length() + 2);
        escaped.append(QUOTE);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == QUOTE) {
                escaped.append(QUOTE);
            }
            escaped.append(c);
        }
        escaped.append(QUOTE);
        return escaped.toString();
    }
}
