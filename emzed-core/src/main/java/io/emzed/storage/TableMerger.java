package io.emzed.storage;

import io.emzed.core.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Concatenates tables with differing columns.
 * <p>
 * The result schema comes from a reference table or is inferred from the inputs: names in
 * order of first appearance, type and format of the first occurrence. Inference fails on
 * conflicting types, formats or column orders unless merging is forced. Each input is extended
 * with {@code null} columns for names it lacks, reordered to the result schema and, where a
 * column type differs, converted to the schema type.
 */
final class TableMerger {

    private static final Logger log = LoggerFactory.getLogger(TableMerger.class);

    private TableMerger() {
    }

    static Table merge(List<Table> tables, Table reference, boolean forceMerge) {
        if (tables == null || tables.isEmpty()) {
            throw new IllegalArgumentException("tables required");
        }
        Schema schema = reference != null ? Schema.of(reference) : infer(tables, forceMerge);
        List<Table> extended = new ArrayList<>(tables.size());
        for (Table table : tables) {
            Table candidate = table;
            List<String> missing = new ArrayList<>();
            for (String name : schema.names()) {
                if (!table.hasColumn(name)) {
                    missing.add(name);
                }
            }
            if (!missing.isEmpty()) {
                candidate = table.copy();
                for (String name : missing) {
                    Column column = schema.columns().get(name);
                    candidate.addColumnUnchecked(name, Collections.nCopies(candidate.numRows(), null),
                            column.type(), column.format());
                }
            }
            Table reordered = candidate.extractColumns(schema.names().toArray(String[]::new));
            for (String name : schema.names()) {
                Column column = schema.columns().get(name);
                if (!column.type().equals(reordered.getColType(name))) {
                    reordered.replaceColumn(name, reordered.columnValues(name), column.type(), column.format());
                }
            }
            extended.add(reordered);
        }
        Table result = extended.get(0);
        result.append(extended.subList(1, extended.size()));
        log.debug("merged {} tables into {} rows", tables.size(), result.numRows());
        return result;
    }

    private static Schema infer(List<Table> tables, boolean forceMerge) {
        Map<String, Column> columns = new LinkedHashMap<>();
        List<String> order = new ArrayList<>();
        for (Table table : tables) {
            List<String> names = table.getColNames();
            List<Class<?>> types = table.getColTypes();
            List<String> formats = table.getColFormats();
            for (int i = 0; i < names.size(); i++) {
                String name = names.get(i);
                Column seen = columns.get(name);
                if (seen == null) {
                    columns.put(name, new Column(types.get(i), formats.get(i)));
                    order.add(name);
                    continue;
                }
                if (forceMerge) {
                    continue;
                }
                if (!seen.type().equals(types.get(i))) {
                    throw new SchemaException("column " + name + " has conflicting types "
                            + seen.type().getSimpleName() + " and " + types.get(i).getSimpleName());
                }
                if (!Objects.equals(seen.format(), formats.get(i))) {
                    throw new SchemaException("column " + name + " has conflicting formats "
                            + seen.format() + " and " + formats.get(i));
                }
            }
            if (!forceMerge) {
                checkOrder(order, names);
            }
        }
        return new Schema(order, columns);
    }

    // shared names must appear in the same relative order in every table
    private static void checkOrder(List<String> order, List<String> names) {
        List<String> shared = new ArrayList<>();
        for (String name : order) {
            if (names.contains(name)) {
                shared.add(name);
            }
        }
        List<String> inTable = new ArrayList<>();
        for (String name : names) {
            if (shared.contains(name)) {
                inTable.add(name);
            }
        }
        if (!shared.equals(inTable)) {
            throw new SchemaException("column order " + inTable + " conflicts with " + shared);
        }
    }

    private record Column(Class<?> type, String format) {
    }

    private record Schema(List<String> names, Map<String, Column> columns) {
        static Schema of(Table reference) {
            Map<String, Column> columns = new LinkedHashMap<>();
            List<String> names = reference.getColNames();
            for (String name : names) {
                columns.put(name, new Column(reference.getColType(name), reference.getColFormat(name)));
            }
            return new Schema(names, columns);
        }
    }
}
