package io.emzed.storage;

import io.emzed.core.NameCollisionException;
import io.emzed.core.SchemaException;
import io.emzed.core.converter.ColumnTypes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ordered column names, types and formats of a table, kept as index aligned lists.
 * <p>
 * A {@code null} format hides the column when a table is printed or exported.
 */
final class ColumnRegistry {

    static final String SEPARATOR = "__";

    private final List<String> names;
    private final List<Class<?>> types;
    private final List<String> formats;
    private final Map<String, Integer> indices = new HashMap<>();

    ColumnRegistry(List<String> names, List<Class<?>> types, List<String> formats) {
        if (names == null || types == null || formats == null) {
            throw new IllegalArgumentException("names, types and formats required");
        }
        if (names.size() != types.size() || names.size() != formats.size()) {
            throw new SchemaException("got " + names.size() + " column names, " + types.size()
                    + " types and " + formats.size() + " formats");
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String name : names) {
            if (name == null || name.isEmpty()) {
                throw new SchemaException("column name required");
            }
            counts.merge(name, 1, Integer::sum);
        }
        List<String> multiples = counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .toList();
        if (!multiples.isEmpty()) {
            throw new SchemaException("multiple columns: " + String.join(", ", multiples));
        }
        for (Class<?> type : types) {
            ColumnTypes.requireAllowed(type);
        }
        this.names = new ArrayList<>(names);
        this.types = new ArrayList<>(types);
        this.formats = new ArrayList<>(formats.size());
        for (String format : formats) {
            this.formats.add(format == null || format.isEmpty() ? null : format);
        }
        reindex();
    }

    ColumnRegistry copy() {
        return new ColumnRegistry(names, types, formats);
    }

    void reindex() {
        indices.clear();
        for (int i = 0; i < names.size(); i++) {
            indices.put(names.get(i), i);
        }
    }

    int size() {
        return names.size();
    }

    List<String> names() {
        return new ArrayList<>(names);
    }

    List<Class<?>> types() {
        return new ArrayList<>(types);
    }

    List<String> formats() {
        return new ArrayList<>(formats);
    }

    String name(int index) {
        return names.get(index);
    }

    Class<?> type(int index) {
        return types.get(index);
    }

    String format(int index) {
        return formats.get(index);
    }

    boolean hasColumn(String name) {
        return indices.containsKey(name);
    }

    int getIndex(String name) {
        Integer index = indices.get(name);
        if (index == null) {
            throw new SchemaException("column with name '" + name + "' not in table");
        }
        return index;
    }

    /**
     * Fails with a message listing the expected, found and missing names.
     */
    void ensureColumns(Collection<String> required) {
        Set<String> missing = new TreeSet<>();
        Set<String> found = new TreeSet<>();
        for (String name : required) {
            if (hasColumn(name)) {
                found.add(name);
            } else {
                missing.add(name);
            }
        }
        if (missing.isEmpty()) {
            return;
        }
        String expected = String.join(", ", new TreeSet<>(required));
        String foundText = String.join(", ", found);
        if (found.isEmpty()) {
            throw new SchemaException("expected names " + expected + " but found " + foundText);
        }
        throw new SchemaException("expected names " + expected + ", found " + foundText
                + " but " + String.join(", ", missing) + " were missing");
    }

    void setType(String name, Class<?> type) {
        types.set(getIndex(name), ColumnTypes.requireAllowed(type));
    }

    void setFormat(String name, String format) {
        formats.set(getIndex(name), format);
    }

    void insert(int position, String name, Class<?> type, String format) {
        if (hasColumn(name)) {
            throw new NameCollisionException("column with name '" + name + "' already exists");
        }
        ColumnTypes.requireAllowed(type);
        names.add(position, name);
        types.add(position, type);
        formats.add(position, format);
        reindex();
    }

    void remove(int index) {
        names.remove(index);
        types.remove(index);
        formats.remove(index);
        reindex();
    }

    /**
     * Keeps the columns at {@code positions}, in that order.
     */
    ColumnRegistry select(List<Integer> positions) {
        List<String> n = new ArrayList<>(positions.size());
        List<Class<?>> t = new ArrayList<>(positions.size());
        List<String> f = new ArrayList<>(positions.size());
        for (int position : positions) {
            n.add(names.get(position));
            t.add(types.get(position));
            f.add(formats.get(position));
        }
        return new ColumnRegistry(n, t, f);
    }

    /**
     * Validates a rename without applying it: every old name must exist and appear once,
     * every new name must be unused, unique and free of the postfix separator.
     */
    void validateRename(List<Map<String, String>> renames) {
        Set<String> oldNames = new HashSet<>();
        for (Map<String, String> rename : renames) {
            for (String oldName : rename.keySet()) {
                if (!oldNames.add(oldName)) {
                    throw new SchemaException("name overlap in column names to rename: " + oldName);
                }
                if (!hasColumn(oldName)) {
                    throw new SchemaException("column '" + oldName + "' does not exist");
                }
            }
        }
        Set<String> newNames = new LinkedHashSet<>();
        for (Map<String, String> rename : renames) {
            for (String newName : rename.values()) {
                if (newName == null || newName.isEmpty()) {
                    throw new SchemaException("new column name required");
                }
                if (!newNames.add(newName)) {
                    throw new NameCollisionException("name overlap in new column names: " + newName);
                }
                if (hasColumn(newName)) {
                    throw new NameCollisionException("column " + newName + " already exists");
                }
                if (newName.contains(SEPARATOR)) {
                    throw new SchemaException("double underscore in '" + newName + "' not allowed");
                }
            }
        }
    }

    void renameUnchecked(Map<String, String> rename) {
        names.replaceAll(name -> rename.getOrDefault(name, name));
        reindex();
    }

    void replaceNames(List<String> newNames) {
        if (newNames.size() != names.size()) {
            throw new SchemaException("expected " + names.size() + " names, got " + newNames.size());
        }
        names.clear();
        names.addAll(newNames);
        reindex();
    }
}
