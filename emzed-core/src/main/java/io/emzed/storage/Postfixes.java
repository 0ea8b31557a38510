package io.emzed.storage;

import io.emzed.core.SchemaException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The {@code name__<k>} convention which keeps column names of joined tables apart.
 * A name without tag has the implicit tag -1; names starting with {@code __} are internal
 * and carry no tag at all.
 */
final class Postfixes {

    private Postfixes() {
    }

    /**
     * Returns {@code ""} for untagged names, {@code "__<k>"} for tagged ones and {@code null}
     * for internal names.
     */
    static String postfixOf(String name) {
        if (name.startsWith(ColumnRegistry.SEPARATOR)) {
            return null;
        }
        String[] fields = name.split(ColumnRegistry.SEPARATOR, -1);
        if (fields.length > 2) {
            throw new SchemaException("invalid column name " + name);
        }
        if (fields.length == 1) {
            return "";
        }
        return ColumnRegistry.SEPARATOR + fields[1];
    }

    static int valueOf(String postfix) {
        if (postfix.isEmpty()) {
            return -1;
        }
        String tag = postfix.substring(ColumnRegistry.SEPARATOR.length());
        try {
            return Integer.parseInt(tag);
        } catch (NumberFormatException e) {
            throw new SchemaException("postfix " + postfix + " is not numeric");
        }
    }

    static Set<String> postfixes(List<String> names) {
        Set<String> postfixes = new LinkedHashSet<>();
        for (String name : names) {
            String postfix = postfixOf(name);
            if (postfix != null) {
                postfixes.add(postfix);
            }
        }
        return postfixes;
    }

    static int max(List<String> names) {
        return postfixes(names).stream().mapToInt(Postfixes::valueOf).max().orElse(-1);
    }

    static int min(List<String> names) {
        return postfixes(names).stream().mapToInt(Postfixes::valueOf).min().orElse(-1);
    }

    /**
     * Shifts every tag by {@code by}; untagged names count as tag -1.
     */
    static List<String> incremented(List<String> names, int by) {
        List<String> result = new ArrayList<>(names.size());
        for (String name : names) {
            String postfix = postfixOf(name);
            if (postfix == null) {
                result.add(name);
                continue;
            }
            String prefix = postfix.isEmpty() ? name : name.substring(0, name.length() - postfix.length());
            result.add(prefix + ColumnRegistry.SEPARATOR + (by + valueOf(postfix)));
        }
        return result;
    }

    /**
     * Offset applied to the right table's tags in a join.
     */
    static int joinOffset(List<String> left, List<String> right) {
        return max(left) - min(right) + 1;
    }
}
