package io.emzed.storage;

import io.emzed.core.LoadException;

import java.util.Map;

/**
 * Column type names in stored payloads: Java class names, plus the short names older files use.
 */
final class TypeNames {

    private static final Map<String, Class<?>> ALIASES = Map.of(
            "int", Integer.class,
            "long", Long.class,
            "float", Double.class,
            "str", String.class,
            "unicode", String.class,
            "bool", Boolean.class,
            "object", Object.class,
            "Table", Table.class);

    private TypeNames() {
    }

    static String nameOf(Class<?> type) {
        return type.getName();
    }

    static Class<?> typeOf(String name) {
        Class<?> alias = ALIASES.get(name);
        if (alias != null) {
            return alias;
        }
        try {
            return Class.forName(name, false, TypeNames.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new LoadException("unknown column type " + name, e);
        }
    }
}
