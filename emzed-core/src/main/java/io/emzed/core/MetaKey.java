package io.emzed.core;

/**
 * Key of a table's meta mapping: either a plain name or the identity of another table
 * (joins record the meta of both source tables under their {@link TableRef}).
 */
public sealed interface MetaKey permits MetaKey.Name, TableRef {

    static MetaKey of(String name) {
        return new Name(name);
    }

    record Name(String name) implements MetaKey {
        public Name {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("name required");
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
