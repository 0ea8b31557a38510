package io.emzed.core;

/**
 * Values with a content digest which does not depend on object identity.
 * Tables fold the digest of such cells into their own {@code uniqueId()} instead of
 * serialising the cell.
 */
public interface ContentHashable {

    /**
     * Returns a stable hex encoded digest of the full content of this value.
     * Two values with equal content return equal ids, across runs.
     */
    String uniqueId();
}
