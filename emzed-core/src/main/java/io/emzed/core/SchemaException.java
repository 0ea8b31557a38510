package io.emzed.core;

/**
 * Duplicate, missing or reserved column names.
 */
public class SchemaException extends EmzedException {

    public SchemaException(String message) {
        super(message);
    }

}
