package io.emzed.core;

/**
 * A rename or add targets a column name which is already taken.
 */
public class NameCollisionException extends SchemaException {

    public NameCollisionException(String message) {
        super(message);
    }

}
