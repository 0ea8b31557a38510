package io.emzed.core;

/**
 * A column type is not allowed, or a cell value can not be converted to its column type.
 */
public class ColumnTypeException extends EmzedException {

    public ColumnTypeException(String message) {
        super(message);
    }

    public ColumnTypeException(String message, Throwable cause) {
        super(message, cause);
    }

}
