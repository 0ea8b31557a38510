package io.emzed.core;

/**
 * Invalid combination of arguments, e.g. mutually exclusive options or a join partner
 * which can not provide column data.
 */
public class ArgumentException extends EmzedException {

    public ArgumentException(String message) {
        super(message);
    }

}
