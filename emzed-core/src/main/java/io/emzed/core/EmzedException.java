package io.emzed.core;

/**
 * Root of all failures raised by the table engine.
 */
public class EmzedException extends RuntimeException {

    public EmzedException(Throwable cause) {
        super(cause);
    }

    public EmzedException(String message, Throwable cause) {
        super(message, cause);
    }

    public EmzedException(String message) {
        super(message);
    }

}
