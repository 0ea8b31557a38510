package io.emzed.core;

/**
 * Raised when a stored table can not be read by any of the supported payload readers.
 * The failures of the individual readers are attached as suppressed exceptions.
 */
public class LoadException extends EmzedException {

    public LoadException(String message) {
        super(message);
    }

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }

}
