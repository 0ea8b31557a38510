package io.emzed.core;

public class ShapeMismatchException extends EmzedException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    public static ShapeMismatchException of(String what, int expected, int actual) {
        return new ShapeMismatchException(what + ": expected " + expected + " but got " + actual);
    }

}
