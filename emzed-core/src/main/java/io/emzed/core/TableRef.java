package io.emzed.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of a table instance, used as key in evaluation contexts and in join meta data.
 */
public record TableRef(long id) implements MetaKey {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    public TableRef {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative");
        }
    }

    public static TableRef next() {
        return new TableRef(SEQUENCE.incrementAndGet());
    }

    @Override
    public String toString() {
        return "TableRef#" + id;
    }
}
