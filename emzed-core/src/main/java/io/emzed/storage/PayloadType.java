package io.emzed.storage;

/**
 * MessagePack extension type codes of table payloads.
 */
final class PayloadType {

    static final byte INTEGER = 1;
    static final byte BLOB = 2;
    static final byte TABLE = 3;
    static final byte TABLE_REF = 4;
    static final byte SERIALIZED = 5;

    private PayloadType() {
    }
}
