package io.emzed.core;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * Opaque binary cell value, e.g. an image or a raw instrument file.
 */
public final class Blob implements EmbeddedValue, Serializable {

    private static final long serialVersionUID = 1L;

    private final byte[] data;
    private final String type;
    private transient String uniqueId;

    public Blob(byte[] data) {
        this(data, null);
    }

    /**
     * @param data payload, copied
     * @param type optional free text type tag, e.g. {@code "PNG"}
     */
    public Blob(byte[] data, String type) {
        if (data == null) {
            throw new IllegalArgumentException("data required");
        }
        this.data = data.clone();
        this.type = type;
    }

    public byte[] data() {
        return data.clone();
    }

    public String type() {
        return type;
    }

    public int size() {
        return data.length;
    }

    @Override
    public Blob copy() {
        return new Blob(data, type);
    }

    @Override
    public String uniqueId() {
        if (uniqueId == null) {
            uniqueId = ContentDigest.create()
                    .update(type)
                    .update(data)
                    .hex();
        }
        return uniqueId;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Blob other = (Blob) obj;
        return Objects.equals(type, other.type) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(type) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Blob{type=" + type + ", size=" + data.length + "}";
    }
}
