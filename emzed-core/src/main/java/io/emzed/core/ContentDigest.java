package io.emzed.core;

import java.lang.reflect.Array;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Accumulates a deterministic digest over heterogeneous values.
 * <p>
 * Every update is prefixed with a type tag, so {@code "1"} and {@code 1} differ.
 * Integral numbers share one tag regardless of their boxed type, floating point numbers
 * another. {@link ContentHashable} values contribute their {@code uniqueId()}; maps are
 * hashed entry by entry with the entry digests sorted, so iteration order does not matter.
 * {@link TableRef} keys contribute a constant, as table identities differ between runs.
 * Other objects contribute their class name and {@code toString()}.
 */
public final class ContentDigest {

    public static final String DEFAULT_ALGORITHM = "SHA-256";

    private static final byte NULL = 0;
    private static final byte BOOLEAN = 1;
    private static final byte INTEGRAL = 2;
    private static final byte FLOATING = 3;
    private static final byte STRING = 4;
    private static final byte SEQUENCE = 5;
    private static final byte MAP = 6;
    private static final byte HASHABLE = 7;
    private static final byte BYTES = 8;
    private static final byte TYPE = 9;
    private static final byte TABLE_REF = 10;
    private static final byte OTHER = 11;

    private final String algorithm;
    private final MessageDigest digest;

    private ContentDigest(String algorithm) {
        this.algorithm = algorithm;
        this.digest = newDigest(algorithm);
    }

    public static ContentDigest create() {
        return new ContentDigest(DEFAULT_ALGORITHM);
    }

    public static ContentDigest create(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalArgumentException("algorithm required");
        }
        return new ContentDigest(algorithm);
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new EmzedException("on creating digest with algo " + algorithm, e);
        }
    }

    public ContentDigest update(Object value) {
        if (value == null) {
            digest.update(NULL);
        } else if (value instanceof Boolean b) {
            digest.update(BOOLEAN);
            digest.update((byte) (b ? 1 : 0));
        } else if (value instanceof Byte || value instanceof Short
                || value instanceof Integer || value instanceof Long) {
            digest.update(INTEGRAL);
            updateLong(((Number) value).longValue());
        } else if (value instanceof Float || value instanceof Double) {
            digest.update(FLOATING);
            updateLong(Double.doubleToLongBits(((Number) value).doubleValue()));
        } else if (value instanceof CharSequence || value instanceof Character) {
            digest.update(STRING);
            updateString(value.toString());
        } else if (value instanceof ContentHashable hashable) {
            digest.update(HASHABLE);
            updateString(hashable.uniqueId());
        } else if (value instanceof byte[] bytes) {
            digest.update(BYTES);
            updateLong(bytes.length);
            digest.update(bytes);
        } else if (value instanceof Class<?> type) {
            digest.update(TYPE);
            updateString(type.getName());
        } else if (value instanceof MetaKey.Name name) {
            digest.update(STRING);
            updateString(name.name());
        } else if (value instanceof TableRef) {
            digest.update(TABLE_REF);
        } else if (value instanceof Map<?, ?> map) {
            updateMap(map);
        } else if (value instanceof Collection<?> collection) {
            digest.update(SEQUENCE);
            updateLong(collection.size());
            for (Object item : collection) {
                update(item);
            }
        } else if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            digest.update(SEQUENCE);
            updateLong(length);
            for (int i = 0; i < length; i++) {
                update(Array.get(value, i));
            }
        } else {
            digest.update(OTHER);
            updateString(value.getClass().getName());
            updateString(value.toString());
        }
        return this;
    }

    private void updateMap(Map<?, ?> map) {
        List<byte[]> entries = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            entries.add(ContentDigest.create(algorithm)
                    .update(entry.getKey())
                    .update(entry.getValue())
                    .finish());
        }
        entries.sort(Arrays::compare);
        digest.update(MAP);
        updateLong(entries.size());
        for (byte[] entry : entries) {
            digest.update(entry);
        }
    }

    private void updateLong(long value) {
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(value).array());
    }

    private void updateString(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        updateLong(bytes.length);
        digest.update(bytes);
    }

    /**
     * Completes the digest. The instance must not be used afterwards.
     */
    public byte[] finish() {
        return digest.digest();
    }

    public String hex() {
        return HexFormat.of().formatHex(finish());
    }
}
