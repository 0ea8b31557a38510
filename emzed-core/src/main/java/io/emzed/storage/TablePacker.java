package io.emzed.storage;

import io.emzed.core.Blob;
import io.emzed.core.EmzedException;
import io.emzed.core.MetaKey;
import io.emzed.core.TableRef;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePacker;
import org.msgpack.core.buffer.ArrayBufferOutput;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.NotSerializableException;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.nio.ByteBuffer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MessagePack packer for table payloads.
 * <p>
 * A payload is the array {@code [names, typeNames, formats, title, meta, rows]}. Cells map to
 * native MessagePack values where possible; {@code Integer} cells, blobs, nested tables, table
 * references and other serializable objects use the extension types of {@link PayloadType}.
 */
final class TablePacker extends MessagePacker {

    TablePacker() {
        super(new ArrayBufferOutput(), MessagePack.DEFAULT_PACKER_CONFIG);
    }

    byte[] toByteArray() throws IOException {
        flush();
        return ((ArrayBufferOutput) out).toByteArray();
    }

    TablePacker packTable(Table table) throws IOException {
        packArrayHeader(6);
        packStrings(table.getColNames());
        List<Class<?>> types = table.getColTypes();
        packArrayHeader(types.size());
        for (Class<?> type : types) {
            packString(TypeNames.nameOf(type));
        }
        packStrings(table.getColFormats());
        packNullableString(table.title());
        packMeta(table.meta());
        packArrayHeader(table.numRows());
        for (List<Object> row : table) {
            packArrayHeader(row.size());
            for (Object cell : row) {
                packCell(cell);
            }
        }
        return this;
    }

    private void packStrings(List<String> values) throws IOException {
        packArrayHeader(values.size());
        for (String value : values) {
            packNullableString(value);
        }
    }

    private void packNullableString(String value) throws IOException {
        if (value == null) {
            packNil();
        } else {
            packString(value);
        }
    }

    private void packMeta(Map<MetaKey, Object> meta) throws IOException {
        Map<MetaKey, Object> stored = new LinkedHashMap<>(meta);
        stored.remove(Table.UNIQUE_ID_KEY);
        packMapHeader(stored.size());
        for (Map.Entry<MetaKey, Object> entry : stored.entrySet()) {
            packCell(entry.getKey());
            packCell(entry.getValue());
        }
    }

    TablePacker packCell(Object value) throws IOException {
        if (value == null) {
            packNil();
        } else if (value instanceof Boolean b) {
            packBoolean(b);
        } else if (value instanceof Integer i) {
            packExtensionTypeHeader(PayloadType.INTEGER, Integer.BYTES);
            writePayload(ByteBuffer.allocate(Integer.BYTES).putInt(i).array());
        } else if (value instanceof Long l) {
            packLong(l);
        } else if (value instanceof Double d) {
            packDouble(d);
        } else if (value instanceof Float f) {
            packFloat(f);
        } else if (value instanceof String s) {
            packString(s);
        } else if (value instanceof MetaKey.Name name) {
            packString(name.name());
        } else if (value instanceof TableRef ref) {
            packExtensionTypeHeader(PayloadType.TABLE_REF, Long.BYTES);
            writePayload(ByteBuffer.allocate(Long.BYTES).putLong(ref.id()).array());
        } else if (value instanceof byte[] bytes) {
            packBinaryHeader(bytes.length);
            writePayload(bytes);
        } else if (value instanceof Blob blob) {
            try (TablePacker nested = new TablePacker()) {
                nested.packArrayHeader(2);
                nested.packNullableString(blob.type());
                byte[] data = blob.data();
                nested.packBinaryHeader(data.length);
                nested.writePayload(data);
                packExtension(PayloadType.BLOB, nested.toByteArray());
            }
        } else if (value instanceof Table table) {
            try (TablePacker nested = new TablePacker()) {
                packExtension(PayloadType.TABLE, nested.packTable(table).toByteArray());
            }
        } else if (value instanceof List<?> list) {
            packArrayHeader(list.size());
            for (Object item : list) {
                packCell(item);
            }
        } else if (value instanceof Map<?, ?> map) {
            packMapHeader(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                packCell(entry.getKey());
                packCell(entry.getValue());
            }
        } else if (value instanceof Serializable serializable) {
            packExtension(PayloadType.SERIALIZED, serialize(serializable));
        } else {
            throw new EmzedException("can not store value of " + value.getClass().getName()
                    + ", it is not serializable");
        }
        return this;
    }

    private void packExtension(byte type, byte[] payload) throws IOException {
        packExtensionTypeHeader(type, payload.length);
        writePayload(payload);
    }

    private static byte[] serialize(Serializable value) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        } catch (NotSerializableException e) {
            throw new EmzedException("can not store value of " + value.getClass().getName(), e);
        }
        return bytes.toByteArray();
    }
}
