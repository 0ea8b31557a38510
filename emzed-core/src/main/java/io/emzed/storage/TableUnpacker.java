package io.emzed.storage;

import io.emzed.core.Blob;
import io.emzed.core.LoadException;
import io.emzed.core.MetaKey;
import io.emzed.core.TableRef;
import io.emzed.core.converter.TypeConverterRegistry;
import org.msgpack.core.ExtensionTypeHeader;
import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.core.buffer.ArrayBufferInput;
import org.msgpack.value.ValueType;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads what {@link TablePacker} writes, and the attribute map payloads of older files.
 */
final class TableUnpacker extends MessageUnpacker {

    TableUnpacker(byte[] bytes) {
        super(new ArrayBufferInput(bytes), MessagePack.DEFAULT_UNPACKER_CONFIG);
    }

    /**
     * Reads a payload array {@code [names, typeNames, formats, title, meta, rows]}.
     */
    Table unpackTable() throws IOException {
        int fields = unpackArrayHeader();
        if (fields != 6) {
            throw new LoadException("expected 6 payload fields, got " + fields);
        }
        List<String> names = unpackStrings();
        List<Class<?>> types = unpackTypes();
        List<String> formats = unpackStrings();
        String title = unpackNullableString();
        Map<MetaKey, Object> meta = unpackMeta();
        List<List<Object>> rows = unpackRows();
        return Table.create(names, types, formats, rows, title, meta);
    }

    /**
     * Reads an attribute map payload of files written before the payload array was introduced.
     * Column attributes are accepted under {@code colNames}, {@code colTypes}, {@code colFormats}
     * or with a leading underscore.
     */
    Table unpackAttributeMap() throws IOException {
        if (getNextFormat().getValueType() != ValueType.MAP) {
            throw new LoadException("expected attribute map, got " + getNextFormat());
        }
        int size = unpackMapHeader();
        List<String> names = null;
        List<Class<?>> types = null;
        List<String> formats = null;
        String title = null;
        Map<MetaKey, Object> meta = new LinkedHashMap<>();
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            String key = unpackString();
            switch (key) {
                case "colNames", "_colNames" -> names = unpackStrings();
                case "colTypes", "_colTypes" -> types = unpackTypes();
                case "colFormats", "_colFormats" -> formats = unpackStrings();
                case "title" -> title = unpackNullableString();
                case "meta" -> meta = unpackMeta();
                case "rows" -> rows = unpackRows();
                default -> skipValue();
            }
        }
        if (names == null || types == null || formats == null) {
            throw new LoadException("internal mismatch: column names, types and formats required");
        }
        // older files store all integral numbers alike
        TypeConverterRegistry registry = TypeConverterRegistry.getInstance();
        for (List<Object> row : rows) {
            for (int i = 0; i < row.size() && i < types.size(); i++) {
                row.set(i, registry.coerce(types.get(i), row.get(i)));
            }
        }
        return Table.create(names, types, formats, rows, title, meta);
    }

    private List<String> unpackStrings() throws IOException {
        int size = unpackArrayHeader();
        List<String> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(unpackNullableString());
        }
        return values;
    }

    private List<Class<?>> unpackTypes() throws IOException {
        int size = unpackArrayHeader();
        List<Class<?>> types = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            types.add(TypeNames.typeOf(unpackString()));
        }
        return types;
    }

    private String unpackNullableString() throws IOException {
        if (tryUnpackNil()) {
            return null;
        }
        return unpackString();
    }

    private Map<MetaKey, Object> unpackMeta() throws IOException {
        int size = unpackMapHeader();
        Map<MetaKey, Object> meta = new LinkedHashMap<>();
        for (int i = 0; i < size; i++) {
            Object key = unpackCell();
            MetaKey metaKey = key instanceof TableRef ref ? ref : MetaKey.of(String.valueOf(key));
            meta.put(metaKey, unpackCell());
        }
        return meta;
    }

    private List<List<Object>> unpackRows() throws IOException {
        int size = unpackArrayHeader();
        List<List<Object>> rows = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            int length = unpackArrayHeader();
            List<Object> row = new ArrayList<>(length);
            for (int j = 0; j < length; j++) {
                row.add(unpackCell());
            }
            rows.add(row);
        }
        return rows;
    }

    Object unpackCell() throws IOException {
        MessageFormat format = getNextFormat();
        switch (format.getValueType()) {
            case NIL:
                unpackNil();
                return null;
            case BOOLEAN:
                return unpackBoolean();
            case INTEGER:
                return unpackLong();
            case FLOAT:
                return format == MessageFormat.FLOAT32 ? (Object) unpackFloat() : (Object) unpackDouble();
            case STRING:
                return unpackString();
            case BINARY:
                return readPayload(unpackBinaryHeader());
            case ARRAY: {
                int size = unpackArrayHeader();
                List<Object> values = new ArrayList<>(size);
                for (int i = 0; i < size; i++) {
                    values.add(unpackCell());
                }
                return values;
            }
            case MAP: {
                int size = unpackMapHeader();
                Map<Object, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < size; i++) {
                    Object key = unpackCell();
                    values.put(key, unpackCell());
                }
                return values;
            }
            case EXTENSION:
                return unpackExtension();
            default:
                throw new LoadException("unsupported value format " + format);
        }
    }

    private Object unpackExtension() throws IOException {
        ExtensionTypeHeader header = unpackExtensionTypeHeader();
        byte[] payload = readPayload(header.getLength());
        switch (header.getType()) {
            case PayloadType.INTEGER:
                return ByteBuffer.wrap(payload).getInt();
            case PayloadType.TABLE_REF:
                return new TableRef(ByteBuffer.wrap(payload).getLong());
            case PayloadType.BLOB: {
                try (TableUnpacker nested = new TableUnpacker(payload)) {
                    nested.unpackArrayHeader();
                    String type = nested.unpackNullableString();
                    byte[] data = nested.readPayload(nested.unpackBinaryHeader());
                    return new Blob(data, type);
                }
            }
            case PayloadType.TABLE: {
                try (TableUnpacker nested = new TableUnpacker(payload)) {
                    return nested.unpackTable();
                }
            }
            case PayloadType.SERIALIZED:
                return deserialize(payload);
            default:
                throw new LoadException("unknown extension type " + header.getType());
        }
    }

    private static Object deserialize(byte[] payload) throws IOException {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(payload))) {
            return in.readObject();
        } catch (ClassNotFoundException e) {
            throw new LoadException("class of stored value not found", e);
        }
    }
}
