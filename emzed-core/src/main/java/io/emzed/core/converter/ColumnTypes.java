package io.emzed.core.converter;

import io.emzed.core.ColumnTypeException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Column type checks and inference.
 */
public final class ColumnTypes {

    private static final Set<Class<?>> MUTABLE_NUMBER_CONTAINERS = Set.of(
            AtomicInteger.class, AtomicLong.class, LongAdder.class, DoubleAdder.class);

    private static final Set<Class<?>> NUMERIC_TYPES = Set.of(
            Integer.class, Long.class, Double.class, Float.class);

    private ColumnTypes() {
    }

    /**
     * Rejects types which must not be declared as column types: primitive classes,
     * primitive arrays and mutable numeric containers. Cells hold boxed values only.
     *
     * @throws ColumnTypeException for a disallowed type
     */
    public static Class<?> requireAllowed(Class<?> type) {
        if (type == null) {
            throw new ColumnTypeException("column type required");
        }
        if (type.isPrimitive()) {
            throw new ColumnTypeException("primitive column type " + type.getName()
                    + " not allowed, use the boxed type");
        }
        if (type.isArray() && type.getComponentType().isPrimitive()) {
            throw new ColumnTypeException("primitive array column type " + type.getSimpleName()
                    + " not allowed");
        }
        if (MUTABLE_NUMBER_CONTAINERS.contains(type)) {
            throw new ColumnTypeException("mutable number container " + type.getSimpleName()
                    + " not allowed as column type");
        }
        return type;
    }

    public static boolean isNumeric(Class<?> type) {
        return NUMERIC_TYPES.contains(type);
    }

    /**
     * Finds the most specific type all non-null values share.
     * Mixed integral values widen to {@code Long}, integral mixed with floating point values
     * to {@code Double}. Anything else that is mixed gives {@code Object}, as does a
     * collection without non-null values.
     */
    public static Class<?> commonTypeFor(Collection<?> values) {
        Set<Class<?>> types = new LinkedHashSet<>();
        for (Object value : values) {
            if (value != null) {
                types.add(value.getClass());
            }
        }
        if (types.isEmpty()) {
            return Object.class;
        }
        if (types.size() == 1) {
            return types.iterator().next();
        }
        boolean integral = true;
        boolean numeric = true;
        for (Class<?> type : types) {
            if (type == Integer.class || type == Long.class || type == Short.class || type == Byte.class) {
                continue;
            }
            integral = false;
            if (type != Double.class && type != Float.class) {
                numeric = false;
            }
        }
        if (integral) {
            return types.contains(Long.class) ? Long.class : Integer.class;
        }
        return numeric ? Double.class : Object.class;
    }

    /**
     * Converts all values to their common type when that type has a converter.
     */
    public static List<Object> convertToCommonType(Collection<?> values) {
        Class<?> common = commonTypeFor(values);
        TypeConverterRegistry registry = TypeConverterRegistry.getInstance();
        List<Object> result = new ArrayList<>(values.size());
        for (Object value : values) {
            result.add(registry.coerce(common, value));
        }
        return result;
    }
}
