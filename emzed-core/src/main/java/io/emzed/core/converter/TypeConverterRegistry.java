package io.emzed.core.converter;

import io.emzed.core.ColumnTypeException;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry of cell converters.
 * <p>
 * Only the primitive cell types ({@code Integer}, {@code Long}, {@code Double},
 * {@code Float}, {@code String}) are coerced when rows are written; values of all other
 * column types, and {@code null}, are stored untouched.
 */
public final class TypeConverterRegistry {
    private static final TypeConverterRegistry INSTANCE = new TypeConverterRegistry();

    private final Map<Class<?>, TypeConverter<?>> converters = new HashMap<>();

    private TypeConverterRegistry() {
        registerDefaults();
    }

    public static TypeConverterRegistry getInstance() {
        return INSTANCE;
    }

    private void registerDefaults() {
        register(new IntegerConverter());
        register(new LongConverter());
        register(new DoubleConverter());
        register(new FloatConverter());
        register(new StringConverter());
    }

    private <T> void register(TypeConverter<T> converter) {
        converters.put(converter.targetType(), converter);
    }

    @SuppressWarnings("unchecked")
    public <T> TypeConverter<T> getConverter(Class<T> type) {
        return (TypeConverter<T>) converters.get(type);
    }

    public boolean hasConverter(Class<?> type) {
        return converters.containsKey(type);
    }

    /**
     * Converts {@code value} to {@code type} if a converter is registered for it.
     *
     * @return the converted value, or {@code value} itself for null values and types
     *         without converter
     */
    public Object coerce(Class<?> type, Object value) {
        if (value == null || type == null) {
            return value;
        }
        TypeConverter<?> converter = converters.get(type);
        if (converter == null) {
            return value;
        }
        return converter.convert(value);
    }

    private static ColumnTypeException notConvertible(Object value, Class<?> type) {
        return new ColumnTypeException("can not convert " + value.getClass().getSimpleName()
                + " value '" + value + "' to " + type.getSimpleName());
    }

    private static final class IntegerConverter implements TypeConverter<Integer> {
        @Override
        public Class<Integer> targetType() {
            return Integer.class;
        }

        @Override
        public Integer convert(Object value) {
            if (value instanceof Integer i) {
                return i;
            }
            if (value instanceof Number n) {
                double d = n.doubleValue();
                if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                    throw notConvertible(value, Integer.class);
                }
                return n.intValue();
            }
            if (value instanceof Boolean b) {
                return b ? 1 : 0;
            }
            if (value instanceof String s) {
                try {
                    return Integer.valueOf(s.trim());
                } catch (NumberFormatException e) {
                    throw new ColumnTypeException("can not convert '" + s + "' to Integer", e);
                }
            }
            throw notConvertible(value, Integer.class);
        }
    }

    private static final class LongConverter implements TypeConverter<Long> {
        @Override
        public Class<Long> targetType() {
            return Long.class;
        }

        @Override
        public Long convert(Object value) {
            if (value instanceof Long l) {
                return l;
            }
            if (value instanceof Number n) {
                return n.longValue();
            }
            if (value instanceof Boolean b) {
                return b ? 1L : 0L;
            }
            if (value instanceof String s) {
                try {
                    return Long.valueOf(s.trim());
                } catch (NumberFormatException e) {
                    throw new ColumnTypeException("can not convert '" + s + "' to Long", e);
                }
            }
            throw notConvertible(value, Long.class);
        }
    }

    private static final class DoubleConverter implements TypeConverter<Double> {
        @Override
        public Class<Double> targetType() {
            return Double.class;
        }

        @Override
        public Double convert(Object value) {
            if (value instanceof Double d) {
                return d;
            }
            if (value instanceof Number n) {
                return n.doubleValue();
            }
            if (value instanceof Boolean b) {
                return b ? 1.0 : 0.0;
            }
            if (value instanceof String s) {
                try {
                    return Double.valueOf(s.trim());
                } catch (NumberFormatException e) {
                    throw new ColumnTypeException("can not convert '" + s + "' to Double", e);
                }
            }
            throw notConvertible(value, Double.class);
        }
    }

    private static final class FloatConverter implements TypeConverter<Float> {
        @Override
        public Class<Float> targetType() {
            return Float.class;
        }

        @Override
        public Float convert(Object value) {
            if (value instanceof Float f) {
                return f;
            }
            if (value instanceof Number n) {
                return n.floatValue();
            }
            if (value instanceof Boolean b) {
                return b ? 1.0f : 0.0f;
            }
            if (value instanceof String s) {
                try {
                    return Float.valueOf(s.trim());
                } catch (NumberFormatException e) {
                    throw new ColumnTypeException("can not convert '" + s + "' to Float", e);
                }
            }
            throw notConvertible(value, Float.class);
        }
    }

    private static final class StringConverter implements TypeConverter<String> {
        @Override
        public Class<String> targetType() {
            return String.class;
        }

        @Override
        public String convert(Object value) {
            return value instanceof String s ? s : String.valueOf(value);
        }
    }
}
