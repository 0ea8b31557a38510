package io.emzed.core.converter;

/**
 * Converts cell values to the declared type of their column.
 *
 * @param <T> the column type this converter produces
 */
public interface TypeConverter<T> {

    /**
     * Get the column type this converter handles.
     */
    Class<T> targetType();

    /**
     * Convert a non-null cell value to the column type.
     *
     * @throws io.emzed.core.ColumnTypeException if the value can not be converted
     */
    T convert(Object value);
}
