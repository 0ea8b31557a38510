package io.emzed.storage;

import io.emzed.core.converter.ColumnTypes;

import java.util.IllegalFormatException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Column display formats.
 * <p>
 * A format is either
 * <ul>
 *     <li>{@code null}, which hides the column,</li>
 *     <li>a {@link String#format} pattern starting with {@code %}, e.g. {@code "%.2f"}, or</li>
 *     <li>the name of a registered formatter, e.g. {@link #MINUTES}.</li>
 * </ul>
 * Missing values render as {@code "-"}; values a pattern can not format render as an empty string.
 */
public final class ColumnFormats {

    /**
     * Renders seconds as minutes with two decimals, e.g. {@code 90.0 -> "1.50m"}.
     */
    public static final String MINUTES = "minutes";

    /**
     * Renders the identity hash of the value in hex.
     */
    public static final String HEX_ID = "hexid";

    private static final Map<String, Function<Object, String>> NAMED = new ConcurrentHashMap<>();

    static {
        NAMED.put(MINUTES, v -> String.format(Locale.ROOT, "%.2fm", ((Number) v).doubleValue() / 60.0));
        NAMED.put(HEX_ID, v -> Integer.toHexString(System.identityHashCode(v)));
    }

    private ColumnFormats() {
    }

    /**
     * Registers a named formatter usable as column format.
     */
    public static void register(String name, Function<Object, String> formatter) {
        if (name == null || name.isEmpty() || name.startsWith("%")) {
            throw new IllegalArgumentException("name required and must not start with %");
        }
        if (formatter == null) {
            throw new IllegalArgumentException("formatter required");
        }
        NAMED.put(name, formatter);
    }

    /**
     * Default format for a new column: numeric columns named {@code m...} get five decimals,
     * numeric columns named {@code rt...} are shown in minutes, else a per type default.
     */
    public static String guess(String name, Class<?> type) {
        if (ColumnTypes.isNumeric(type)) {
            if (name.startsWith("m")) {
                return "%.5f";
            }
            if (name.startsWith("rt")) {
                return MINUTES;
            }
        }
        if (type == Integer.class || type == Long.class) {
            return "%d";
        }
        if (type == Double.class || type == Float.class) {
            return "%.2f";
        }
        return "%s";
    }

    /**
     * Builds the formatter for {@code format}. Hidden columns get a formatter returning {@code null}.
     */
    static Function<Object, String> formatter(String format) {
        if (format == null) {
            return v -> null;
        }
        if (format.startsWith("%")) {
            return v -> v == null ? "-" : interpolate(format, v);
        }
        Function<Object, String> named = NAMED.get(format);
        if (named == null) {
            return v -> v == null ? "-" : String.valueOf(v);
        }
        return v -> {
            if (v == null) {
                return "-";
            }
            try {
                return named.apply(v);
            } catch (RuntimeException e) {
                return "";
            }
        };
    }

    private static String interpolate(String format, Object value) {
        char conversion = format.charAt(format.length() - 1);
        Object argument = value;
        if (value instanceof Number n) {
            if (conversion == 'd' || conversion == 'x') {
                argument = n.longValue();
            } else if (conversion == 'f' || conversion == 'e' || conversion == 'g') {
                argument = n.doubleValue();
            }
        }
        try {
            return String.format(Locale.ROOT, format, argument);
        } catch (IllegalFormatException e) {
            return "";
        }
    }
}
