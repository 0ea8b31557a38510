package io.emzed.storage;

import io.emzed.core.ArgumentException;
import io.emzed.core.ContentDigest;
import io.emzed.core.ContentHashable;
import io.emzed.core.EmbeddedValue;
import io.emzed.core.EmzedConfiguration;
import io.emzed.core.MetaKey;
import io.emzed.core.SchemaException;
import io.emzed.core.ShapeMismatchException;
import io.emzed.core.TableRef;
import io.emzed.core.converter.ColumnTypes;
import io.emzed.core.converter.TypeConverterRegistry;
import io.emzed.kernel.CellComparator;
import io.emzed.kernel.ColumnData;
import io.emzed.kernel.ColumnHandle;
import io.emzed.kernel.ColumnKey;
import io.emzed.kernel.EvalResult;
import io.emzed.kernel.EvaluationContext;
import io.emzed.kernel.Expression;
import io.emzed.kernel.ExpressionBuilder;
import io.emzed.kernel.Expressions;
import io.emzed.kernel.TableView;
import io.emzed.query.JoinExecutor;
import io.emzed.query.RowGrouping;
import io.emzed.query.RowSorter;

import java.io.PrintStream;
import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * In-memory table with typed, named columns and row oriented storage.
 * <p>
 * Query operations ({@link #filter}, {@link #join}, {@link #splitBy}, ...) return new tables
 * holding copies of the selected rows. Column algebra and row edits act in place and finish
 * with {@link #resetInternals()}.
 * <p>
 * Columns are referenced in expressions through {@link #column(String)}:
 * <pre>
 * Table t = Table.toTable("mz", List.of(100.0, 200.0, 300.0));
 * Table big = t.filter(t.column("mz").ge(200.0));
 * </pre>
 * Tables are not thread safe.
 */
public class Table implements TableView, ContentHashable, Iterable<List<Object>> {

    public static final String UNIQUE_ID = "unique_id";
    public static final String LOADED_FROM = "loaded_from";

    static final MetaKey UNIQUE_ID_KEY = MetaKey.of(UNIQUE_ID);
    static final MetaKey LOADED_FROM_KEY = MetaKey.of(LOADED_FROM);

    private static final Set<String> RESERVED_NAMES = Arrays.stream(Table.class.getMethods())
            .map(Method::getName)
            .collect(Collectors.toUnmodifiableSet());

    private final TableRef ref = TableRef.next();
    private final ColumnRegistry columns;
    private final RowStore rows;
    private final Map<MetaKey, Object> meta;
    private final Map<String, Boolean> primaryIndex = new LinkedHashMap<>();
    private final Map<String, ColumnHandle> handles = new HashMap<>();
    private List<Function<Object, String>> formatters = List.of();
    private String title;
    private String version;
    private EmzedConfiguration configuration = EmzedConfiguration.defaults();

    public Table(List<String> names, List<Class<?>> types, List<String> formats) {
        this(names, types, formats, List.of(), null, null);
    }

    public Table(List<String> names, List<Class<?>> types, List<String> formats,
                 List<? extends List<?>> rows) {
        this(names, types, formats, rows, null, null);
    }

    /**
     * @param names   column names, unique and without {@code __}
     * @param types   column types
     * @param formats column formats, {@code null} or {@code ""} hides a column
     * @param rows    rows, each as long as {@code names}; copied
     * @param title   optional title
     * @param meta    optional meta data; copied
     */
    public Table(List<String> names, List<Class<?>> types, List<String> formats,
                 List<? extends List<?>> rows, String title, Map<MetaKey, ?> meta) {
        this(new ColumnRegistry(requireUserNames(names), types, formats), new RowStore(rowsOrEmpty(rows)),
                title, meta);
    }

    private Table(ColumnRegistry columns, RowStore rows, String title, Map<MetaKey, ?> meta) {
        for (int i = 0; i < columns.size(); i++) {
            checkReserved(columns.name(i));
        }
        for (int i = 0; i < rows.size(); i++) {
            int length = rows.view(i).size();
            if (length != columns.size()) {
                throw new ShapeMismatchException("row " + i + " has length " + length + ", expected "
                        + columns.size() + " values");
            }
        }
        this.columns = columns;
        this.rows = rows;
        this.title = title;
        this.meta = meta == null ? new LinkedHashMap<>() : new LinkedHashMap<>(meta);
        resetInternals();
    }

    /**
     * Builds a table without checking names for the postfix separator. Used for tables produced
     * by joins, loaders and merges whose names may carry postfixes.
     */
    static Table create(List<String> names, List<Class<?>> types, List<String> formats,
                        Collection<? extends List<?>> rows, String title, Map<MetaKey, ?> meta) {
        return new Table(new ColumnRegistry(names, types, formats), new RowStore(rowsOrEmpty(rows)), title, meta);
    }

    /**
     * Builds a table whose names may carry numeric {@code __<k>} postfixes, as produced by joins.
     *
     * @throws SchemaException for names with other uses of {@code __}
     */
    public static Table createPostfixed(List<String> names, List<Class<?>> types, List<String> formats,
                                       List<? extends List<?>> rows, String title, Map<MetaKey, ?> meta) {
        if (names == null) {
            throw new IllegalArgumentException("names required");
        }
        for (String name : names) {
            if (name != null && name.contains(ColumnRegistry.SEPARATOR)) {
                String postfix = Postfixes.postfixOf(name);
                if (postfix == null || Postfixes.valueOf(postfix) < 0) {
                    throw new SchemaException("invalid postfix in column name " + name);
                }
            }
        }
        return create(names, types, formats, rows, title, meta);
    }

    private static Collection<? extends List<?>> rowsOrEmpty(Collection<? extends List<?>> rows) {
        return rows == null ? List.of() : rows;
    }

    private static List<String> requireUserNames(List<String> names) {
        if (names == null) {
            throw new IllegalArgumentException("names required");
        }
        for (String name : names) {
            if (name != null && name.contains(ColumnRegistry.SEPARATOR)) {
                throw new SchemaException("double underscore in '" + name + "' not allowed");
            }
        }
        return names;
    }

    private static void checkReserved(String name) {
        if (RESERVED_NAMES.contains(name)) {
            throw new SchemaException("column name '" + name + "' is reserved");
        }
    }

    private static void checkUserName(String name) {
        if (name == null || name.isEmpty()) {
            throw new SchemaException("column name required");
        }
        requireUserNames(List.of(name));
        checkReserved(name);
    }

    /**
     * Builds a one column table from {@code values}, converted to their common type.
     */
    public static Table toTable(String name, Collection<?> values) {
        return toTable(name, values, "", null, null, null);
    }

    public static Table toTable(String name, Collection<?> values, Class<?> type) {
        return toTable(name, values, "", type, null, null);
    }

    /**
     * Builds a one column table.
     *
     * @param format column format, {@code ""} to guess one from name and type
     * @param type   column type; {@code null} to use the common type of the values
     */
    public static Table toTable(String name, Collection<?> values, String format, Class<?> type,
                                String title, Map<MetaKey, ?> meta) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        List<Object> cells;
        Class<?> columnType;
        if (type == null) {
            cells = ColumnTypes.convertToCommonType(values);
            columnType = ColumnTypes.commonTypeFor(cells);
        } else {
            TypeConverterRegistry registry = TypeConverterRegistry.getInstance();
            cells = new ArrayList<>(values.size());
            for (Object value : values) {
                cells.add(registry.coerce(type, value));
            }
            columnType = type;
        }
        String columnFormat = "".equals(format) ? ColumnFormats.guess(name, columnType) : format;
        List<List<Object>> rows = new ArrayList<>(cells.size());
        for (Object cell : cells) {
            rows.add(Collections.singletonList(cell));
        }
        List<String> formats = new ArrayList<>();
        formats.add(columnFormat);
        return new Table(List.of(name), List.of(columnType), formats, rows, title, meta);
    }

    /**
     * Merges tables into a new one with a common schema. See {@link TableMerger}.
     */
    public static Table mergeTables(List<Table> tables) {
        return mergeTables(tables, null, false);
    }

    /**
     * @param reference  optional table providing column names, types and formats of the result
     * @param forceMerge if true, conflicting schemas are merged with the first occurrence winning
     */
    public static Table mergeTables(List<Table> tables, Table reference, boolean forceMerge) {
        return TableMerger.merge(tables, reference, forceMerge);
    }

    /**
     * Reads a table written by {@link #store(Path)}.
     */
    public static Table load(Path path) {
        return new TableStore(EmzedConfiguration.defaults()).load(path);
    }

    public static Table loadCsv(Path path) {
        return new CsvTableIO(EmzedConfiguration.defaults()).loadCsv(path);
    }

    /**
     * Rebuilds derived state (name index, formatters, column handles) and drops the cached
     * unique id. Called by every in place mutation.
     */
    public void resetInternals() {
        columns.reindex();
        List<Function<Object, String>> rebuilt = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            rebuilt.add(ColumnFormats.formatter(columns.format(i)));
        }
        formatters = rebuilt;
        handles.clear();
        meta.remove(UNIQUE_ID_KEY);
    }

    // configuration and descriptive state

    public Table configure(EmzedConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
        return this;
    }

    public EmzedConfiguration configuration() {
        return configuration;
    }

    @Override
    public TableRef ref() {
        return ref;
    }

    @Override
    public String title() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    /**
     * The live meta mapping. Callers editing it directly should call {@link #resetInternals()}
     * afterwards so the cached unique id is recomputed.
     */
    @Override
    public Map<MetaKey, Object> meta() {
        return meta;
    }

    public Object getMeta(String key) {
        return meta.get(MetaKey.of(key));
    }

    public void putMeta(String key, Object value) {
        meta.put(MetaKey.of(key), value);
        if (!UNIQUE_ID.equals(key)) {
            meta.remove(UNIQUE_ID_KEY);
        }
    }

    /**
     * The column the rows are sorted by, as {@code {name: true}}, or an empty map.
     */
    public Map<String, Boolean> primaryIndex() {
        return Collections.unmodifiableMap(primaryIndex);
    }

    /**
     * Version of the file this table was loaded from, {@code null} for tables built in memory.
     */
    public String version() {
        return version;
    }

    void setVersion(String version) {
        this.version = version;
    }

    // schema

    @Override
    public List<String> getColNames() {
        return columns.names();
    }

    @Override
    public List<Class<?>> getColTypes() {
        return columns.types();
    }

    @Override
    public List<String> getColFormats() {
        return columns.formats();
    }

    public Class<?> getColType(String name) {
        return columns.type(getIndex(name));
    }

    public String getColFormat(String name) {
        return columns.format(getIndex(name));
    }

    public void setColType(String name, Class<?> type) {
        columns.setType(name, type);
        resetInternals();
    }

    /**
     * Sets the format of column {@code name}; {@code null} or {@code ""} hides the column.
     */
    public void setColFormat(String name, String format) {
        columns.setFormat(name, format == null || format.isEmpty() ? null : format);
        resetInternals();
    }

    /**
     * Names of the columns with a non {@code null} format.
     */
    public List<String> getVisibleCols() {
        List<String> visible = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (columns.format(i) != null) {
                visible.add(columns.name(i));
            }
        }
        return visible;
    }

    public int numCols() {
        return columns.size();
    }

    public boolean hasColumn(String name) {
        return columns.hasColumn(name);
    }

    public boolean hasColumns(String... names) {
        return Arrays.stream(names).allMatch(columns::hasColumn);
    }

    /**
     * @throws SchemaException listing expected, found and missing names
     */
    public void ensureColNames(String... names) {
        columns.ensureColumns(Arrays.asList(names));
    }

    public int getIndex(String name) {
        return columns.getIndex(name);
    }

    /**
     * Returns a handle to column {@code name} for building expressions and reading values.
     */
    public ColumnHandle column(String name) {
        int index = getIndex(name);
        return handles.computeIfAbsent(name, n -> new ColumnHandle(this, n, columns.type(index)));
    }

    @Override
    public List<Object> columnValues(String name) {
        return rows.column(getIndex(name));
    }

    @Override
    public Map<String, ColumnData> columnContext(Set<ColumnKey> needed) {
        Map<String, ColumnData> context = new HashMap<>();
        for (ColumnKey key : needed) {
            if (!key.table().equals(ref)) {
                continue;
            }
            int index = getIndex(key.name());
            context.put(key.name(), new ColumnData(rows.column(index), primaryIndex.get(key.name()),
                    columns.type(index)));
        }
        return context;
    }

    // rows

    @Override
    public int numRows() {
        return rows.size();
    }

    @Override
    public List<Object> row(int index) {
        return rows.view(index);
    }

    /**
     * Unmodifiable views of all rows.
     */
    public List<List<Object>> rows() {
        List<List<Object>> views = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            views.add(rows.view(i));
        }
        return views;
    }

    @Override
    public Iterator<List<Object>> iterator() {
        return rows().iterator();
    }

    public Object getValue(int rowIndex, String name) {
        return rows.get(rowIndex, getIndex(name));
    }

    public Object getValue(List<?> row, String name) {
        return row.get(getIndex(name));
    }

    /**
     * Returns {@code defaultValue} if the table has no column {@code name}.
     */
    public Object getValue(List<?> row, String name, Object defaultValue) {
        if (!columns.hasColumn(name)) {
            return defaultValue;
        }
        return row.get(getIndex(name));
    }

    /**
     * Values of {@code row} by column name, in column order.
     */
    public Map<String, Object> getValues(List<?> row) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            values.put(columns.name(i), row.get(i));
        }
        return values;
    }

    public Map<String, Object> getValues(int rowIndex) {
        return getValues(rows.view(rowIndex));
    }

    /**
     * Sets a cell; values for {@code Integer}, {@code Long}, {@code Double}, {@code Float} and
     * {@code String} columns are converted to the column type.
     */
    public void setValue(int rowIndex, String name, Object value) {
        checkRowIndex(rowIndex);
        int index = getIndex(name);
        rows.set(rowIndex, index, TypeConverterRegistry.getInstance().coerce(columns.type(index), value));
        primaryIndex.remove(name);
        resetInternals();
    }

    /**
     * Replaces row {@code rowIndex}, converting cells as {@link #setValue} does.
     */
    public void setRow(int rowIndex, List<?> row) {
        checkRowIndex(rowIndex);
        rows.replace(rowIndex, coerceRow(row));
        primaryIndex.clear();
        resetInternals();
    }

    /**
     * Appends a row. If the row has the wrong length or a cell can not be converted, the table
     * stays unchanged and the exception propagates.
     */
    public void addRow(List<?> row) {
        if (row == null) {
            throw new IllegalArgumentException("row required");
        }
        rows.add(Collections.nCopies(row.size(), null));
        try {
            setRow(rows.size() - 1, row);
        } catch (RuntimeException e) {
            rows.removeLast();
            resetInternals();
            throw e;
        }
    }

    private List<Object> coerceRow(List<?> row) {
        if (row == null) {
            throw new IllegalArgumentException("row required");
        }
        if (row.size() != columns.size()) {
            throw ShapeMismatchException.of("row length", columns.size(), row.size());
        }
        TypeConverterRegistry registry = TypeConverterRegistry.getInstance();
        List<Object> coerced = new ArrayList<>(row.size());
        for (int i = 0; i < row.size(); i++) {
            coerced.add(registry.coerce(columns.type(i), row.get(i)));
        }
        return coerced;
    }

    private void checkRowIndex(int rowIndex) {
        if (rowIndex < 0 || rowIndex >= rows.size()) {
            throw new IndexOutOfBoundsException("row index " + rowIndex + " not in 0.." + (rows.size() - 1));
        }
    }

    // copies

    /**
     * New table with the same schema, title, meta and configuration but no rows.
     */
    public Table buildEmptyClone() {
        Table clone = new Table(columns.copy(), new RowStore(), title, meta);
        clone.configuration = configuration;
        return clone;
    }

    /**
     * Copy with its own rows; cell values are shared.
     */
    public Table copy() {
        return selectRows(range(0, rows.size()));
    }

    /**
     * Rows {@code from} (inclusive) to {@code to} (exclusive) as new table.
     */
    public Table slice(int from, int to) {
        if (from < 0 || to > rows.size() || from > to) {
            throw new IndexOutOfBoundsException("slice " + from + ".." + to + " of " + rows.size() + " rows");
        }
        return selectRows(range(from, to));
    }

    private static List<Integer> range(int from, int to) {
        List<Integer> positions = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            positions.add(i);
        }
        return positions;
    }

    private Table selectRows(List<Integer> positions) {
        Table result = buildEmptyClone();
        for (int position : positions) {
            result.rows.add(rows.view(position));
        }
        result.primaryIndex.putAll(primaryIndex);
        result.resetInternals();
        return result;
    }

    /**
     * New table holding the given columns in the given order.
     */
    public Table extractColumns(String... names) {
        ensureColNames(names);
        List<Integer> positions = new ArrayList<>(names.length);
        for (String name : names) {
            positions.add(getIndex(name));
        }
        Table result = new Table(columns.select(positions), new RowStore(rows.project(positions)), title, meta);
        result.configuration = configuration;
        for (String name : names) {
            if (primaryIndex.containsKey(name)) {
                result.primaryIndex.put(name, primaryIndex.get(name));
            }
        }
        return result;
    }

    // column algebra

    public void addColumn(String name, Object source) {
        addColumn(name, source, null, "", null, null);
    }

    public void addColumn(String name, Object source, Class<?> type) {
        addColumn(name, source, type, "", null, null);
    }

    public void addColumn(String name, Object source, Class<?> type, String format) {
        addColumn(name, source, type, format, null, null);
    }

    /**
     * Adds a column computed from {@code source}:
     * <ul>
     *     <li>an {@link ExpressionBuilder} is evaluated against this table, single values are broadcast,</li>
     *     <li>a {@link ColumnCallback} is called once per row,</li>
     *     <li>a {@link Collection} or object array provides one value per row,</li>
     *     <li>anything else is a constant for every row.</li>
     * </ul>
     *
     * @param type         column type, {@code null} to infer it from the values
     * @param format       column format, {@code ""} to guess one, {@code null} to hide the column
     * @param insertBefore column name or position to insert before, or {@code null}
     * @param insertAfter  column name or position to insert after, or {@code null}
     */
    public void addColumn(String name, Object source, Class<?> type, String format,
                          Object insertBefore, Object insertAfter) {
        checkUserName(name);
        addColumnUnchecked(name, materialize(name, source), type, format, insertBefore, insertAfter);
    }

    public void addColumnBefore(String name, Object source, Object insertBefore) {
        addColumn(name, source, null, "", insertBefore, null);
    }

    public void addColumnAfter(String name, Object source, Object insertAfter) {
        addColumn(name, source, null, "", null, insertAfter);
    }

    /**
     * Adds {@code value} to every row as is, even if it is a collection.
     */
    public void addConstantColumn(String name, Object value) {
        addConstantColumn(name, value, null, "");
    }

    public void addConstantColumn(String name, Object value, Class<?> type, String format) {
        checkUserName(name);
        List<Object> values = new ArrayList<>(Collections.nCopies(rows.size(), value));
        Class<?> columnType = type != null ? type : value == null ? Object.class : value.getClass();
        addColumnUnchecked(name, new ColumnValues(values, columnType), columnType, format, null, null);
    }

    /**
     * Adds a column at position 0 holding the row numbers {@code 0..n-1}.
     */
    public void addEnumeration() {
        addEnumeration("id");
    }

    public void addEnumeration(String name) {
        checkUserName(name);
        List<Object> values = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            values.add(i);
        }
        int width = String.valueOf(Math.max(rows.size() - 1, 0)).length();
        String format = width > 1 ? "%" + width + "d" : "%d";
        insertColumn(0, name, values, Integer.class, format);
    }

    void addColumnUnchecked(String name, Collection<?> values, Class<?> type, String format) {
        addColumnUnchecked(name, new ColumnValues(new ArrayList<>(values), null), type, format, null, null);
    }

    private void addColumnUnchecked(String name, ColumnValues values, Class<?> type, String format,
                                    Object insertBefore, Object insertAfter) {
        if (insertBefore != null && insertAfter != null) {
            throw new ArgumentException("can not use insertBefore and insertAfter at the same time");
        }
        Class<?> columnType = type;
        List<Object> cells = values.values();
        if (columnType == null) {
            columnType = values.type() != null && values.type() != Object.class
                    ? values.type()
                    : ColumnTypes.commonTypeFor(cells);
        } else {
            TypeConverterRegistry registry = TypeConverterRegistry.getInstance();
            cells.replaceAll(value -> registry.coerce(type, value));
        }
        String columnFormat = "".equals(format) ? ColumnFormats.guess(name, columnType) : format;
        int position;
        if (insertBefore != null) {
            position = resolvePosition(insertBefore, "insertBefore");
        } else if (insertAfter != null) {
            position = resolvePosition(insertAfter, "insertAfter") + 1;
        } else {
            position = columns.size();
        }
        insertColumn(position, name, cells, columnType, columnFormat);
    }

    private void insertColumn(int position, String name, List<?> values, Class<?> type, String format) {
        if (values.size() != rows.size()) {
            throw ShapeMismatchException.of("values for column " + name, rows.size(), values.size());
        }
        columns.insert(position, name, type, format);
        rows.insertColumn(position, values);
        resetInternals();
    }

    private int resolvePosition(Object position, String what) {
        if (position instanceof String name) {
            return getIndex(name);
        }
        if (position instanceof Integer index) {
            int resolved = index < 0 ? index + columns.size() : index;
            if (resolved < 0 || resolved >= columns.size()) {
                throw new ArgumentException(what + " " + index + " out of range for " + columns.size() + " columns");
            }
            return resolved;
        }
        throw new ArgumentException(what + " must be a column name or an int position, got " + position);
    }

    private ColumnValues materialize(String name, Object source) {
        if (source instanceof ExpressionBuilder builder) {
            Expression expression = builder.expression();
            EvaluationContext context = new EvaluationContext()
                    .put(ref, columnContext(expression.neededColumns()));
            EvalResult result = expression.evaluate(context);
            List<Object> values;
            if (result.isScalar()) {
                values = new ArrayList<>(Collections.nCopies(rows.size(), result.get(0)));
            } else if (result.size() == rows.size()) {
                values = new ArrayList<>(result.values());
            } else {
                throw ShapeMismatchException.of("result of " + expression, rows.size(), result.size());
            }
            return new ColumnValues(values, result.type());
        }
        if (source instanceof ColumnCallback callback) {
            List<Object> values = new ArrayList<>(rows.size());
            for (int i = 0; i < rows.size(); i++) {
                values.add(callback.compute(this, rows.view(i), name));
            }
            return new ColumnValues(values, null);
        }
        List<Object> positional = null;
        if (source instanceof Collection<?> collection) {
            positional = new ArrayList<>(collection);
        } else if (source != null && source.getClass().isArray()) {
            int length = Array.getLength(source);
            positional = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                positional.add(Array.get(source, i));
            }
        }
        if (positional != null) {
            if (positional.size() != rows.size()) {
                throw ShapeMismatchException.of("values for column " + name, rows.size(), positional.size());
            }
            return new ColumnValues(positional, null);
        }
        return new ColumnValues(new ArrayList<>(Collections.nCopies(rows.size(), source)), null);
    }

    private record ColumnValues(List<Object> values, Class<?> type) {
    }

    public void replaceColumn(String name, Object source) {
        replaceColumn(name, source, null, "");
    }

    /**
     * Replaces column {@code name} in place, keeping its position.
     */
    public void replaceColumn(String name, Object source, Class<?> type, String format) {
        getIndex(name);
        String temporary = name + ColumnRegistry.SEPARATOR + "tmp";
        addColumnUnchecked(temporary, materialize(name, source), type, format, name, null);
        dropColumns(name);
        columns.renameUnchecked(Map.of(temporary, name));
        resetInternals();
    }

    /**
     * Replaces column {@code name} if present, else adds it.
     */
    public void updateColumn(String name, Object source) {
        updateColumn(name, source, null, "");
    }

    public void updateColumn(String name, Object source, Class<?> type, String format) {
        if (hasColumn(name)) {
            replaceColumn(name, source, type, format);
        } else {
            addColumn(name, source, type, format);
        }
    }

    /**
     * Removes columns; all names are checked before any column is removed.
     */
    public void dropColumns(String... names) {
        Set<String> unique = new LinkedHashSet<>(Arrays.asList(names));
        columns.ensureColumns(unique);
        List<Integer> positions = new ArrayList<>();
        for (String name : unique) {
            positions.add(getIndex(name));
        }
        positions.sort(Collections.reverseOrder());
        for (int position : positions) {
            columns.remove(position);
            rows.removeColumn(position);
        }
        if (columns.size() == 0) {
            rows.clear();
        }
        primaryIndex.keySet().removeAll(unique);
        resetInternals();
    }

    /**
     * Renames columns atomically: nothing is renamed if any old name is missing or given twice,
     * or any new name exists, repeats or contains {@code __}.
     */
    @SafeVarargs
    public final void renameColumns(Map<String, String>... renames) {
        List<Map<String, String>> all = Arrays.asList(renames);
        columns.validateRename(all);
        Map<String, String> merged = new HashMap<>();
        for (Map<String, String> rename : all) {
            merged.putAll(rename);
        }
        for (String newName : merged.values()) {
            checkReserved(newName);
        }
        applyRename(merged);
    }

    public void renameColumn(String oldName, String newName) {
        renameColumns(Map.of(oldName, newName));
    }

    private void applyRename(Map<String, String> rename) {
        columns.renameUnchecked(rename);
        Map<String, Boolean> renamedIndex = new LinkedHashMap<>();
        primaryIndex.forEach((name, flag) -> renamedIndex.put(rename.getOrDefault(name, name), flag));
        primaryIndex.clear();
        primaryIndex.putAll(renamedIndex);
        resetInternals();
    }

    // postfixes

    /**
     * Postfixes of all column names ({@code ""} for untagged names); internal names are ignored.
     */
    public Set<String> findPostfixes() {
        return Postfixes.postfixes(columns.names());
    }

    public int maxPostfix() {
        return Postfixes.max(columns.names());
    }

    public int minPostfix() {
        return Postfixes.min(columns.names());
    }

    /**
     * Postfixes {@code p} such that {@code prefix + p} is a column for every given prefix.
     * For columns {@code rt, rtmin, rtmax, rt1, rtmin1} and prefixes {@code rt, rtmin} this is
     * {@code ["", "1"]}.
     */
    public List<String> supportedPostfixes(String... prefixes) {
        Map<String, Integer> counts = new HashMap<>();
        for (String prefix : new LinkedHashSet<>(Arrays.asList(prefixes))) {
            for (int i = 0; i < columns.size(); i++) {
                String name = columns.name(i);
                if (name.startsWith(prefix)) {
                    counts.merge(name.substring(prefix.length()), 1, Integer::sum);
                }
            }
        }
        int required = new LinkedHashSet<>(Arrays.asList(prefixes)).size();
        return counts.entrySet().stream()
                .filter(e -> e.getValue() == required)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    /**
     * Strips the given postfixes from column names, or every {@code __...} suffix when called
     * without arguments.
     *
     * @throws SchemaException if stripping produces duplicate names
     */
    public void removePostfixes(String... postfixes) {
        List<String> renamed = new ArrayList<>(columns.size());
        for (String name : columns.names()) {
            String newName = name;
            if (postfixes.length == 0) {
                int at = name.indexOf(ColumnRegistry.SEPARATOR);
                newName = at >= 0 ? name.substring(0, at) : name;
            } else {
                for (String postfix : postfixes) {
                    if (name.endsWith(postfix)) {
                        newName = name.substring(0, name.length() - postfix.length());
                        break;
                    }
                }
            }
            renamed.add(newName);
        }
        if (new LinkedHashSet<>(renamed).size() != renamed.size()) {
            throw new SchemaException("removing postfixes " + Arrays.toString(postfixes)
                    + " results in ambiguous column names " + renamed);
        }
        for (String name : renamed) {
            if (name.isEmpty()) {
                throw new SchemaException("removing postfixes " + Arrays.toString(postfixes)
                        + " results in empty column name");
            }
            checkReserved(name);
        }
        Map<String, String> rename = new HashMap<>();
        List<String> names = columns.names();
        for (int i = 0; i < names.size(); i++) {
            rename.put(names.get(i), renamed.get(i));
        }
        columns.replaceNames(renamed);
        Map<String, Boolean> renamedIndex = new LinkedHashMap<>();
        primaryIndex.forEach((name, flag) -> renamedIndex.put(rename.get(name), flag));
        primaryIndex.clear();
        primaryIndex.putAll(renamedIndex);
        resetInternals();
    }

    /**
     * Renames postfixes, e.g. {@code {"__0": "_new"}} turns {@code mz__0} into {@code mz_new}.
     */
    public void renamePostfixes(Map<String, String> postfixes) {
        Map<String, String> collected = new LinkedHashMap<>();
        postfixes.forEach((oldPostfix, newPostfix) -> {
            for (String name : columns.names()) {
                if (name.endsWith(oldPostfix)) {
                    String newName = name.substring(0, name.length() - oldPostfix.length()) + newPostfix;
                    if (newName.contains(ColumnRegistry.SEPARATOR)) {
                        throw new SchemaException("renaming '" + name + "' results in double underscore in '"
                                + newName + "'");
                    }
                    collected.put(name, newName);
                }
            }
        });
        renameColumns(collected);
    }

    // queries

    /**
     * Rows for which {@code condition} holds, as new table. A single value condition selects
     * all or no rows.
     */
    public Table filter(Object condition) {
        Expression expression = Expressions.of(condition);
        EvaluationContext context = new EvaluationContext()
                .put(ref, columnContext(expression.neededColumns()));
        EvalResult flags = expression.evaluate(context);
        List<Integer> selected = new ArrayList<>();
        if (flags.isScalar() && rows.size() != 1) {
            if (CellComparator.isTrue(flags.get(0))) {
                selected = range(0, rows.size());
            }
        } else {
            if (flags.size() != rows.size()) {
                throw ShapeMismatchException.of("filter result size", rows.size(), flags.size());
            }
            for (int i = 0; i < flags.size(); i++) {
                if (CellComparator.isTrue(flags.get(i))) {
                    selected.add(i);
                }
            }
        }
        return selectRows(selected);
    }

    public Table join(TableView other) {
        return join(other, Boolean.TRUE, null);
    }

    public Table join(TableView other, Object condition) {
        return join(other, condition, null);
    }

    /**
     * Joins with {@code other}: all pairs of rows for which {@code condition} holds, concatenated.
     * Column names of {@code other} get their postfixes renumbered, see {@link #maxPostfix()}.
     *
     * @param title title of the result, {@code "<title> vs <other title>"} if {@code null}
     */
    public Table join(TableView other, Object condition, String title) {
        return join(other, condition, title, false);
    }

    public Table leftJoin(TableView other) {
        return leftJoin(other, Boolean.TRUE, null);
    }

    public Table leftJoin(TableView other, Object condition) {
        return leftJoin(other, condition, null);
    }

    /**
     * Like {@link #join(TableView, Object, String)}, but keeps left rows without partner, with
     * {@code null} for all columns of {@code other}.
     */
    public Table leftJoin(TableView other, Object condition, String title) {
        return join(other, condition, title, true);
    }

    private Table join(TableView other, Object condition, String title, boolean leftJoin) {
        if (other == null) {
            throw new ArgumentException("table to join with required");
        }
        Expression expression = Expressions.of(condition);
        if (other.ref().equals(ref) && !expression.neededColumns().isEmpty()) {
            throw new ArgumentException("can not join table with itself on a column condition, join with a copy");
        }
        List<String> leftNames = columns.names();
        List<String> rightNames = other.getColNames();
        List<String> names = new ArrayList<>(leftNames);
        names.addAll(Postfixes.incremented(rightNames, Postfixes.joinOffset(leftNames, rightNames)));
        List<Class<?>> types = new ArrayList<>(columns.types());
        types.addAll(other.getColTypes());
        List<String> formats = new ArrayList<>(columns.formats());
        formats.addAll(other.getColFormats());
        Map<MetaKey, Object> joinedMeta = new LinkedHashMap<>();
        joinedMeta.put(ref, withoutUniqueId(meta));
        joinedMeta.put(other.ref(), withoutUniqueId(other.meta()));
        String joinedTitle = title != null ? title : this.title + " vs " + other.title();

        List<List<Object>> joined = new JoinExecutor(configuration).join(this, other, expression, leftJoin);
        Table result = create(names, types, formats, joined, joinedTitle, joinedMeta);
        result.configuration = configuration;
        return result;
    }

    public int[] sortBy(String... names) {
        return sortBy(Arrays.asList(names), true);
    }

    /**
     * Sorts rows in place, stable for both directions. An ascending sort records
     * {@code names[0]} as primary index, a descending sort clears it.
     *
     * @return the permutation applied: new row {@code i} is old row {@code p[i]}
     */
    public int[] sortBy(List<String> names, boolean ascending) {
        if (names == null || names.isEmpty()) {
            throw new ArgumentException("column names to sort by required");
        }
        columns.ensureColumns(names);
        int[] keys = names.stream().mapToInt(this::getIndex).toArray();
        int[] permutation = RowSorter.permutation(rows(), keys, ascending);
        rows.permute(permutation);
        primaryIndex.clear();
        if (ascending) {
            primaryIndex.put(names.get(0), Boolean.TRUE);
        }
        resetInternals();
        return permutation;
    }

    /**
     * One new table per distinct combination of values in the given columns, in order of first
     * appearance.
     */
    public List<Table> splitBy(String... names) {
        ensureColNames(names);
        int[] keys = Arrays.stream(names).mapToInt(this::getIndex).toArray();
        List<Table> groups = new ArrayList<>();
        for (List<Integer> group : RowGrouping.groups(rows(), keys)) {
            groups.add(selectRows(group));
        }
        return groups;
    }

    /**
     * New table without duplicate rows; the first occurrence of each row is kept.
     */
    public Table uniqueRows() {
        return selectRows(RowGrouping.firstOccurrences(rows()));
    }

    /**
     * One row per {@link #splitBy} group: the key values and the group as table in column
     * {@code collapsed}.
     */
    public Table collapse(String... names) {
        ensureColNames(names);
        List<String> masterNames = new ArrayList<>(Arrays.asList(names));
        masterNames.add("collapsed");
        List<Class<?>> masterTypes = new ArrayList<>();
        List<String> masterFormats = new ArrayList<>();
        for (String name : names) {
            masterTypes.add(getColType(name));
            masterFormats.add(getColFormat(name));
        }
        masterTypes.add(Table.class);
        masterFormats.add("%s");

        List<List<Object>> masterRows = new ArrayList<>();
        for (Table group : splitBy(names)) {
            List<Object> keyValues = new ArrayList<>();
            List<String> parts = new ArrayList<>();
            for (String name : names) {
                Object value = group.getValue(0, name);
                keyValues.add(value);
                parts.add(name + "=" + value);
            }
            group.setTitle(String.join(", ", parts));
            List<Object> row = new ArrayList<>(keyValues);
            row.add(group);
            masterRows.add(row);
        }
        Table result = create(masterNames, masterTypes, masterFormats, masterRows, null, meta);
        result.configuration = configuration;
        return result;
    }

    public void append(TableView... tables) {
        append(Arrays.asList(tables));
    }

    /**
     * Appends the rows of {@code tables} in place. Column names and types of every table must
     * equal this table's; formats may differ. Nothing is appended if one table does not match.
     */
    public void append(Collection<? extends TableView> tables) {
        List<String> names = columns.names();
        List<Class<?>> types = columns.types();
        for (TableView table : tables) {
            if (table == null) {
                throw new IllegalArgumentException("tables must not contain null");
            }
            if (!names.equals(table.getColNames())) {
                throw new SchemaException("column names " + table.getColNames() + " do not match " + names);
            }
            if (!types.equals(table.getColTypes())) {
                throw new SchemaException("column types of table '" + table.title() + "' do not match");
            }
        }
        List<List<Object>> appended = new ArrayList<>();
        for (TableView table : tables) {
            for (int i = 0; i < table.numRows(); i++) {
                appended.add(table.row(i));
            }
        }
        rows.addAll(appended);
        primaryIndex.clear();
        resetInternals();
    }

    // identity

    /**
     * Content digest over names, types, formats, meta and all cells, cached in meta under
     * {@value #UNIQUE_ID}. Nested tables and embedded values contribute their own unique id.
     */
    @Override
    public String uniqueId() {
        Object cached = meta.get(UNIQUE_ID_KEY);
        if (cached instanceof String id) {
            return id;
        }
        ContentDigest digest = ContentDigest.create(configuration.digestAlgorithm())
                .update(columns.names())
                .update(columns.types())
                .update(columns.formats());
        Map<MetaKey, Object> hashedMeta = withoutUniqueId(meta);
        hashedMeta.replaceAll((key, value) -> value instanceof Map<?, ?> nested ? withoutUniqueId(nested) : value);
        digest.update(hashedMeta);
        for (int i = 0; i < rows.size(); i++) {
            for (Object cell : rows.view(i)) {
                digest.update(cell);
            }
        }
        String id = digest.hex();
        meta.put(UNIQUE_ID_KEY, id);
        return id;
    }

    /**
     * Copy of {@code source} without a cached unique id, keyed by {@link MetaKey} or by its name.
     */
    private static <K> Map<K, Object> withoutUniqueId(Map<K, ?> source) {
        Map<K, Object> copy = new LinkedHashMap<>(source);
        copy.remove(UNIQUE_ID_KEY);
        copy.remove(UNIQUE_ID);
        return copy;
    }

    /**
     * Replaces content equal embedded values by one shared instance.
     */
    public void compressEmbeddedValues() {
        Map<String, EmbeddedValue> canonical = new HashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            for (int j = 0; j < columns.size(); j++) {
                if (rows.get(i, j) instanceof EmbeddedValue value) {
                    EmbeddedValue shared = canonical.computeIfAbsent(value.uniqueId(), id -> value);
                    if (shared != value) {
                        rows.set(i, j, shared);
                    }
                }
            }
        }
        resetInternals();
    }

    // persistence

    public Path store(Path path) {
        return store(path, false);
    }

    /**
     * Writes this table in binary format.
     *
     * @param forceOverwrite replace an existing file
     */
    public Path store(Path path, boolean forceOverwrite) {
        new TableStore(configuration).store(this, path, forceOverwrite);
        return path;
    }

    /**
     * Writes visible columns as CSV; returns the path written, which differs from {@code path}
     * if that file exists.
     */
    public Path storeCsv(Path path) {
        return storeCsv(path, true);
    }

    public Path storeCsv(Path path, boolean onlyVisibleColumns) {
        return new CsvTableIO(configuration).storeCsv(this, path, onlyVisibleColumns);
    }

    // rendering

    String formatValue(int column, Object value) {
        return formatters.get(column).apply(value);
    }

    public String render() {
        return render(Integer.MAX_VALUE);
    }

    /**
     * Renders visible columns as text; if the table has more than {@code maxLines} rows only
     * the head and tail are shown.
     */
    public String render(int maxLines) {
        return new TablePrinter(this).render(maxLines);
    }

    public void print(PrintStream out) {
        out.print(render());
    }

    /**
     * Summary of title, meta and, per column, the number of distinct and missing values.
     */
    public String info() {
        StringBuilder info = new StringBuilder();
        info.append("table info:   title=").append(title).append('\n');
        info.append("   meta=").append(meta).append('\n');
        info.append("   rows=").append(rows.size()).append('\n');
        for (int i = 0; i < columns.size(); i++) {
            List<Object> values = rows.column(i);
            long nones = values.stream().filter(v -> v == null).count();
            long distinct = values.stream().distinct().count();
            info.append(String.format(Locale.ROOT, "   column %2d:  %3d diff vals, %3d Nones in column %-15s of type %-10s"
                            + " with format %s%n", i, distinct, nones, columns.name(i),
                    columns.type(i).getSimpleName(), columns.format(i)));
        }
        return info.toString();
    }

    @Override
    public String toString() {
        return "<Table " + ref + " '" + title + "' with " + rows.size() + " rows>";
    }
}
