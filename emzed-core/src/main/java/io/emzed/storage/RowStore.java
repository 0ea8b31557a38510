package io.emzed.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Ordered rows of a table. Rows handed out are unmodifiable views; rows taken in are copied.
 */
final class RowStore {

    private List<List<Object>> rows;

    RowStore() {
        this.rows = new ArrayList<>();
    }

    RowStore(Collection<? extends List<?>> rows) {
        this.rows = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            this.rows.add(new ArrayList<>(row));
        }
    }

    int size() {
        return rows.size();
    }

    List<Object> view(int index) {
        return Collections.unmodifiableList(rows.get(index));
    }

    List<Object> copyOf(int index) {
        return new ArrayList<>(rows.get(index));
    }

    Object get(int row, int column) {
        return rows.get(row).get(column);
    }

    void set(int row, int column, Object value) {
        rows.get(row).set(column, value);
    }

    void add(List<?> row) {
        rows.add(new ArrayList<>(row));
    }

    void addAll(Collection<? extends List<?>> more) {
        for (List<?> row : more) {
            add(row);
        }
    }

    void replace(int index, List<?> row) {
        rows.set(index, new ArrayList<>(row));
    }

    void removeLast() {
        rows.remove(rows.size() - 1);
    }

    void clear() {
        rows.clear();
    }

    List<Object> column(int index) {
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    void insertColumn(int position, List<?> values) {
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).add(position, values.get(i));
        }
    }

    void removeColumn(int index) {
        for (List<Object> row : rows) {
            row.remove(index);
        }
    }

    /**
     * Reorders rows so that new row {@code i} is old row {@code permutation[i]}.
     */
    void permute(int[] permutation) {
        List<List<Object>> reordered = new ArrayList<>(permutation.length);
        for (int index : permutation) {
            reordered.add(rows.get(index));
        }
        rows = reordered;
    }

    /**
     * Copies of the columns at {@code positions} for every row.
     */
    List<List<Object>> project(List<Integer> positions) {
        List<List<Object>> projected = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> copy = new ArrayList<>(positions.size());
            for (int position : positions) {
                copy.add(row.get(position));
            }
            projected.add(copy);
        }
        return projected;
    }
}
