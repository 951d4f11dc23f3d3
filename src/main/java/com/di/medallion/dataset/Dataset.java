package com.di.medallion.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Immutable, ordered table of records sharing one schema.
 *
 * <p>Column order and row order are preserved end to end. Every operation that
 * changes the shape or content of a dataset returns a new instance; the receiver
 * is never modified.
 *
 * <p>Values are plain Java objects ({@code String}, {@code Long}, {@code Integer},
 * {@code BigDecimal}, {@code Boolean}, {@code LocalDate}, {@code LocalDateTime})
 * and may be {@code null}.
 */
public final class Dataset {

    private final List<String>       columns;
    private final Map<String, Integer> index;
    private final List<List<Object>> rows;

    private Dataset(List<String> columns, List<List<Object>> rows) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            String name = Objects.requireNonNull(columns.get(i), "column name");
            if (idx.put(name, i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + name);
            }
        }
        this.index = Collections.unmodifiableMap(idx);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row width %d does not match column count %d", row.size(), columns.size()));
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static Dataset of(List<String> columns, List<? extends List<?>> rows) {
        List<List<Object>> typed = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            typed.add(new ArrayList<>(row));
        }
        return new Dataset(columns, typed);
    }

    public static Dataset empty(List<String> columns) {
        return new Dataset(columns, List.of());
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    /* ------------------------------------------------------------------ */
    /* Accessors                                                           */
    /* ------------------------------------------------------------------ */

    public List<String> getColumns() {
        return columns;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getRowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return index.containsKey(column);
    }

    /**
     * @throws IllegalArgumentException if the column is not part of the schema
     */
    public int columnIndex(String column) {
        Integer i = index.get(column);
        if (i == null) {
            throw new IllegalArgumentException("Unknown column '" + column + "'; available: " + columns);
        }
        return i;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public List<Object> getRow(int rowIndex) {
        return rows.get(rowIndex);
    }

    public Object getValue(int rowIndex, String column) {
        return rows.get(rowIndex).get(columnIndex(column));
    }

    public List<Object> columnValues(String column) {
        int c = columnIndex(column);
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(c));
        }
        return values;
    }

    /** Row views in insertion order. */
    public List<DataRow> rows() {
        List<DataRow> views = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            views.add(new DataRow(this, i));
        }
        return views;
    }

    /* ------------------------------------------------------------------ */
    /* Copy-on-write operations                                            */
    /* ------------------------------------------------------------------ */

    /** Returns a copy without {@code column}; a missing column yields {@code this}. */
    public Dataset dropColumn(String column) {
        if (!hasColumn(column)) {
            return this;
        }
        int c = columnIndex(column);
        List<String> newColumns = new ArrayList<>(columns);
        newColumns.remove(c);
        List<List<Object>> newRows = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> copy = new ArrayList<>(row);
            copy.remove(c);
            newRows.add(copy);
        }
        return new Dataset(newColumns, newRows);
    }

    /** Replaces every value of an existing column with {@code fn(value)}. */
    public Dataset mapColumn(String column, Function<Object, Object> fn) {
        int c = columnIndex(column);
        List<List<Object>> newRows = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> copy = new ArrayList<>(row);
            copy.set(c, fn.apply(row.get(c)));
            newRows.add(copy);
        }
        return new Dataset(columns, newRows);
    }

    /**
     * Computes a column from each row. An existing column of the same name is
     * replaced in place; otherwise the column is appended at the end.
     */
    public Dataset withColumn(String column, Function<DataRow, Object> fn) {
        boolean replace = hasColumn(column);
        int c = replace ? columnIndex(column) : columns.size();
        List<String> newColumns = new ArrayList<>(columns);
        if (!replace) {
            newColumns.add(column);
        }
        List<List<Object>> newRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<Object> copy = new ArrayList<>(rows.get(i));
            Object value = fn.apply(new DataRow(this, i));
            if (replace) {
                copy.set(c, value);
            } else {
                copy.add(value);
            }
            newRows.add(copy);
        }
        return new Dataset(newColumns, newRows);
    }

    public Dataset filter(Predicate<DataRow> predicate) {
        List<List<Object>> kept = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            if (predicate.test(new DataRow(this, i))) {
                kept.add(rows.get(i));
            }
        }
        return new Dataset(columns, kept);
    }

    /** Rows at the given positions, in the order given. */
    public Dataset selectRows(List<Integer> rowIndexes) {
        List<List<Object>> picked = new ArrayList<>(rowIndexes.size());
        for (int i : rowIndexes) {
            picked.add(rows.get(i));
        }
        return new Dataset(columns, picked);
    }

    /* ------------------------------------------------------------------ */

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dataset)) return false;
        Dataset other = (Dataset) o;
        return columns.equals(other.columns) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rows);
    }

    @Override
    public String toString() {
        return "Dataset[columns=" + columns.size() + ", rows=" + rows.size() + "]";
    }

    /* ------------------------------------------------------------------ */

    /** Accumulates rows for a new dataset; single use. */
    public static final class Builder {

        private final List<String>       columns;
        private final List<List<Object>> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = new ArrayList<>(columns);
        }

        public Builder addRow(List<?> values) {
            rows.add(new ArrayList<>(values));
            return this;
        }

        public Builder addRow(Object... values) {
            List<Object> row = new ArrayList<>(values.length);
            Collections.addAll(row, values);
            rows.add(row);
            return this;
        }

        public Dataset build() {
            return new Dataset(columns, rows);
        }
    }
}
