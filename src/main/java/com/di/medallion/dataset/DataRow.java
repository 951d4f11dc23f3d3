package com.di.medallion.dataset;

/**
 * Read-only view of one row of a {@link Dataset}.
 */
public final class DataRow {

    private final Dataset dataset;
    private final int     rowIndex;

    DataRow(Dataset dataset, int rowIndex) {
        this.dataset  = dataset;
        this.rowIndex = rowIndex;
    }

    public int index() {
        return rowIndex;
    }

    public boolean has(String column) {
        return dataset.hasColumn(column);
    }

    public Object get(String column) {
        return dataset.getRow(rowIndex).get(dataset.columnIndex(column));
    }

    /** Value of {@code column}, or {@code null} when the column is not in the schema. */
    public Object getOrNull(String column) {
        return dataset.hasColumn(column) ? get(column) : null;
    }

    public String getString(String column) {
        Object v = getOrNull(column);
        return v == null ? null : v.toString();
    }

    public boolean isNull(String column) {
        return getOrNull(column) == null;
    }
}
