package com.di.medallion.dataset;

import com.di.medallion.util.ValueParsers;

/**
 * Storage type of a column, used to re-type values read back from a text layer.
 */
public enum ColumnType {

    STRING,
    LONG,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    TIMESTAMP;

    /**
     * Converts a value (typically a string read from CSV) to this type.
     * Values that cannot be converted become {@code null}.
     */
    public Object coerce(Object value) {
        if (value == null) {
            return null;
        }
        switch (this) {
            case STRING:
                return value.toString();
            case LONG:
                return ValueParsers.parseLong(value);
            case INTEGER:
                Long l = ValueParsers.parseLong(value);
                return l == null ? null : Integer.valueOf(l.intValue());
            case DECIMAL:
                return ValueParsers.parseDecimal(value);
            case BOOLEAN:
                return ValueParsers.parseBoolean(value);
            case DATE:
                return ValueParsers.parseDate(value);
            case TIMESTAMP:
                return ValueParsers.parseDateTime(value);
            default:
                return value;
        }
    }
}
