package com.di.medallion.transform;

import com.di.medallion.model.EmployeeSchema;

import java.util.Map;

/**
 * Fixed lookup tables for coded categorical columns.
 *
 * <p>A code outside the table is not discarded: the trimmed original value is
 * kept and the companion {@link #getUnmappedFlagColumn() flag column} is set.
 */
public enum CategoricalMapping {

    GENDER(EmployeeSchema.GENDER, EmployeeSchema.GENDER_UNMAPPED,
            Map.of("M", "Male", "F", "Female")),
    MARITAL_STATUS(EmployeeSchema.MARITAL_STATUS, EmployeeSchema.MARITAL_STATUS_UNMAPPED,
            Map.of("M", "Married", "S", "Single"));

    private final String              column;
    private final String              unmappedFlagColumn;
    private final Map<String, String> lookup;

    CategoricalMapping(String column, String unmappedFlagColumn, Map<String, String> lookup) {
        this.column             = column;
        this.unmappedFlagColumn = unmappedFlagColumn;
        this.lookup             = lookup;
    }

    public String getColumn() {
        return column;
    }

    public String getUnmappedFlagColumn() {
        return unmappedFlagColumn;
    }

    /** Mapped label, or {@code null} when {@code code} is null or not in the table. */
    public String lookup(String code) {
        return code == null ? null : lookup.get(code);
    }

    /** Whether a non-null code has no entry in the table. */
    public boolean isUnmapped(String code) {
        return code != null && !lookup.containsKey(code);
    }
}
