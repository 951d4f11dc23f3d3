package com.di.medallion.quality;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Findings of one quality-gate evaluation. Advisory: a failed report never
 * blocks the stage that produced the dataset.
 *
 * <p>Serialised next to each layer file as {@code {stem}_{timestamp}.quality.json}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityReport {

    /** Dataset label, e.g. {@code DimEmployee} or {@code department_summary}. */
    private String  label;

    private int     rowCount;
    private int     columnCount;
    private long    totalNullCells;
    private long    duplicateRowCount;
    private int     minRowCount;

    /** Columns with at least one null, in schema order. */
    @Builder.Default
    private List<ColumnNulls> columnNulls = new ArrayList<>();

    /** Column → observed value type(s), {@code "empty"} when every value is null. */
    @Builder.Default
    private Map<String, String> columnTypes = new LinkedHashMap<>();

    @Builder.Default
    private List<String> issues = new ArrayList<>();

    /** {@code true} iff {@link #issues} is empty. */
    private boolean passed;

    /* ---------------------------------------------------------------------- */

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ColumnNulls {

        private String column;
        private long   nullCount;

        /** {@code nullCount / rowCount × 100}, rounded to 2 decimals. */
        private double nullPercentage;
    }
}
