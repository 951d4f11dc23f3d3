package com.di.medallion.quality;

import com.di.medallion.config.PipelineProperties;
import com.di.medallion.dataset.Dataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Data-quality checks run at every stage boundary.
 *
 * <h3>Checks</h3>
 * <ol>
 *   <li>Row count against a minimum (error-level finding).</li>
 *   <li>Null count and percentage per column.</li>
 *   <li>Whole-row duplicates (rows identical across all columns).</li>
 *   <li>Column type census (logged at DEBUG, kept in the report).</li>
 * </ol>
 *
 * <p>The gate never throws and never mutates the dataset: findings are logged
 * and returned in the {@link QualityReport}.
 */
@Slf4j
@Component
public class QualityGate {

    private final int defaultMinRowCount;

    @Autowired
    public QualityGate(PipelineProperties properties) {
        this(properties.getMinRowCount());
    }

    public QualityGate(int defaultMinRowCount) {
        this.defaultMinRowCount = defaultMinRowCount;
    }

    public QualityReport evaluate(Dataset dataset, String label) {
        return evaluate(dataset, label, defaultMinRowCount);
    }

    public QualityReport evaluate(Dataset dataset, String label, int minRowCount) {
        log.info("[QUALITY] Starting data quality checks for {}", label);
        List<String> issues = new ArrayList<>();

        int rowCount = dataset.getRowCount();
        checkRowCount(label, rowCount, minRowCount, issues);

        List<QualityReport.ColumnNulls> columnNulls = new ArrayList<>();
        long totalNulls = checkNullValues(label, dataset, columnNulls, issues);

        long duplicates = checkDuplicates(label, dataset, issues);

        Map<String, String> columnTypes = censusTypes(label, dataset);

        if (issues.isEmpty()) {
            log.info("[QUALITY] [{}] All quality checks passed", label);
        } else {
            log.warn("[QUALITY] [{}] Found {} quality issues", label, issues.size());
        }

        return QualityReport.builder()
                .label(label)
                .rowCount(rowCount)
                .columnCount(dataset.getColumnCount())
                .totalNullCells(totalNulls)
                .duplicateRowCount(duplicates)
                .minRowCount(minRowCount)
                .columnNulls(columnNulls)
                .columnTypes(columnTypes)
                .issues(issues)
                .passed(issues.isEmpty())
                .build();
    }

    /* ------------------------------------------------------------------ */

    private void checkRowCount(String label, int rowCount, int minRowCount, List<String> issues) {
        if (rowCount < minRowCount) {
            String message = String.format("Row count (%d) is below expected minimum (%d)", rowCount, minRowCount);
            issues.add(message);
            log.error("[QUALITY] [{}] {}", label, message);
        } else {
            log.info("[QUALITY] [{}] Row count: {}", label, rowCount);
        }
    }

    private long checkNullValues(String label, Dataset dataset,
                                 List<QualityReport.ColumnNulls> out, List<String> issues) {
        long total = 0;
        int rowCount = dataset.getRowCount();
        for (String column : dataset.getColumns()) {
            long nulls = 0;
            for (Object value : dataset.columnValues(column)) {
                if (value == null) {
                    nulls++;
                }
            }
            total += nulls;
            if (nulls > 0) {
                double pct = percentage(nulls, rowCount);
                out.add(QualityReport.ColumnNulls.builder()
                        .column(column)
                        .nullCount(nulls)
                        .nullPercentage(pct)
                        .build());
                String message = String.format(Locale.ROOT,
                        "Column '%s' has %d null values (%.2f%%)", column, nulls, pct);
                issues.add(message);
                log.warn("[QUALITY] [{}] {}", label, message);
            }
        }
        return total;
    }

    private long checkDuplicates(String label, Dataset dataset, List<String> issues) {
        Set<List<Object>> seen = new HashSet<>();
        long duplicates = 0;
        for (List<Object> row : dataset.getRows()) {
            if (!seen.add(duplicateKey(row))) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            String message = String.format("Found %d duplicate rows", duplicates);
            issues.add(message);
            log.warn("[QUALITY] [{}] {}", label, message);
        }
        return duplicates;
    }

    /** Decimals compare by value, so {@code 10.0} and {@code 10.00} are the same cell. */
    private static List<Object> duplicateKey(List<Object> row) {
        List<Object> key = new ArrayList<>(row.size());
        for (Object value : row) {
            key.add(value instanceof BigDecimal decimal ? decimal.stripTrailingZeros() : value);
        }
        return key;
    }

    private Map<String, String> censusTypes(String label, Dataset dataset) {
        Map<String, String> types = new LinkedHashMap<>();
        log.debug("[QUALITY] [{}] Data types:", label);
        for (String column : dataset.getColumns()) {
            Set<String> names = new TreeSet<>();
            for (Object value : dataset.columnValues(column)) {
                if (value != null) {
                    names.add(value.getClass().getSimpleName());
                }
            }
            String type = names.isEmpty() ? "empty" : String.join("|", names);
            types.put(column, type);
            log.debug("  - {}: {}", column, type);
        }
        return types;
    }

    private static double percentage(long part, int whole) {
        if (whole == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(part * 100L)
                .divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
