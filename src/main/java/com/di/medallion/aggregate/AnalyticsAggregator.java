package com.di.medallion.aggregate;

import com.di.medallion.dataset.Dataset;
import com.di.medallion.dataset.SchemaDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the gold-layer tables from one conformed dataset.
 *
 * <p>Tables are computed one after another in a fixed order and are independent
 * of each other: a table whose input columns are missing is skipped with a
 * warning and the others are still built.
 */
@Slf4j
@Component
public class AnalyticsAggregator {

    private final List<AnalyticTable> tables;

    @Autowired
    public AnalyticsAggregator() {
        this(List.of(
                new DepartmentSummaryTable(),
                new GenderDiversityTable(),
                new TenureAnalysisTable(),
                new HiringTrendsTable()));
    }

    public AnalyticsAggregator(List<AnalyticTable> tables) {
        this.tables = List.copyOf(tables);
    }

    public List<AnalyticTable> getTables() {
        return tables;
    }

    /** One outcome per table, keyed by table name, in table order. */
    public Map<String, AggregateOutcome> aggregate(Dataset conformed) {
        log.info("[AGGREGATE] Creating {} analytics tables from {} rows", tables.size(), conformed.getRowCount());
        Map<String, AggregateOutcome> outcomes = new LinkedHashMap<>();
        for (AnalyticTable table : tables) {
            List<String> missing = SchemaDescriptor.missing(conformed, table.requiredColumns());
            if (!missing.isEmpty()) {
                log.warn("[AGGREGATE] Skipping {}: missing column(s) {}", table.name(), missing);
                outcomes.put(table.name(), AggregateOutcome.skipped(table.name(), missing));
                continue;
            }
            Dataset result = table.build(conformed);
            log.info("[AGGREGATE] Created {} with {} rows", table.name(), result.getRowCount());
            outcomes.put(table.name(), AggregateOutcome.produced(table.name(), result));
        }
        return outcomes;
    }
}
