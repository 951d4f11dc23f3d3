package com.di.medallion.pipeline;

import com.di.medallion.aggregate.AggregateOutcome;
import com.di.medallion.aggregate.AnalyticsAggregator;
import com.di.medallion.dataset.Dataset;
import com.di.medallion.model.EmployeeSchema;
import com.di.medallion.quality.QualityGate;
import com.di.medallion.quality.QualityReport;
import com.di.medallion.storage.LayerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Phase 3: silver {@code employees_latest} to the gold analytics tables.
 *
 * <p>A table skipped for missing columns, or produced empty, is not written and
 * does not fail the phase.
 */
@Slf4j
@Component
public class LoadPhase implements PipelinePhase {

    public static final String NAME = "Load";

    private final AnalyticsAggregator aggregator;
    private final QualityGate         qualityGate;
    private final LayerStore          silver;
    private final LayerStore          gold;

    public LoadPhase(AnalyticsAggregator aggregator,
                     QualityGate qualityGate,
                     @Qualifier("silverStore") LayerStore silver,
                     @Qualifier("goldStore") LayerStore gold) {
        this.aggregator  = aggregator;
        this.qualityGate = qualityGate;
        this.silver      = silver;
        this.gold        = gold;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PhaseResult execute(RunContext context) {
        long start = System.currentTimeMillis();
        Dataset conformed = EmployeeSchema.CONFORMED.retype(silver.readLatest(TransformPhase.SILVER_STEM));
        log.info("[LOAD] Loaded {} rows from silver layer", conformed.getRowCount());

        PhaseResult result = PhaseResult.builder().phase(NAME).build();
        for (Map.Entry<String, AggregateOutcome> e : aggregator.aggregate(conformed).entrySet()) {
            String table = e.getKey();
            AggregateOutcome outcome = e.getValue();
            if (!outcome.isProduced()) {
                result.getSkippedTables().put(table, outcome.getMissingColumns());
                continue;
            }
            Dataset dataset = outcome.getDataset();
            if (dataset.isEmpty()) {
                log.warn("[LOAD] {} is empty; not written", table);
                result.getWarnings().add(table + " produced no rows");
                continue;
            }
            QualityReport quality = qualityGate.evaluate(dataset, table);
            Path file = gold.write(table, dataset, quality);
            result.getRowsWritten().put(table, dataset.getRowCount());
            result.getQualityReports().put(table, quality);
            result.getFiles().add(file.toString());
            result.setQualityIssues(result.getQualityIssues() + quality.getIssues().size());
        }

        log.info("[LOAD] Analytics tables created: {}", result.getRowsWritten().size());
        result.getRowsWritten().forEach((table, rows) -> log.info("[LOAD]   - {}: {} rows", table, rows));
        result.setDurationMs(System.currentTimeMillis() - start);
        return result;
    }
}
