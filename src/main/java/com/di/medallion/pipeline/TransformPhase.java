package com.di.medallion.pipeline;

import com.di.medallion.config.PipelineProperties;
import com.di.medallion.dataset.Dataset;
import com.di.medallion.extract.SourceEntity;
import com.di.medallion.model.EmployeeSchema;
import com.di.medallion.storage.LayerStore;
import com.di.medallion.transform.EmployeeTransformer;
import com.di.medallion.transform.TransformReport;
import com.di.medallion.transform.TransformResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Phase 2: bronze {@code dimemployee_latest} to silver {@code employees}.
 *
 * <p>The clock is read once on entry; that instant supplies both the reference
 * date for {@code Age}/{@code YearsOfService} and {@code transformation_timestamp}.
 */
@Slf4j
@Component
public class TransformPhase implements PipelinePhase {

    public static final String NAME        = "Transform";
    public static final String SILVER_STEM = "employees";

    private final EmployeeTransformer transformer;
    private final LayerStore          bronze;
    private final LayerStore          silver;
    private final PipelineProperties  properties;
    private final Clock               clock;

    public TransformPhase(EmployeeTransformer transformer,
                          @Qualifier("bronzeStore") LayerStore bronze,
                          @Qualifier("silverStore") LayerStore silver,
                          PipelineProperties properties,
                          Clock clock) {
        this.transformer = transformer;
        this.bronze      = bronze;
        this.silver      = silver;
        this.properties  = properties;
        this.clock       = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PhaseResult execute(RunContext context) {
        long start = System.currentTimeMillis();
        LocalDateTime reference = LocalDateTime.now(clock);

        Dataset raw = bronze.readLatest(SourceEntity.EMPLOYEE.getFileStem());
        TransformResult result = transformer.transform(raw, reference.toLocalDate(), properties.isActiveOnly());
        TransformReport report = result.getReport();

        Dataset conformed = result.getConformed()
                .withColumn(EmployeeSchema.TRANSFORMATION_TIMESTAMP, row -> reference);
        Path file = silver.write(SILVER_STEM, conformed, report.getQuality());

        PhaseResult phase = PhaseResult.builder()
                .phase(NAME)
                .qualityIssues(report.getQuality().getIssues().size())
                .build();
        phase.getRowsWritten().put(SILVER_STEM, conformed.getRowCount());
        phase.getQualityReports().put(SILVER_STEM, report.getQuality());
        phase.getFiles().add(file.toString());
        phase.getWarnings().addAll(report.getWarnings());
        report.getUnmappedCodes().forEach((column, count) ->
                phase.getWarnings().add(count + " unmapped " + column + " codes kept and flagged"));
        phase.setDurationMs(System.currentTimeMillis() - start);
        return phase;
    }
}
