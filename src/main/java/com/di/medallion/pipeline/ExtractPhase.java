package com.di.medallion.pipeline;

import com.di.medallion.dataset.Dataset;
import com.di.medallion.extract.SourceEntity;
import com.di.medallion.extract.SourceExtractor;
import com.di.medallion.model.EmployeeSchema;
import com.di.medallion.quality.QualityGate;
import com.di.medallion.quality.QualityReport;
import com.di.medallion.storage.LayerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Phase 1: every {@link SourceEntity} from the source database to the bronze layer.
 *
 * <h3>Steps per entity</h3>
 * <ol>
 *   <li>Extract the full table.</li>
 *   <li>Run the quality gate (advisory).</li>
 *   <li>Stamp {@code extraction_timestamp} on every row.</li>
 *   <li>Write {@code {stem}_{timestamp}.csv} and {@code {stem}_latest.csv}.</li>
 * </ol>
 */
@Slf4j
@Component
public class ExtractPhase implements PipelinePhase {

    public static final String NAME = "Extract";

    private final SourceExtractor extractor;
    private final QualityGate     qualityGate;
    private final LayerStore      bronze;
    private final Clock           clock;

    public ExtractPhase(SourceExtractor extractor,
                        QualityGate qualityGate,
                        @Qualifier("bronzeStore") LayerStore bronze,
                        Clock clock) {
        this.extractor   = extractor;
        this.qualityGate = qualityGate;
        this.bronze      = bronze;
        this.clock       = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PhaseResult execute(RunContext context) {
        long start = System.currentTimeMillis();
        PhaseResult result = PhaseResult.builder().phase(NAME).build();

        for (SourceEntity entity : SourceEntity.values()) {
            Dataset raw = extractor.extract(entity);
            QualityReport quality = qualityGate.evaluate(raw, entity.getTableName());

            LocalDateTime extractedAt = LocalDateTime.now(clock);
            Dataset stamped = raw.withColumn(EmployeeSchema.EXTRACTION_TIMESTAMP, row -> extractedAt);
            Path file = bronze.write(entity.getFileStem(), stamped, quality);

            log.info("[EXTRACT] {} extracted: {} rows", entity.getTableName(), stamped.getRowCount());
            result.getRowsWritten().put(entity.getFileStem(), stamped.getRowCount());
            result.getQualityReports().put(entity.getFileStem(), quality);
            result.getFiles().add(file.toString());
            result.setQualityIssues(result.getQualityIssues() + quality.getIssues().size());
        }

        result.setDurationMs(System.currentTimeMillis() - start);
        return result;
    }
}
