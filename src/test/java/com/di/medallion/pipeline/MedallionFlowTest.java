package com.di.medallion.pipeline;

import com.di.medallion.aggregate.AnalyticsAggregator;
import com.di.medallion.config.PipelineProperties;
import com.di.medallion.dataset.DataRow;
import com.di.medallion.dataset.Dataset;
import com.di.medallion.exception.ErrorCategory;
import com.di.medallion.exception.ExtractionException;
import com.di.medallion.extract.SourceConnectionChecker;
import com.di.medallion.extract.SourceEntity;
import com.di.medallion.extract.SourceExtractor;
import com.di.medallion.model.DepartmentSchema;
import com.di.medallion.model.EmployeeSchema;
import com.di.medallion.quality.QualityGate;
import com.di.medallion.storage.CsvDatasetCodec;
import com.di.medallion.storage.LayerStore;
import com.di.medallion.transform.EmployeeTransformer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Extract, transform and load wired together over temporary layer directories,
 * with only the source database mocked.
 */
@DisplayName("Medallion Flow Tests")
class MedallionFlowTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);

    @TempDir
    Path dataDir;

    private SourceExtractor extractor;
    private LayerStore bronze;
    private LayerStore silver;
    private LayerStore gold;
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        extractor = mock(SourceExtractor.class);
        CsvDatasetCodec codec = new CsvDatasetCodec();
        bronze = new LayerStore("bronze", dataDir.resolve("bronze"), CLOCK, codec);
        silver = new LayerStore("silver", dataDir.resolve("silver"), CLOCK, codec);
        gold   = new LayerStore("gold", dataDir.resolve("gold"), CLOCK, codec);

        QualityGate gate = new QualityGate(1);
        List<PipelinePhase> phases = List.of(
                new ExtractPhase(extractor, gate, bronze, CLOCK),
                new TransformPhase(new EmployeeTransformer(gate), bronze, silver, new PipelineProperties(), CLOCK),
                new LoadPhase(new AnalyticsAggregator(), gate, silver, gold));
        orchestrator = new PipelineOrchestrator("Flow Test", mock(SourceConnectionChecker.class), phases,
                new RunSummaryWriter(dataDir), CLOCK);
    }

    private static List<Object> employee(long key, String department, String gender, String baseRate, String hireDate) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String column : EmployeeSchema.SOURCE_COLUMNS) {
            row.put(column, null);
        }
        row.put(EmployeeSchema.EMPLOYEE_KEY, key);
        row.put(EmployeeSchema.FIRST_NAME, "First" + key);
        row.put(EmployeeSchema.LAST_NAME, "Last" + key);
        row.put(EmployeeSchema.HIRE_DATE, hireDate);
        row.put(EmployeeSchema.BIRTH_DATE, "1980-01-01");
        row.put(EmployeeSchema.EMAIL_ADDRESS, "e" + key + "@adventure-works.com");
        row.put(EmployeeSchema.PHONE, "555-0100");
        row.put(EmployeeSchema.MARITAL_STATUS, "S");
        row.put(EmployeeSchema.GENDER, gender);
        row.put(EmployeeSchema.BASE_RATE, baseRate);
        row.put(EmployeeSchema.VACATION_HOURS, "10");
        row.put(EmployeeSchema.SICK_LEAVE_HOURS, "20");
        row.put(EmployeeSchema.CURRENT_FLAG, true);
        row.put(EmployeeSchema.DEPARTMENT_NAME, department);
        return Arrays.asList(row.values().toArray());
    }

    private void sourceReturns(List<List<Object>> employees) {
        when(extractor.extract(SourceEntity.EMPLOYEE))
                .thenReturn(Dataset.of(EmployeeSchema.SOURCE_COLUMNS, employees));
        when(extractor.extract(SourceEntity.DEPARTMENT_GROUP))
                .thenReturn(Dataset.of(DepartmentSchema.SOURCE_COLUMNS, List.of(Arrays.asList(1L, null, "Corporate"))));
    }

    @Test
    @DisplayName("Should materialise bronze, silver and gold from one source snapshot")
    void testRun_EndToEnd() {
        sourceReturns(List.of(
                employee(1, "Production", "M", "12.45", "2006-07-31"),
                employee(2, "Production", "F", "20.00", "2010-01-01"),
                employee(3, "Sales", "M", "30.00", "2022-06-15"),
                employee(2, "Production", "F", "25.00", "2010-01-01")));

        RunSummary summary = orchestrator.run();

        assertEquals(RunStatus.COMPLETED_SUCCESSFULLY, summary.getStatus(), summary.getErrors().toString());
        assertTrue(bronze.hasLatest("dimemployee"));
        assertTrue(bronze.hasLatest("dimdepartmentgroup"));
        assertTrue(Files.exists(dataDir.resolve("bronze/dimemployee_20240305_140709.csv")));
        assertTrue(silver.hasLatest("employees"));
        for (String table : List.of("department_summary", "gender_diversity", "tenure_analysis", "hiring_trends")) {
            assertTrue(gold.hasLatest(table), table);
        }
        assertTrue(Files.exists(dataDir.resolve("run_summary_latest.json")));

        Dataset employees = silver.readLatest("employees");
        assertEquals(3, employees.getRowCount());
        assertFalse(employees.hasColumn(EmployeeSchema.EXTRACTION_TIMESTAMP));
        assertTrue(employees.hasColumn(EmployeeSchema.TRANSFORMATION_TIMESTAMP));
        assertEquals("2024-03-05T14:07:09", employees.getValue(0, EmployeeSchema.TRANSFORMATION_TIMESTAMP));

        DataRow production = gold.readLatest("department_summary").rows().get(0);
        assertEquals("Production", production.get("DepartmentName"));
        assertEquals("2", production.get("total_employees"));
        // the later duplicate of key 2 (25.00) survives
        assertEquals("18.73", production.get("avg_base_rate"));
    }

    @Test
    @DisplayName("Should record per-phase row counts in the summary")
    void testRun_PhaseResults() {
        sourceReturns(List.of(
                employee(1, "Production", "M", "12.45", "2006-07-31"),
                employee(2, "Sales", "F", "20.00", "2010-01-01")));

        RunSummary summary = orchestrator.run();

        PhaseResult extract = summary.getPhaseResults().get(0);
        assertEquals(2, extract.getRowsWritten().get("dimemployee"));
        assertEquals(1, extract.getRowsWritten().get("dimdepartmentgroup"));
        assertEquals(2, summary.getPhaseResults().get(1).getRowsWritten().get("employees"));
        assertEquals(4, summary.getPhaseResults().get(2).getRowsWritten().size());
    }

    @Test
    @DisplayName("Should carry each written dataset's quality report in the summary")
    void testRun_QualityReports() throws Exception {
        sourceReturns(List.of(
                employee(1, "Production", "M", "12.45", "2006-07-31"),
                employee(2, "Sales", "F", "20.00", "2010-01-01")));

        RunSummary summary = orchestrator.run();

        PhaseResult extract = summary.getPhaseResults().get(0);
        assertEquals(extract.getRowsWritten().keySet(), extract.getQualityReports().keySet());
        assertEquals(2, extract.getQualityReports().get("dimemployee").getRowCount());
        assertEquals(2, summary.getPhaseResults().get(1).getQualityReports().get("employees").getRowCount());
        PhaseResult load = summary.getPhaseResults().get(2);
        assertEquals(4, load.getQualityReports().size());
        assertNotNull(load.getQualityReports().get("department_summary"));

        String json = Files.readString(dataDir.resolve("run_summary_latest.json"));
        assertTrue(json.contains("\"quality_reports\""), json);
        assertTrue(json.contains("\"row_count\" : 2"), json);
    }

    @Test
    @DisplayName("Should leave silver and gold untouched when extraction fails")
    void testRun_ExtractionFails() {
        when(extractor.extract(SourceEntity.EMPLOYEE))
                .thenThrow(new ExtractionException("DimEmployee", "Invalid object name 'dbo.DimEmployee'", null));

        RunSummary summary = orchestrator.run();

        assertEquals(RunStatus.FAILED, summary.getStatus());
        assertEquals("Extract", summary.getErrors().get(0).phase());
        assertEquals(ErrorCategory.DATABASE_ERROR, summary.getErrors().get(0).category());
        assertFalse(silver.hasLatest("employees"));
        assertFalse(gold.hasLatest("department_summary"));
    }
}
