package com.di.medallion.pipeline;

import com.di.medallion.exception.ErrorCategory;
import com.di.medallion.exception.LayerFileNotFoundException;
import com.di.medallion.exception.SourceUnavailableException;
import com.di.medallion.extract.SourceConnectionChecker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("PipelineOrchestrator Tests")
class PipelineOrchestratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-05T14:07:09Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private SourceConnectionChecker checker;
    private PipelinePhase extract;
    private PipelinePhase transform;
    private PipelinePhase load;

    @BeforeEach
    void setUp() {
        checker   = mock(SourceConnectionChecker.class);
        extract   = phase("Extract");
        transform = phase("Transform");
        load      = phase("Load");
    }

    private static PipelinePhase phase(String name) {
        PipelinePhase phase = mock(PipelinePhase.class);
        when(phase.name()).thenReturn(name);
        when(phase.execute(any())).thenReturn(PhaseResult.builder().phase(name).build());
        return phase;
    }

    private PipelineOrchestrator orchestrator(Path summaryDir) {
        return new PipelineOrchestrator("Test Pipeline", checker, List.of(extract, transform, load),
                new RunSummaryWriter(summaryDir), CLOCK);
    }

    // ============================================================================
    // Success
    // ============================================================================

    @Test
    @DisplayName("Should run every phase in order and report success")
    void testRun_Success() {
        RunSummary summary = orchestrator(tempDir).run();

        assertEquals(RunStatus.COMPLETED_SUCCESSFULLY, summary.getStatus());
        assertEquals(0, summary.exitCode());
        assertEquals(List.of("Extract", "Transform", "Load"), summary.getCompletedPhases());
        assertEquals(3, summary.getPhaseResults().size());
        assertTrue(summary.getErrors().isEmpty());
        assertEquals("Test Pipeline", summary.getPipelineName());
        assertNotNull(summary.getRunId());
        assertEquals(Double.valueOf(0.0), summary.getDurationSeconds());

        var order = inOrder(checker, extract, transform, load);
        order.verify(checker).verify();
        order.verify(extract).execute(any());
        order.verify(transform).execute(any());
        order.verify(load).execute(any());
    }

    @Test
    @DisplayName("Should write the run summary as timestamped and latest JSON")
    void testRun_WritesSummary() throws IOException {
        orchestrator(tempDir).run();

        Path latest = tempDir.resolve("run_summary_latest.json");
        assertTrue(Files.exists(tempDir.resolve("run_summary_20240305_140709.json")));
        assertTrue(Files.exists(latest));
        String json = Files.readString(latest, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"status\" : \"Completed Successfully\""), json);
        assertTrue(json.contains("\"pipeline_name\" : \"Test Pipeline\""), json);
        assertTrue(json.contains("\"start_time\" : \"2024-03-05T14:07:09\""), json);
        assertTrue(json.contains("\"duration_seconds\" : 0.0"), json);
        assertTrue(json.contains("\"completed_phases\""), json);
        assertFalse(json.contains("\"startTime\""), json);
    }

    @Test
    @DisplayName("Should pass the same run context to every phase")
    void testRun_SharedContext() {
        AtomicReference<RunContext> first = new AtomicReference<>();
        when(extract.execute(any())).thenAnswer(inv -> {
            first.set(inv.getArgument(0));
            return PhaseResult.builder().phase("Extract").build();
        });

        RunSummary summary = orchestrator(tempDir).run();

        assertEquals(summary.getRunId(), first.get().runId());
        verify(transform).execute(first.get());
        verify(load).execute(first.get());
    }

    // ============================================================================
    // Fail-fast
    // ============================================================================

    @Test
    @DisplayName("Should stop at the failing phase and never run later phases")
    void testRun_TransformFails() {
        when(transform.execute(any())).thenThrow(
                new LayerFileNotFoundException("bronze", Paths.get("data/bronze/dimemployee_latest.csv")));

        RunSummary summary = orchestrator(tempDir).run();

        assertEquals(RunStatus.FAILED, summary.getStatus());
        assertEquals(1, summary.exitCode());
        assertEquals(List.of("Extract"), summary.getCompletedPhases());
        assertEquals(1, summary.getErrors().size());
        PhaseError error = summary.getErrors().get(0);
        assertEquals("Transform", error.phase());
        assertEquals(ErrorCategory.MISSING_INPUT, error.category());
        assertTrue(error.message().startsWith("Bronze file not found"));
        verify(load, never()).execute(any());
    }

    @Test
    @DisplayName("Should record unexpected runtime exceptions as application errors")
    void testRun_UnexpectedException() {
        when(extract.execute(any())).thenThrow(new IllegalStateException("boom"));

        RunSummary summary = orchestrator(tempDir).run();

        assertEquals(RunStatus.FAILED, summary.getStatus());
        assertEquals(new PhaseError("Extract", "boom", ErrorCategory.APPLICATION_ERROR), summary.getErrors().get(0));
        assertTrue(summary.getCompletedPhases().isEmpty());
        verify(transform, never()).execute(any());
        verify(load, never()).execute(any());
    }

    @Test
    @DisplayName("Should abort before any phase when the pre-flight check fails")
    void testRun_PreflightFails() {
        doThrow(new SourceUnavailableException("Database connection test failed: refused", null))
                .when(checker).verify();

        RunSummary summary = orchestrator(tempDir).run();

        assertEquals(RunStatus.FAILED, summary.getStatus());
        assertEquals(1, summary.exitCode());
        assertEquals(1, summary.getErrors().size());
        assertEquals(PipelineOrchestrator.PREFLIGHT_PHASE, summary.getErrors().get(0).phase());
        assertEquals(ErrorCategory.CONNECTION_ERROR, summary.getErrors().get(0).category());
        verify(extract, never()).execute(any());
        verify(transform, never()).execute(any());
        verify(load, never()).execute(any());
        assertTrue(Files.exists(tempDir.resolve("run_summary_latest.json")));
    }

    // ============================================================================
    // Run scoping
    // ============================================================================

    @Test
    @DisplayName("Should expose the run id in MDC only while the run is active")
    void testRun_MdcScope() {
        AtomicReference<String> seen = new AtomicReference<>();
        when(extract.execute(any())).thenAnswer(inv -> {
            seen.set(MDC.get(PipelineOrchestrator.MDC_RUN_ID));
            return PhaseResult.builder().phase("Extract").build();
        });

        RunSummary summary = orchestrator(tempDir).run();

        assertEquals(summary.getRunId(), seen.get());
        assertNull(MDC.get(PipelineOrchestrator.MDC_RUN_ID));
    }

    @Test
    @DisplayName("Should return the summary even when it cannot be persisted")
    void testRun_SummaryWriteFails() throws IOException {
        Path notADirectory = Files.createFile(tempDir.resolve("blocked"));

        RunSummary summary = orchestrator(notADirectory).run();

        assertEquals(RunStatus.COMPLETED_SUCCESSFULLY, summary.getStatus());
        assertNotNull(summary.getEndTime());
    }

    @Test
    @DisplayName("Should give every run its own id")
    void testRun_DistinctRunIds() {
        PipelineOrchestrator orchestrator = orchestrator(tempDir);
        assertNotEquals(orchestrator.run().getRunId(), orchestrator.run().getRunId());
    }
}
