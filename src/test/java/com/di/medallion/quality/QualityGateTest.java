package com.di.medallion.quality;

import com.di.medallion.dataset.Dataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QualityGate Tests")
class QualityGateTest {

    private final QualityGate gate = new QualityGate(1);

    @Test
    @DisplayName("Should pass a clean dataset")
    void testEvaluate_Clean() {
        Dataset ds = Dataset.builder(List.of("id", "name"))
                .addRow(1L, "Ann")
                .addRow(2L, "Bob")
                .build();

        QualityReport report = gate.evaluate(ds, "clean");

        assertTrue(report.isPassed());
        assertTrue(report.getIssues().isEmpty());
        assertEquals(2, report.getRowCount());
        assertEquals(2, report.getColumnCount());
        assertEquals(0, report.getTotalNullCells());
        assertEquals(0, report.getDuplicateRowCount());
        assertEquals("Long", report.getColumnTypes().get("id"));
    }

    @Test
    @DisplayName("Should count nulls per column with percentages")
    void testEvaluate_Nulls() {
        Dataset ds = Dataset.builder(List.of("id", "email"))
                .addRow(1L, null)
                .addRow(2L, "b@x.com")
                .addRow(3L, null)
                .build();

        QualityReport report = gate.evaluate(ds, "nulls");

        assertFalse(report.isPassed());
        assertEquals(2, report.getTotalNullCells());
        assertEquals(1, report.getColumnNulls().size());
        QualityReport.ColumnNulls email = report.getColumnNulls().get(0);
        assertEquals("email", email.getColumn());
        assertEquals(2, email.getNullCount());
        assertEquals(66.67, email.getNullPercentage(), 0.0001);
        assertTrue(report.getIssues().contains("Column 'email' has 2 null values (66.67%)"));
    }

    @Test
    @DisplayName("Should count whole-row duplicates")
    void testEvaluate_Duplicates() {
        Dataset ds = Dataset.builder(List.of("id", "name"))
                .addRow(1L, "Ann")
                .addRow(1L, "Ann")
                .addRow(1L, "Ann")
                .addRow(1L, "Bob")
                .build();

        QualityReport report = gate.evaluate(ds, "dups");

        assertEquals(2, report.getDuplicateRowCount());
        assertTrue(report.getIssues().contains("Found 2 duplicate rows"));
    }

    @Test
    @DisplayName("Should treat decimals differing only in scale as duplicates")
    void testEvaluate_DuplicatesIgnoreDecimalScale() {
        Dataset ds = Dataset.builder(List.of("id", "rate"))
                .addRow(1L, new BigDecimal("10.0"))
                .addRow(1L, new BigDecimal("10.00"))
                .addRow(1L, new BigDecimal("10.01"))
                .build();

        QualityReport report = gate.evaluate(ds, "scale");

        assertEquals(1, report.getDuplicateRowCount());
        assertTrue(report.getIssues().contains("Found 1 duplicate rows"));
    }

    @Test
    @DisplayName("Should report a row-count shortfall without throwing")
    void testEvaluate_BelowMinimum() {
        Dataset ds = Dataset.empty(List.of("id"));

        QualityReport report = assertDoesNotThrow(() -> gate.evaluate(ds, "empty"));

        assertFalse(report.isPassed());
        assertEquals(List.of("Row count (0) is below expected minimum (1)"), report.getIssues());
        assertEquals("empty", report.getColumnTypes().get("id"));
    }

    @Test
    @DisplayName("Should honour an explicit minimum row count")
    void testEvaluate_ExplicitMinimum() {
        Dataset ds = Dataset.builder(List.of("id")).addRow(1L).addRow(2L).build();
        QualityReport report = gate.evaluate(ds, "min", 5);
        assertEquals(5, report.getMinRowCount());
        assertTrue(report.getIssues().get(0).contains("below expected minimum (5)"));
    }

    @Test
    @DisplayName("Should not modify the evaluated dataset")
    void testEvaluate_Pure() {
        Dataset ds = Dataset.builder(List.of("id", "v")).addRow(1L, null).build();
        Dataset copy = Dataset.of(ds.getColumns(), ds.getRows());
        gate.evaluate(ds, "pure");
        assertEquals(copy, ds);
    }
}
