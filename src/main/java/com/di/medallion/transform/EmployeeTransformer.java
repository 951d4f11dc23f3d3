package com.di.medallion.transform;

import com.di.medallion.dataset.DataRow;
import com.di.medallion.dataset.Dataset;
import com.di.medallion.dataset.SchemaDescriptor;
import com.di.medallion.exception.InvalidKeyException;
import com.di.medallion.quality.QualityGate;
import com.di.medallion.quality.QualityReport;
import com.di.medallion.util.ValueParsers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static com.di.medallion.model.EmployeeSchema.*;

/**
 * Conforms a raw employee extract into the silver schema.
 *
 * <p>Rules run in a fixed order:
 * <ol>
 *   <li>drop extraction metadata</li>
 *   <li>null-fill {@code MiddleName} and {@code Title}</li>
 *   <li>trim text columns</li>
 *   <li>derive {@code FullName}</li>
 *   <li>parse dates (unparseable becomes null)</li>
 *   <li>derive {@code Age} and {@code YearsOfService} against the reference date</li>
 *   <li>coerce flags to boolean (unknown becomes false)</li>
 *   <li>coerce numerics (unparseable becomes 0)</li>
 *   <li>map {@code Gender} and {@code MaritalStatus} codes</li>
 *   <li>compute {@code data_quality_score}</li>
 *   <li>deduplicate on {@code EmployeeKey}, last row wins</li>
 *   <li>optional active-only filter on {@code CurrentFlag}</li>
 * </ol>
 * Every rule except deduplication is total. Deduplication needs a parseable key
 * on every row and throws {@link InvalidKeyException} otherwise.
 *
 * <p>The output depends only on the input and {@code referenceDate}; the caller
 * captures that date once per run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmployeeTransformer {

    static final String TITLE_DEFAULT   = "Not Specified";
    static final int    SCORE_MAX       = 100;
    static final int    SCORE_PENALTY   = 10;
    static final int    DAYS_PER_YEAR   = 365;

    private final QualityGate qualityGate;

    public TransformResult transform(Dataset raw, LocalDate referenceDate, boolean activeOnly) {
        log.info("[TRANSFORM] Starting employee data transformation ({} rows, reference date {})",
                raw.getRowCount(), referenceDate);
        TransformReport.TransformReportBuilder report = TransformReport.builder().inputRows(raw.getRowCount());

        Dataset ds = raw.dropColumn(EXTRACTION_TIMESTAMP);
        ds = fillNulls(ds);
        ds = trimText(ds);
        ds = deriveFullName(ds);
        ds = parseDates(ds, report);
        ds = deriveDurations(ds, referenceDate, report);
        ds = coerceFlags(ds, report);
        ds = coerceNumerics(ds, report);
        ds = mapCategoricals(ds, report);
        ds = scoreQuality(ds);

        int beforeDedup = ds.getRowCount();
        ds = conformKey(ds);
        ds = Deduplicator.keepLast(ds, EMPLOYEE_KEY);
        int duplicates = beforeDedup - ds.getRowCount();
        report.duplicatesRemoved(duplicates);
        if (duplicates > 0) {
            log.info("[TRANSFORM] Removed {} duplicate records on {}", duplicates, EMPLOYEE_KEY);
        }

        int beforeFilter = ds.getRowCount();
        if (activeOnly) {
            ds = filterActive(ds, report);
        }
        report.rowsFiltered(beforeFilter - ds.getRowCount());

        QualityReport quality = qualityGate.evaluate(ds, "employees");
        report.outputRows(ds.getRowCount()).quality(quality);

        log.info("[TRANSFORM] Transformed {} employee records", ds.getRowCount());
        return new TransformResult(ds, report.build());
    }

    /* ------------------------------------------------------------------ */
    /* Rules                                                               */
    /* ------------------------------------------------------------------ */

    private Dataset fillNulls(Dataset ds) {
        if (ds.hasColumn(MIDDLE_NAME)) {
            ds = ds.mapColumn(MIDDLE_NAME, v -> v == null ? "" : v);
        }
        if (ds.hasColumn(TITLE)) {
            ds = ds.mapColumn(TITLE, v -> v == null ? TITLE_DEFAULT : v);
        }
        return ds;
    }

    private Dataset trimText(Dataset ds) {
        for (String column : TEXT_COLUMNS) {
            if (ds.hasColumn(column)) {
                ds = ds.mapColumn(column, ValueParsers::trim);
            }
        }
        return ds;
    }

    private Dataset deriveFullName(Dataset ds) {
        return ds.withColumn(FULL_NAME, row -> fullName(
                row.getString(FIRST_NAME), row.getString(MIDDLE_NAME), row.getString(LAST_NAME)));
    }

    static String fullName(String... parts) {
        List<String> present = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (part != null && !part.isBlank()) {
                present.add(part.trim());
            }
        }
        return String.join(" ", present);
    }

    private Dataset parseDates(Dataset ds, TransformReport.TransformReportBuilder report) {
        for (String column : DATE_COLUMNS) {
            if (!ds.hasColumn(column)) {
                continue;
            }
            int failures = 0;
            for (Object value : ds.columnValues(column)) {
                if (isPresent(value) && ValueParsers.parseDate(value) == null) {
                    failures++;
                }
            }
            if (failures > 0) {
                log.warn("[TRANSFORM] {} unparseable values in {} set to null", failures, column);
                report.unparseableDate(column, failures);
            }
            ds = ds.mapColumn(column, ValueParsers::parseDate);
        }
        return ds;
    }

    private Dataset deriveDurations(Dataset ds, LocalDate referenceDate, TransformReport.TransformReportBuilder report) {
        ds = deriveYears(ds, AGE, BIRTH_DATE, referenceDate, report);
        return deriveYears(ds, YEARS_OF_SERVICE, HIRE_DATE, referenceDate, report);
    }

    /** Appends {@code target} from {@code source}; skipped with a warning when {@code source} is absent. */
    private Dataset deriveYears(Dataset ds, String target, String source, LocalDate referenceDate,
                                TransformReport.TransformReportBuilder report) {
        List<String> missing = SchemaDescriptor.missing(ds, List.of(source));
        if (!missing.isEmpty()) {
            String warning = target + " not derived: missing column(s) " + missing;
            log.warn("[TRANSFORM] {}", warning);
            report.warning(warning);
            return ds;
        }
        return ds.withColumn(target, row -> wholeYearsBetween((LocalDate) row.get(source), referenceDate));
    }

    /** {@code floor(days / 365)}; null when {@code from} is null. */
    static Long wholeYearsBetween(LocalDate from, LocalDate referenceDate) {
        if (from == null) {
            return null;
        }
        return Math.floorDiv(ChronoUnit.DAYS.between(from, referenceDate), (long) DAYS_PER_YEAR);
    }

    private Dataset coerceFlags(Dataset ds, TransformReport.TransformReportBuilder report) {
        for (String column : BOOLEAN_COLUMNS) {
            if (!ds.hasColumn(column)) {
                continue;
            }
            int unrecognised = 0;
            for (Object value : ds.columnValues(column)) {
                if (value != null && ValueParsers.parseBoolean(value) == null) {
                    unrecognised++;
                }
            }
            if (unrecognised > 0) {
                log.warn("[TRANSFORM] {} unrecognised values in {} set to false", unrecognised, column);
                report.unrecognisedBoolean(column, unrecognised);
            }
            ds = ds.mapColumn(column, v -> Boolean.TRUE.equals(ValueParsers.parseBoolean(v)));
        }
        return ds;
    }

    private Dataset coerceNumerics(Dataset ds, TransformReport.TransformReportBuilder report) {
        for (String column : NUMERIC_COLUMNS) {
            if (!ds.hasColumn(column)) {
                continue;
            }
            int unparseable = 0;
            for (Object value : ds.columnValues(column)) {
                if (isPresent(value) && ValueParsers.parseDecimal(value) == null) {
                    unparseable++;
                }
            }
            if (unparseable > 0) {
                log.warn("[TRANSFORM] {} unparseable values in {} set to 0", unparseable, column);
                report.unparseableNumber(column, unparseable);
            }
            ds = ds.mapColumn(column, v -> {
                BigDecimal parsed = ValueParsers.parseDecimal(v);
                return parsed == null ? BigDecimal.ZERO : parsed;
            });
        }
        return ds;
    }

    private Dataset mapCategoricals(Dataset ds, TransformReport.TransformReportBuilder report) {
        for (CategoricalMapping mapping : CategoricalMapping.values()) {
            String column = mapping.getColumn();
            if (!ds.hasColumn(column)) {
                continue;
            }
            Dataset trimmed = ds.mapColumn(column, ValueParsers::trim);
            Dataset flagged = trimmed.withColumn(mapping.getUnmappedFlagColumn(),
                    row -> mapping.isUnmapped(row.getString(column)));
            int unmapped = 0;
            for (Object flag : flagged.columnValues(mapping.getUnmappedFlagColumn())) {
                if (Boolean.TRUE.equals(flag)) {
                    unmapped++;
                }
            }
            if (unmapped > 0) {
                log.warn("[TRANSFORM] {} unmapped {} codes kept as-is and flagged in {}",
                        unmapped, column, mapping.getUnmappedFlagColumn());
                report.unmappedCode(column, unmapped);
            }
            ds = flagged.mapColumn(column, v -> {
                String code = (String) v;
                String label = mapping.lookup(code);
                return label != null ? label : code;
            });
        }
        return ds;
    }

    private Dataset scoreQuality(Dataset ds) {
        return ds.withColumn(DATA_QUALITY_SCORE, EmployeeTransformer::qualityScore);
    }

    /** 100 minus 10 per null critical field; critical fields absent from the schema do not count. */
    static Integer qualityScore(DataRow row) {
        int score = SCORE_MAX;
        for (String field : CRITICAL_FIELDS) {
            if (row.has(field) && row.isNull(field)) {
                score -= SCORE_PENALTY;
            }
        }
        return score;
    }

    /**
     * Converts {@code EmployeeKey} to {@code Long}.
     *
     * @throws InvalidKeyException if the column is absent or a value is missing or not an integer
     */
    private Dataset conformKey(Dataset ds) {
        if (!ds.hasColumn(EMPLOYEE_KEY)) {
            throw new InvalidKeyException("Required key column '" + EMPLOYEE_KEY + "' is missing");
        }
        List<Object> keys = ds.columnValues(EMPLOYEE_KEY);
        for (int i = 0; i < keys.size(); i++) {
            if (ValueParsers.parseLong(keys.get(i)) == null) {
                throw new InvalidKeyException(String.format(
                        "Row %d has a missing or unparseable %s: '%s'", i, EMPLOYEE_KEY, keys.get(i)));
            }
        }
        return ds.mapColumn(EMPLOYEE_KEY, ValueParsers::parseLong);
    }

    private Dataset filterActive(Dataset ds, TransformReport.TransformReportBuilder report) {
        if (!ds.hasColumn(CURRENT_FLAG)) {
            String warning = "Active-only filter requested but " + CURRENT_FLAG + " is missing; no rows filtered";
            log.warn("[TRANSFORM] {}", warning);
            report.warning(warning);
            return ds;
        }
        Dataset active = ds.filter(row -> Boolean.TRUE.equals(row.get(CURRENT_FLAG)));
        log.info("[TRANSFORM] Filtered to {} active employees", active.getRowCount());
        return active;
    }

    private static boolean isPresent(Object value) {
        return value != null && !value.toString().isBlank();
    }
}
