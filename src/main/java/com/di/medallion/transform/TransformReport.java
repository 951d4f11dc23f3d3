package com.di.medallion.transform;

import com.di.medallion.quality.QualityReport;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Advisory counters collected while conforming one dataset, plus the quality
 * report of the output.
 */
@Value
@Builder
public class TransformReport {

    int inputRows;
    int outputRows;
    int duplicatesRemoved;

    /** Rows dropped by the active-only filter. */
    int rowsFiltered;

    /** Date column → non-empty values that could not be parsed. */
    @Singular
    Map<String, Integer> unparseableDates;

    /** Flag column → non-null values outside the recognised boolean tokens. */
    @Singular
    Map<String, Integer> unrecognisedBooleans;

    /** Numeric column → non-null values replaced with 0. */
    @Singular
    Map<String, Integer> unparseableNumbers;

    /** Categorical column → codes kept as-is because the lookup has no entry. */
    @Singular
    Map<String, Integer> unmappedCodes;

    @Singular
    List<String> warnings;

    QualityReport quality;
}
