package com.di.medallion.aggregate;

import com.di.medallion.dataset.DataRow;
import com.di.medallion.util.ValueParsers;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Null-ignoring numeric summaries. All results are rounded to 2 decimals,
 * half-up; an input with no numeric values yields {@code null}.
 */
final class Stats {

    static final int SCALE = 2;

    private Stats() {
    }

    /** Non-null numeric values of {@code column}; empty when the column is absent. */
    static List<BigDecimal> values(List<DataRow> rows, String column) {
        List<BigDecimal> values = new ArrayList<>(rows.size());
        for (DataRow row : rows) {
            BigDecimal v = ValueParsers.parseDecimal(row.getOrNull(column));
            if (v != null) {
                values.add(v);
            }
        }
        return values;
    }

    static BigDecimal mean(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return null;
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal v : values) {
            sum = sum.add(v);
        }
        return round(sum.divide(BigDecimal.valueOf(values.size()), MathContext.DECIMAL128));
    }

    /** Middle value, or the mean of the two middle values for an even count. */
    static BigDecimal median(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return null;
        }
        List<BigDecimal> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int n = sorted.size();
        if (n % 2 == 1) {
            return round(sorted.get(n / 2));
        }
        BigDecimal pair = sorted.get(n / 2 - 1).add(sorted.get(n / 2));
        return round(pair.divide(BigDecimal.valueOf(2), MathContext.DECIMAL128));
    }

    static BigDecimal min(List<BigDecimal> values) {
        return values.isEmpty() ? null : round(Collections.min(values));
    }

    static BigDecimal max(List<BigDecimal> values) {
        return values.isEmpty() ? null : round(Collections.max(values));
    }

    static BigDecimal percentage(long part, long whole) {
        if (whole == 0) {
            return null;
        }
        return BigDecimal.valueOf(part * 100L).divide(BigDecimal.valueOf(whole), SCALE, RoundingMode.HALF_UP);
    }

    static BigDecimal round(BigDecimal value) {
        return value == null ? null : value.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
