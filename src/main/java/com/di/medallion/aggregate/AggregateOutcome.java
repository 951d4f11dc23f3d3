package com.di.medallion.aggregate;

import com.di.medallion.dataset.Dataset;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Result of one analytic table: either the produced dataset or the list of
 * input columns whose absence caused the table to be skipped.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AggregateOutcome {

    String       table;
    Dataset      dataset;
    List<String> missingColumns;

    public static AggregateOutcome produced(String table, Dataset dataset) {
        return new AggregateOutcome(table, dataset, List.of());
    }

    public static AggregateOutcome skipped(String table, List<String> missingColumns) {
        return new AggregateOutcome(table, null, List.copyOf(missingColumns));
    }

    public boolean isProduced() {
        return dataset != null;
    }
}
