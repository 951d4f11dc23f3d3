package com.di.medallion.aggregate;

import com.di.medallion.dataset.Dataset;

import java.util.List;

/**
 * One gold-layer table computed from the conformed employee dataset.
 *
 * <p>Each table declares the columns it needs; the aggregator checks them
 * before calling {@link #build} and skips the table when any is missing.
 */
public interface AnalyticTable {

    /** Table name, also the gold-layer file stem. */
    String name();

    List<String> requiredColumns();

    /** Called only when every {@link #requiredColumns() required column} is present. */
    Dataset build(Dataset conformed);
}
