package com.di.medallion.aggregate;

import com.di.medallion.dataset.DataRow;
import com.di.medallion.dataset.Dataset;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Deterministic group-by: groups come back sorted by key, component by
 * component, ascending with nulls last. A null key component forms its own group.
 */
final class Grouping {

    private Grouping() {
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static final Comparator<Object> NULLS_LAST =
            Comparator.nullsLast((a, b) -> ((Comparable) a).compareTo(b));

    static final Comparator<List<Object>> KEY_ORDER = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = NULLS_LAST.compare(a.get(i), b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    /** Groups rows by the listed columns. */
    static Map<List<Object>, List<DataRow>> by(Dataset dataset, String... columns) {
        return by(dataset, row -> {
            List<Object> key = new ArrayList<>(columns.length);
            for (String column : columns) {
                key.add(row.get(column));
            }
            return key;
        });
    }

    /** Groups rows by a computed key; key components must be mutually comparable per position. */
    static Map<List<Object>, List<DataRow>> by(Dataset dataset, Function<DataRow, List<Object>> keyFn) {
        Map<List<Object>, List<DataRow>> groups = new TreeMap<>(KEY_ORDER);
        for (DataRow row : dataset.rows()) {
            groups.computeIfAbsent(keyFn.apply(row), k -> new ArrayList<>()).add(row);
        }
        return groups;
    }
}
