package com.di.medallion.transform;

import com.di.medallion.dataset.Dataset;
import com.di.medallion.exception.InvalidKeyException;
import com.di.medallion.util.ValueParsers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Key-based deduplication keeping the last occurrence of each key.
 */
public final class Deduplicator {

    private Deduplicator() {
    }

    /**
     * Keeps, for every distinct value of {@code keyColumn}, the last row carrying it.
     * Surviving rows stay in their original relative order.
     *
     * @throws InvalidKeyException if the key column is absent or a key is null or not an integer
     */
    public static Dataset keepLast(Dataset dataset, String keyColumn) {
        if (!dataset.hasColumn(keyColumn)) {
            throw new InvalidKeyException("Key column '" + keyColumn + "' is missing");
        }
        Map<Long, Integer> lastRowByKey = new LinkedHashMap<>();
        List<Object> keys = dataset.columnValues(keyColumn);
        for (int i = 0; i < keys.size(); i++) {
            Long key = ValueParsers.parseLong(keys.get(i));
            if (key == null) {
                throw new InvalidKeyException(String.format(
                        "Row %d has a missing or unparseable %s: '%s'", i, keyColumn, keys.get(i)));
            }
            lastRowByKey.put(key, i);
        }
        if (lastRowByKey.size() == dataset.getRowCount()) {
            return dataset;
        }
        List<Integer> survivors = new ArrayList<>(lastRowByKey.values());
        Collections.sort(survivors);
        return dataset.selectRows(survivors);
    }
}
