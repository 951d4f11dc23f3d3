package com.di.medallion.dataset;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared column types of a stage's output.
 *
 * <p>Used two ways: a consumer reloading a persisted layer re-types the text
 * values it reads ({@link #retype}), and an optional derivation checks its
 * declared inputs against an actual schema before running ({@link #missing}).
 */
public final class SchemaDescriptor {

    private final Map<String, ColumnType> types;

    private SchemaDescriptor(Map<String, ColumnType> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Coerces every declared column present in {@code dataset}; undeclared
     * columns are left untouched.
     */
    public Dataset retype(Dataset dataset) {
        Dataset out = dataset;
        for (Map.Entry<String, ColumnType> e : types.entrySet()) {
            if (out.hasColumn(e.getKey())) {
                ColumnType type = e.getValue();
                out = out.mapColumn(e.getKey(), type::coerce);
            }
        }
        return out;
    }

    /** Columns of {@code required} absent from {@code dataset}, in declaration order. */
    public static List<String> missing(Dataset dataset, Collection<String> required) {
        List<String> absent = new ArrayList<>();
        for (String column : required) {
            if (!dataset.hasColumn(column)) {
                absent.add(column);
            }
        }
        return absent;
    }

    public static final class Builder {

        private final Map<String, ColumnType> types = new LinkedHashMap<>();

        public Builder column(String name, ColumnType type) {
            types.put(name, type);
            return this;
        }

        public Builder columns(Collection<String> names, ColumnType type) {
            for (String name : names) {
                types.put(name, type);
            }
            return this;
        }

        public SchemaDescriptor build() {
            return new SchemaDescriptor(types);
        }
    }
}
