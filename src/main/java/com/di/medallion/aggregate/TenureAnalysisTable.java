package com.di.medallion.aggregate;

import com.di.medallion.dataset.DataRow;
import com.di.medallion.dataset.Dataset;
import com.di.medallion.util.ValueParsers;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.di.medallion.model.EmployeeSchema.DEPARTMENT_NAME;
import static com.di.medallion.model.EmployeeSchema.YEARS_OF_SERVICE;

/**
 * Employee count per (department, {@link TenureBand}). Bands sort in tenure
 * order; rows without a band are counted under a null band, last.
 */
public class TenureAnalysisTable implements AnalyticTable {

    public static final String NAME = "tenure_analysis";

    public static final String TENURE_BAND = "tenure_band";

    public static final List<String> COLUMNS = List.of(DEPARTMENT_NAME, TENURE_BAND, "employee_count");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(DEPARTMENT_NAME, YEARS_OF_SERVICE);
    }

    @Override
    public Dataset build(Dataset conformed) {
        Map<List<Object>, List<DataRow>> groups = Grouping.by(conformed, row -> Arrays.asList(
                row.get(DEPARTMENT_NAME),
                TenureBand.fromYears(ValueParsers.parseLong(row.get(YEARS_OF_SERVICE)))));

        Dataset.Builder out = Dataset.builder(COLUMNS);
        for (Map.Entry<List<Object>, List<DataRow>> group : groups.entrySet()) {
            TenureBand band = (TenureBand) group.getKey().get(1);
            out.addRow(Arrays.asList(
                    group.getKey().get(0),
                    band == null ? null : band.getLabel(),
                    (long) group.getValue().size()));
        }
        return out.build();
    }
}
