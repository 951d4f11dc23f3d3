package com.di.medallion.aggregate;

import com.di.medallion.dataset.DataRow;
import com.di.medallion.dataset.Dataset;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.di.medallion.model.EmployeeSchema.*;

/**
 * Headcount and pay/tenure/leave statistics per department. {@code YearsOfService},
 * {@code Age} and the leave-hour columns are optional: their averages are null
 * when the column is absent.
 */
public class DepartmentSummaryTable implements AnalyticTable {

    public static final String NAME = "department_summary";

    public static final List<String> COLUMNS = List.of(
            DEPARTMENT_NAME,
            "total_employees",
            "avg_base_rate",
            "median_base_rate",
            "avg_years_of_service",
            "avg_age",
            "avg_vacation_hours",
            "avg_sick_leave_hours",
            "min_base_rate",
            "max_base_rate");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(DEPARTMENT_NAME, EMPLOYEE_KEY, BASE_RATE);
    }

    @Override
    public Dataset build(Dataset conformed) {
        Dataset.Builder out = Dataset.builder(COLUMNS);
        for (Map.Entry<List<Object>, List<DataRow>> group : Grouping.by(conformed, DEPARTMENT_NAME).entrySet()) {
            List<DataRow> rows = group.getValue();
            List<BigDecimal> baseRates = Stats.values(rows, BASE_RATE);
            out.addRow(Arrays.asList(
                    group.getKey().get(0),
                    countKeys(rows),
                    Stats.mean(baseRates),
                    Stats.median(baseRates),
                    Stats.mean(Stats.values(rows, YEARS_OF_SERVICE)),
                    Stats.mean(Stats.values(rows, AGE)),
                    Stats.mean(Stats.values(rows, VACATION_HOURS)),
                    Stats.mean(Stats.values(rows, SICK_LEAVE_HOURS)),
                    Stats.min(baseRates),
                    Stats.max(baseRates)));
        }
        return out.build();
    }

    private static long countKeys(List<DataRow> rows) {
        long count = 0;
        for (DataRow row : rows) {
            if (!row.isNull(EMPLOYEE_KEY)) {
                count++;
            }
        }
        return count;
    }
}
