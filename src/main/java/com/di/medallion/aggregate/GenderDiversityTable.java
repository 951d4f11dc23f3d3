package com.di.medallion.aggregate;

import com.di.medallion.dataset.DataRow;
import com.di.medallion.dataset.Dataset;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.di.medallion.model.EmployeeSchema.DEPARTMENT_NAME;
import static com.di.medallion.model.EmployeeSchema.GENDER;

/**
 * Employee count per (department, gender) and its share of the department's
 * headcount. Percentages of one department add up to 100 within rounding.
 */
public class GenderDiversityTable implements AnalyticTable {

    public static final String NAME = "gender_diversity";

    public static final List<String> COLUMNS = List.of(DEPARTMENT_NAME, GENDER, "employee_count", "percentage");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(DEPARTMENT_NAME, GENDER);
    }

    @Override
    public Dataset build(Dataset conformed) {
        Map<Object, Integer> departmentTotals = new HashMap<>();
        for (Object department : conformed.columnValues(DEPARTMENT_NAME)) {
            departmentTotals.merge(department, 1, Integer::sum);
        }

        Dataset.Builder out = Dataset.builder(COLUMNS);
        for (Map.Entry<List<Object>, List<DataRow>> group : Grouping.by(conformed, DEPARTMENT_NAME, GENDER).entrySet()) {
            Object department = group.getKey().get(0);
            long count = group.getValue().size();
            out.addRow(Arrays.asList(
                    department,
                    group.getKey().get(1),
                    count,
                    Stats.percentage(count, departmentTotals.get(department))));
        }
        return out.build();
    }
}
