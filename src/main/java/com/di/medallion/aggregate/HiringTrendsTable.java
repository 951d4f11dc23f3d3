package com.di.medallion.aggregate;

import com.di.medallion.dataset.DataRow;
import com.di.medallion.dataset.Dataset;
import com.di.medallion.util.ValueParsers;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static com.di.medallion.model.EmployeeSchema.DEPARTMENT_NAME;
import static com.di.medallion.model.EmployeeSchema.HIRE_DATE;

/**
 * New hires per (hire year, department), most recent year first and, within a
 * year, the busiest department first.
 */
public class HiringTrendsTable implements AnalyticTable {

    public static final String NAME = "hiring_trends";

    public static final String HIRE_YEAR = "hire_year";
    public static final String NEW_HIRES = "new_hires";

    public static final List<String> COLUMNS = List.of(HIRE_YEAR, DEPARTMENT_NAME, NEW_HIRES);

    /** hire_year desc, new_hires desc, DepartmentName asc; nulls last throughout. */
    static final Comparator<List<Object>> ROW_ORDER = Comparator
            .comparing((List<Object> r) -> (Integer) r.get(0), Comparator.nullsLast(Comparator.<Integer>reverseOrder()))
            .thenComparing(r -> (Long) r.get(2), Comparator.nullsLast(Comparator.<Long>reverseOrder()))
            .thenComparing(r -> (String) r.get(1), Comparator.nullsLast(Comparator.<String>naturalOrder()));

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> requiredColumns() {
        return List.of(HIRE_DATE, DEPARTMENT_NAME);
    }

    @Override
    public Dataset build(Dataset conformed) {
        Map<List<Object>, List<DataRow>> groups = Grouping.by(conformed, row -> Arrays.asList(
                hireYear(row.get(HIRE_DATE)),
                row.get(DEPARTMENT_NAME)));

        List<List<Object>> rows = new ArrayList<>(groups.size());
        for (Map.Entry<List<Object>, List<DataRow>> group : groups.entrySet()) {
            rows.add(Arrays.asList(group.getKey().get(0), group.getKey().get(1), (long) group.getValue().size()));
        }
        rows.sort(ROW_ORDER);
        return Dataset.of(COLUMNS, rows);
    }

    private static Integer hireYear(Object hireDate) {
        LocalDate date = ValueParsers.parseDate(hireDate);
        return date == null ? null : date.getYear();
    }
}
