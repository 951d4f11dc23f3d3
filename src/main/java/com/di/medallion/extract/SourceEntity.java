package com.di.medallion.extract;

import com.di.medallion.model.DepartmentSchema;
import com.di.medallion.model.EmployeeSchema;

import java.util.List;

/**
 * Entities pulled from the source warehouse, with the fixed column list each
 * extraction must return and the file stem used in the bronze layer.
 */
public enum SourceEntity {

    EMPLOYEE("DimEmployee", "dimemployee", EmployeeSchema.SOURCE_COLUMNS),
    DEPARTMENT_GROUP("DimDepartmentGroup", "dimdepartmentgroup", DepartmentSchema.SOURCE_COLUMNS);

    private final String       tableName;
    private final String       fileStem;
    private final List<String> columns;

    SourceEntity(String tableName, String fileStem, List<String> columns) {
        this.tableName = tableName;
        this.fileStem  = fileStem;
        this.columns   = columns;
    }

    public String getTableName() {
        return tableName;
    }

    public String getFileStem() {
        return fileStem;
    }

    public List<String> getColumns() {
        return columns;
    }
}
