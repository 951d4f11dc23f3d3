package com.di.medallion.model;

import java.util.List;

/**
 * Column names of the department-group entity. The parent key forms a tree
 * that is carried through unresolved.
 */
public final class DepartmentSchema {

    private DepartmentSchema() {
    }

    public static final String DEPARTMENT_GROUP_KEY        = "DepartmentGroupKey";
    public static final String PARENT_DEPARTMENT_GROUP_KEY = "ParentDepartmentGroupKey";
    public static final String DEPARTMENT_GROUP_NAME       = "DepartmentGroupName";

    public static final List<String> SOURCE_COLUMNS = List.of(
            DEPARTMENT_GROUP_KEY, PARENT_DEPARTMENT_GROUP_KEY, DEPARTMENT_GROUP_NAME);
}
