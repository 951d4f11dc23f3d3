package com.di.medallion.model;

import com.di.medallion.dataset.ColumnType;
import com.di.medallion.dataset.SchemaDescriptor;

import java.util.List;

/**
 * Column names of the employee entity across the bronze, silver and gold layers.
 */
public final class EmployeeSchema {

    private EmployeeSchema() {
    }

    public static final String EMPLOYEE_KEY      = "EmployeeKey";
    public static final String FIRST_NAME        = "FirstName";
    public static final String MIDDLE_NAME       = "MiddleName";
    public static final String LAST_NAME         = "LastName";
    public static final String TITLE             = "Title";
    public static final String HIRE_DATE         = "HireDate";
    public static final String BIRTH_DATE        = "BirthDate";
    public static final String START_DATE        = "StartDate";
    public static final String END_DATE          = "EndDate";
    public static final String EMAIL_ADDRESS     = "EmailAddress";
    public static final String PHONE             = "Phone";
    public static final String MARITAL_STATUS    = "MaritalStatus";
    public static final String GENDER            = "Gender";
    public static final String BASE_RATE         = "BaseRate";
    public static final String VACATION_HOURS    = "VacationHours";
    public static final String SICK_LEAVE_HOURS  = "SickLeaveHours";
    public static final String CURRENT_FLAG      = "CurrentFlag";
    public static final String SALARIED_FLAG     = "SalariedFlag";
    public static final String SALES_PERSON_FLAG = "SalesPersonFlag";
    public static final String DEPARTMENT_NAME   = "DepartmentName";
    public static final String EMERGENCY_CONTACT_NAME = "EmergencyContactName";

    // derived
    public static final String FULL_NAME               = "FullName";
    public static final String AGE                     = "Age";
    public static final String YEARS_OF_SERVICE        = "YearsOfService";
    public static final String GENDER_UNMAPPED         = "GenderUnmapped";
    public static final String MARITAL_STATUS_UNMAPPED = "MaritalStatusUnmapped";
    public static final String DATA_QUALITY_SCORE      = "data_quality_score";

    // stage metadata
    public static final String EXTRACTION_TIMESTAMP     = "extraction_timestamp";
    public static final String TRANSFORMATION_TIMESTAMP = "transformation_timestamp";

    /** Columns selected from {@code DimEmployee}, in select order. */
    public static final List<String> SOURCE_COLUMNS = List.of(
            EMPLOYEE_KEY,
            "ParentEmployeeKey",
            "EmployeeNationalIDAlternateKey",
            "ParentEmployeeNationalIDAlternateKey",
            "SalesTerritoryKey",
            FIRST_NAME,
            LAST_NAME,
            MIDDLE_NAME,
            "NameStyle",
            TITLE,
            HIRE_DATE,
            BIRTH_DATE,
            "LoginID",
            EMAIL_ADDRESS,
            PHONE,
            MARITAL_STATUS,
            EMERGENCY_CONTACT_NAME,
            "EmergencyContactPhone",
            SALARIED_FLAG,
            GENDER,
            "PayFrequency",
            BASE_RATE,
            VACATION_HOURS,
            SICK_LEAVE_HOURS,
            CURRENT_FLAG,
            SALES_PERSON_FLAG,
            DEPARTMENT_NAME,
            START_DATE,
            END_DATE,
            "Status");

    public static final List<String> TEXT_COLUMNS = List.of(
            FIRST_NAME, LAST_NAME, MIDDLE_NAME, TITLE, DEPARTMENT_NAME, EMERGENCY_CONTACT_NAME);

    public static final List<String> DATE_COLUMNS = List.of(HIRE_DATE, BIRTH_DATE, START_DATE, END_DATE);

    public static final List<String> BOOLEAN_COLUMNS = List.of(SALARIED_FLAG, CURRENT_FLAG, SALES_PERSON_FLAG);

    public static final List<String> NUMERIC_COLUMNS = List.of(BASE_RATE, VACATION_HOURS, SICK_LEAVE_HOURS);

    /** Each null among these costs a record 10 quality points. */
    public static final List<String> CRITICAL_FIELDS = List.of(EMAIL_ADDRESS, PHONE, DEPARTMENT_NAME);

    /** Types of the silver layer, used when the load stage reloads {@code employees_latest}. */
    public static final SchemaDescriptor CONFORMED = SchemaDescriptor.builder()
            .column(EMPLOYEE_KEY, ColumnType.LONG)
            .columns(TEXT_COLUMNS, ColumnType.STRING)
            .columns(DATE_COLUMNS, ColumnType.DATE)
            .columns(BOOLEAN_COLUMNS, ColumnType.BOOLEAN)
            .columns(NUMERIC_COLUMNS, ColumnType.DECIMAL)
            .column(GENDER, ColumnType.STRING)
            .column(MARITAL_STATUS, ColumnType.STRING)
            .column(FULL_NAME, ColumnType.STRING)
            .column(AGE, ColumnType.LONG)
            .column(YEARS_OF_SERVICE, ColumnType.LONG)
            .column(GENDER_UNMAPPED, ColumnType.BOOLEAN)
            .column(MARITAL_STATUS_UNMAPPED, ColumnType.BOOLEAN)
            .column(DATA_QUALITY_SCORE, ColumnType.INTEGER)
            .column(TRANSFORMATION_TIMESTAMP, ColumnType.TIMESTAMP)
            .build();
}
