package com.di.medallion.extract;

import com.di.medallion.config.SourceSettings;
import com.di.medallion.dataset.Dataset;
import com.di.medallion.exception.ErrorCategory;
import com.di.medallion.exception.ExtractionException;
import com.di.medallion.model.DepartmentSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("JdbcSourceExtractor Tests")
class JdbcSourceExtractorTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcSourceExtractor extractor;

    private static SourceSettings settings(String schema) {
        return new SourceSettings("localhost", "AdventureWorksDW2022", schema, "", "",
                true, true, 2, 30000L, 15);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        extractor = new JdbcSourceExtractor(jdbcTemplate, settings("dbo"));
    }

    @Test
    @DisplayName("Should select the declared columns from schema.table")
    void testBuildQuery() {
        String sql = extractor.buildQuery(SourceEntity.DEPARTMENT_GROUP);
        assertEquals("SELECT DepartmentGroupKey, ParentDepartmentGroupKey, DepartmentGroupName "
                + "FROM dbo.DimDepartmentGroup", sql);
    }

    @Test
    @DisplayName("Should select all employee columns in extraction order")
    void testBuildQuery_Employee() {
        String sql = extractor.buildQuery(SourceEntity.EMPLOYEE);
        assertTrue(sql.startsWith("SELECT EmployeeKey, ParentEmployeeKey, "));
        assertTrue(sql.endsWith("StartDate, EndDate, Status FROM dbo.DimEmployee"));
        assertEquals(30, SourceEntity.EMPLOYEE.getColumns().size());
    }

    @Test
    @DisplayName("Should return a dataset with the entity's columns and converted temporal values")
    @SuppressWarnings("unchecked")
    void testExtract_MapsRows() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getObject(1)).thenReturn(1);
        when(rs.getObject(2)).thenReturn(null);
        when(rs.getObject(3)).thenReturn(Timestamp.valueOf(LocalDateTime.of(2020, 1, 2, 3, 4, 5)));

        when(jdbcTemplate.query(anyString(), any(RowMapper.class))).thenAnswer(inv -> {
            RowMapper<List<Object>> mapper = inv.getArgument(1);
            List<List<Object>> rows = new ArrayList<>();
            rows.add(mapper.mapRow(rs, 0));
            return rows;
        });

        Dataset ds = extractor.extract(SourceEntity.DEPARTMENT_GROUP);

        assertEquals(DepartmentSchema.SOURCE_COLUMNS, ds.getColumns());
        assertEquals(1, ds.getRowCount());
        assertEquals(1, ds.getValue(0, "DepartmentGroupKey"));
        assertNull(ds.getValue(0, "ParentDepartmentGroupKey"));
        assertEquals(LocalDateTime.of(2020, 1, 2, 3, 4, 5), ds.getValue(0, "DepartmentGroupName"));
        verify(jdbcTemplate).query(eq("SELECT DepartmentGroupKey, ParentDepartmentGroupKey, DepartmentGroupName "
                + "FROM dbo.DimDepartmentGroup"), any(RowMapper.class));
    }

    @Test
    @DisplayName("Should wrap JDBC failures in a single ExtractionException")
    @SuppressWarnings("unchecked")
    void testExtract_Failure() {
        SQLException cause = new SQLException("Invalid object name 'dbo.DimEmployee'.", "S0002");
        when(jdbcTemplate.query(anyString(), any(RowMapper.class)))
                .thenThrow(new BadSqlGrammarException("extract", "SELECT ...", cause));

        ExtractionException ex = assertThrows(ExtractionException.class,
                () -> extractor.extract(SourceEntity.EMPLOYEE));

        assertEquals("DimEmployee", ex.getEntity());
        assertTrue(ex.getMessage().startsWith("Failed to extract DimEmployee: "));
        assertEquals(ErrorCategory.SQL_SYNTAX_ERROR, ErrorCategory.categorize(ex));
    }

    @Test
    @DisplayName("Should refuse an unsafe schema name without querying")
    void testExtract_UnsafeSchema() {
        JdbcSourceExtractor unsafe = new JdbcSourceExtractor(jdbcTemplate, settings("dbo; DROP TABLE x--"));

        assertThrows(ExtractionException.class, () -> unsafe.extract(SourceEntity.EMPLOYEE));
        verifyNoInteractions(jdbcTemplate);
    }
}
