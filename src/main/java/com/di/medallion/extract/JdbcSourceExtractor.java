package com.di.medallion.extract;

import com.di.medallion.config.SourceSettings;
import com.di.medallion.dataset.Dataset;
import com.di.medallion.exception.ExtractionException;
import com.di.medallion.util.InputValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Extraction adapter for SQL Server. The connection settings are handed in as an
 * immutable {@link SourceSettings}; the adapter keeps no other state.
 */
@Slf4j
@Component
public class JdbcSourceExtractor implements SourceExtractor {

    private final JdbcTemplate   jdbcTemplate;
    private final SourceSettings settings;

    public JdbcSourceExtractor(@Qualifier("sourceJdbcTemplate") JdbcTemplate jdbcTemplate,
                               SourceSettings settings) {
        this.jdbcTemplate = jdbcTemplate;
        this.settings     = settings;
    }

    @Override
    public Dataset extract(SourceEntity entity) {
        String sql;
        try {
            sql = buildQuery(entity);
        } catch (IllegalArgumentException e) {
            throw new ExtractionException(entity.getTableName(), e.getMessage(), e);
        }

        log.info("[EXTRACT] Extracting {} data...", entity.getTableName());
        long start = System.currentTimeMillis();
        List<String> columns = entity.getColumns();
        try {
            List<List<Object>> rows = jdbcTemplate.query(sql, (rs, rowNum) -> readRow(rs, columns.size()));
            Dataset dataset = Dataset.of(columns, rows);
            log.info("[EXTRACT] Extracted {} records from {} in {} ms",
                    dataset.getRowCount(), entity.getTableName(), System.currentTimeMillis() - start);
            return dataset;
        } catch (DataAccessException e) {
            log.error("[EXTRACT] Error extracting {}: {}", entity.getTableName(), e.getMostSpecificCause().getMessage());
            throw new ExtractionException(entity.getTableName(), e.getMostSpecificCause().getMessage(), e);
        }
    }

    String buildQuery(SourceEntity entity) {
        String schema = InputValidator.validateSchemaName(settings.schema());
        String table  = InputValidator.validateTableName(entity.getTableName());
        List<String> selected = new ArrayList<>(entity.getColumns().size());
        for (String column : entity.getColumns()) {
            selected.add(InputValidator.validateColumnName(column));
        }
        return "SELECT " + String.join(", ", selected) + " FROM " + schema + "." + table;
    }

    /** JDBC temporal types become java.time values; everything else is kept as returned. */
    private static List<Object> readRow(ResultSet rs, int width) throws SQLException {
        List<Object> row = new ArrayList<>(width);
        for (int i = 1; i <= width; i++) {
            Object value = rs.getObject(i);
            if (value instanceof Timestamp) {
                value = ((Timestamp) value).toLocalDateTime();
            } else if (value instanceof java.sql.Date) {
                value = ((java.sql.Date) value).toLocalDate();
            } else if (value instanceof Time) {
                value = ((Time) value).toLocalTime();
            }
            row.add(value);
        }
        return row;
    }
}
