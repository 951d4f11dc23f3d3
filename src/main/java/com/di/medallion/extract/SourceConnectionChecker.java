package com.di.medallion.extract;

import com.di.medallion.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Pre-flight connectivity check against the source database.
 */
@Slf4j
@Component
public class SourceConnectionChecker {

    private static final String CHECK_SQL = "SELECT 1";

    private final JdbcTemplate jdbcTemplate;

    public SourceConnectionChecker(@Qualifier("sourceJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @throws SourceUnavailableException if the check query fails or returns an unexpected value
     */
    public void verify() {
        log.info("[PREFLIGHT] Testing source database connection...");
        Integer result;
        try {
            result = jdbcTemplate.queryForObject(CHECK_SQL, Integer.class);
        } catch (DataAccessException e) {
            throw new SourceUnavailableException(
                    "Database connection test failed: " + e.getMostSpecificCause().getMessage(), e);
        }
        if (result == null || result != 1) {
            throw new SourceUnavailableException("Database connection test returned " + result, null);
        }
        log.info("[PREFLIGHT] Database connection test successful");
    }
}
