package com.di.medallion.extract;

import com.di.medallion.exception.ErrorCategory;
import com.di.medallion.exception.SourceUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("SourceConnectionChecker Tests")
class SourceConnectionCheckerTest {

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
    private final SourceConnectionChecker checker = new SourceConnectionChecker(jdbcTemplate);

    @Test
    @DisplayName("Should pass when SELECT 1 returns 1")
    void testVerify_Reachable() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenReturn(1);
        assertDoesNotThrow(checker::verify);
    }

    @Test
    @DisplayName("Should throw SourceUnavailableException when no connection can be obtained")
    void testVerify_Unreachable() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class))
                .thenThrow(new CannotGetJdbcConnectionException("Failed to obtain JDBC Connection"));

        SourceUnavailableException ex = assertThrows(SourceUnavailableException.class, checker::verify);
        assertTrue(ex.getMessage().startsWith("Database connection test failed"));
        assertEquals(ErrorCategory.CONNECTION_ERROR, ErrorCategory.categorize(ex));
    }

    @Test
    @DisplayName("Should throw when the check query returns an unexpected value")
    void testVerify_UnexpectedResult() {
        when(jdbcTemplate.queryForObject("SELECT 1", Integer.class)).thenReturn(0);
        assertThrows(SourceUnavailableException.class, checker::verify);
    }
}
