package com.di.medallion.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validation of SQL identifiers that are concatenated into extraction queries.
 * Schema, table and column names come from configuration and cannot be bound as
 * statement parameters, so they are checked here first.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // SQL Server identifier rules
    // ============================================================================

    /** Regular identifier: letter, underscore, @ or # first, up to 128 characters. */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[a-zA-Z_@#][a-zA-Z0-9_@#$]{0,127}$"
    );

    /** Keywords are matched as whole words so names like {@code DimOrganization} pass. */
    private static final Pattern SQL_INJECTION_PATTERN = Pattern.compile(
            "(?i)(\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|EXEC|EXECUTE|UNION|OR|AND)\\b|--|/\\*|\\*/|;|'|\")"
    );

    private static final int MAX_IDENTIFIER_LENGTH = 128;

    /**
     * Validates a single identifier (schema, table or column name).
     *
     * @return the trimmed identifier
     * @throws IllegalArgumentException if the identifier is null, empty, too long or unsafe
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }
        String trimmed = identifier.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }
        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s exceeds maximum length of %d characters: %s",
                            identifierType, MAX_IDENTIFIER_LENGTH, trimmed));
        }
        if (SQL_INJECTION_PATTERN.matcher(trimmed).find()) {
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, sanitizeForLogging(trimmed));
            throw new IllegalArgumentException(
                    String.format("Invalid %s: contains potentially dangerous SQL patterns", identifierType));
        }
        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s: '%s'. Only letters, digits, _, @, # and $ are allowed",
                            identifierType, trimmed));
        }
        return trimmed;
    }

    public static String validateSchemaName(String schemaName) {
        return validateIdentifier(schemaName, "schema name");
    }

    public static String validateTableName(String tableName) {
        return validateIdentifier(tableName, "table name");
    }

    public static String validateColumnName(String columnName) {
        return validateIdentifier(columnName, "column name");
    }

    /** Strips control characters and truncates, for values echoed into logs. */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }
        String cleaned = input.replaceAll("[\\r\\n\\t]", " ");
        return cleaned.length() > 100 ? cleaned.substring(0, 100) + "..." : cleaned;
    }
}
