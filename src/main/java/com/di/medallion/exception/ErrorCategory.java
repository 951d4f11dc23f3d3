package com.di.medallion.exception;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Classification of fatal errors caught at a phase boundary. The category is
 * recorded with each phase error in the run summary.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a category: add the constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    CONNECTION_ERROR("Source connection error", "Failed to establish or maintain the source database connection"),
    AUTHENTICATION_ERROR("Authentication error", "The source database rejected the configured credentials"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL or unknown table/column in the extraction query"),
    DATABASE_ERROR("Database error", "General source database error"),
    MISSING_INPUT("Missing input", "A required upstream layer file does not exist"),
    DATA_ERROR("Data error", "A required key column is missing or unparseable"),
    STORAGE_ERROR("Storage error", "Reading or writing a layer file failed"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(t -> t instanceof SourceUnavailableException, CONNECTION_ERROR);
        MATCHERS.put(t -> t instanceof LayerFileNotFoundException, MISSING_INPUT);
        MATCHERS.put(t -> t instanceof InvalidKeyException, DATA_ERROR);
        MATCHERS.put(ErrorCategory::isStorageError, STORAGE_ERROR);
        MATCHERS.put(ErrorCategory::isAuthenticationError, AUTHENTICATION_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, CONNECTION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        SQLException sql = findSqlException(exception);
        if (sql != null && !(exception instanceof SourceUnavailableException)) {
            return categorizeSqlException(sql);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        if (exception instanceof ExtractionException) {
            return DATABASE_ERROR;
        }
        return APPLICATION_ERROR;
    }

    private static SQLException findSqlException(Throwable t) {
        Throwable cur = t;
        int depth = 0;
        while (cur != null && depth++ < 10) {
            if (cur instanceof SQLException) {
                return (SQLException) cur;
            }
            cur = cur.getCause();
        }
        return null;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "login failed", "authentication")) return AUTHENTICATION_ERROR;
            if (containsAny(lower, "connection", "timeout", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "syntax", "invalid object name", "invalid column name")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "28", AUTHENTICATION_ERROR,
            "42", SQL_SYNTAX_ERROR,
            "S0", SQL_SYNTAX_ERROR
    );

    // --- Matcher helpers ---

    private static boolean isStorageError(Throwable t) {
        return t instanceof StorageException
                || t instanceof java.io.UncheckedIOException
                || t instanceof java.nio.file.FileSystemException;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.SocketTimeoutException
                || t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isAuthenticationError(Throwable t) {
        return messageContains(t, "login failed", "authentication", "access denied", "invalid credentials");
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(), keywords);
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
