package com.di.medallion.util;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lenient converters from source values (JDBC objects or CSV strings) to the
 * types used in the conformed layer.
 *
 * <p>Every method is total: a value that cannot be converted yields
 * {@code null}, never an exception. Callers decide what the sentinel means
 * (absent date, zero amount, {@code false} flag).
 */
@Slf4j
public final class ValueParsers {

    private ValueParsers() {
        // Utility class - prevent instantiation
    }

    /**
     * Date-only patterns tried after the ISO forms, in order. Month-first
     * patterns win over day-first ones for both {@code /} and {@code -}, so
     * {@code 01/02/2020} and {@code 01-02-2020} are both January 2nd; a day-first
     * pattern only matches when the first field cannot be a month.
     */
    private static final List<String> KNOWN_DATE_PATTERNS = Arrays.asList(
            "uuuu-MM-dd",
            "MM/dd/uuuu",
            "MM-dd-uuuu",
            "dd/MM/uuuu",
            "dd-MM-uuuu",
            "uuuu/MM/dd",
            "dd.MM.uuuu",
            "uuuu.MM.dd",
            "uuuuMMdd"
    );

    /** Strict resolution: impossible calendar dates such as {@code 2020-02-31} fail instead of clamping. */
    private static final List<DateTimeFormatter> DATE_FORMATTERS = KNOWN_DATE_PATTERNS.stream()
            .map(pattern -> DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT))
            .toList();

    /** SQL Server / pandas style {@code 2009-01-14 00:00:00[.fffffff]}. */
    private static final DateTimeFormatter SPACE_DATE_TIME =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss[.SSSSSSSSS][.SSSSSSS][.SSSSSS][.SSS]")
                    .withResolverStyle(ResolverStyle.STRICT);

    private static final Set<String> TRUE_TOKENS  = Set.of("true", "1", "yes", "y", "t");
    private static final Set<String> FALSE_TOKENS = Set.of("false", "0", "no", "n", "f");

    // ============================================================================
    // Dates
    // ============================================================================

    public static LocalDate parseDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toLocalDate();
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant().atOffset(ZoneOffset.UTC).toLocalDate();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        LocalDateTime dateTime = parseDateTimeText(text);
        if (dateTime != null) {
            return dateTime.toLocalDate();
        }
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(text, formatter);
            } catch (DateTimeParseException ignored) {
                // next pattern
            }
        }
        log.debug("Unparseable date value '{}'", text);
        return null;
    }

    public static LocalDateTime parseDateTime(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().atStartOfDay();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        LocalDateTime dateTime = parseDateTimeText(text);
        if (dateTime != null) {
            return dateTime;
        }
        LocalDate date = parseDate(text);
        return date == null ? null : date.atStartOfDay();
    }

    private static LocalDateTime parseDateTimeText(String text) {
        if (text.length() < 11) {
            return null;
        }
        try {
            return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return LocalDateTime.parse(text, SPACE_DATE_TIME);
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    // ============================================================================
    // Numbers
    // ============================================================================

    public static BigDecimal parseDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        if (value instanceof Boolean) {
            return null;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses an integral value. {@code "7.0"} is accepted (text layers written by
     * other tools often render integer keys that way); {@code "7.5"} is not.
     */
    public static Long parseLong(Object value) {
        if (value instanceof Long) {
            return (Long) value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        BigDecimal decimal = parseDecimal(value);
        if (decimal == null) {
            return null;
        }
        try {
            return decimal.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    // ============================================================================
    // Booleans
    // ============================================================================

    /** Recognised truthy/falsy tokens, numbers (non-zero is true), or {@code null}. */
    public static Boolean parseBoolean(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        String token = value.toString().trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(token)) {
            return Boolean.TRUE;
        }
        if (FALSE_TOKENS.contains(token)) {
            return Boolean.FALSE;
        }
        return null;
    }

    // ============================================================================
    // Text
    // ============================================================================

    public static String trim(Object value) {
        return value == null ? null : value.toString().trim();
    }
}
