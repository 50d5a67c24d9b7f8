package se.artisan_be.util;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Typed reads from JDBC result rows returned as column maps.
 */
public final class RowValues {

    private RowValues() {
    }

    public static String asString(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    public static Long asLong(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    public static Integer asInteger(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    public static Double asDouble(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    public static BigDecimal asDecimal(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        return value instanceof Number ? BigDecimal.valueOf(((Number) value).doubleValue()) : null;
    }

    public static Boolean asBoolean(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        return value == null ? null : Boolean.valueOf(value.toString());
    }

    public static LocalDate asLocalDate(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof Date) {
            return ((Date) value).toLocalDate();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toLocalDate();
        }
        return null;
    }

    public static LocalDateTime asLocalDateTime(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        }
        return null;
    }

    /** Numeric cell or zero, for chart payloads where a missing count means none. */
    public static Number numberOrZero(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value instanceof Number ? (Number) value : 0;
    }
}
