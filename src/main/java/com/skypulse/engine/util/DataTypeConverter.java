package com.skypulse.engine.util;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Utility class for the conversions needed when ingest events and Mongo
 * documents are mapped to engine types.
 *
 * All timestamps are interpreted in UTC; the seasonal buckets are computed on
 * the UTC calendar date of an observation.
 */
public final class DataTypeConverter {

    private DataTypeConverter() {
    }

    /**
     * Converts a timestamp string to an Instant.
     *
     * Supports:
     * - ISO 8601 instant (e.g., "2026-04-15T10:30:00Z")
     * - ISO 8601 offset date-time (e.g., "2026-04-15T10:30:00+02:00")
     * - ISO 8601 local date-time, read as UTC (e.g., "2026-04-15T10:30:00")
     * - ISO 8601 date, start of day UTC (e.g., "2026-04-15")
     * - Unix epoch milliseconds (e.g., "1776249000000")
     *
     * @param timestamp The timestamp string to convert, null or empty returns null
     * @throws DateTimeParseException if no format matches
     */
    public static Instant toInstant(String timestamp) {
        if (timestamp == null || timestamp.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(timestamp, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e1) {
            try {
                return LocalDateTime.parse(timestamp, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e2) {
                try {
                    return LocalDate.parse(timestamp).atStartOfDay(ZoneOffset.UTC).toInstant();
                } catch (DateTimeParseException e3) {
                    try {
                        return Instant.ofEpochMilli(Long.parseLong(timestamp));
                    } catch (NumberFormatException e4) {
                        throw new DateTimeParseException(
                                "Unable to parse timestamp: " + timestamp
                                        + ". Tried ISO offset date-time, ISO local date-time, ISO date and epoch milliseconds.",
                                timestamp, 0);
                    }
                }
            }
        }
    }

    /**
     * Converts a date or date-time string to the UTC calendar date.
     *
     * @param value date ("2026-04-15") or any format accepted by toInstant
     * @return LocalDate, or null for null/empty input
     */
    public static LocalDate toLocalDate(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return toUtcDate(toInstant(value));
        }
    }

    public static LocalDate toUtcDate(Instant instant) {
        return instant == null ? null : LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    /**
     * Reads a JSON number or numeric string as BigDecimal without going through
     * binary floating point for strings.
     */
    public static BigDecimal toBigDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new NumberFormatException("Not a price: " + text);
        }
    }

    /**
     * Plain price text for messages ("449", "449.5").
     */
    public static String formatPrice(BigDecimal price) {
        return price == null ? "?" : price.stripTrailingZeros().toPlainString();
    }
}
