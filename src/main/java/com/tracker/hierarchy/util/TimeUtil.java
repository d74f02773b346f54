package com.tracker.hierarchy.util;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Time parsing and whole-day arithmetic.
 * Uses java.time formatters, which are thread-safe.
 */
@Slf4j
public class TimeUtil {

    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

    private TimeUtil() {
    }

    /**
     * Parse an ISO-8601 timestamp with offset, e.g. {@code 2024-03-01T10:15:30.123Z}.
     *
     * @param timeStr timestamp string
     * @return the parsed time, or null if the string is empty or malformed
     */
    public static OffsetDateTime parseDateTime(String timeStr) {
        if (timeStr == null || timeStr.trim().isEmpty()) {
            return null;
        }

        try {
            return OffsetDateTime.parse(timeStr.trim(), DATE_TIME_FORMATTER);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable timestamp: {}, error: {}", timeStr, e.getMessage());
            return null;
        }
    }

    /**
     * Parse an ISO-8601 calendar date, e.g. {@code 2024-03-31}.
     *
     * @param dateStr date string
     * @return the parsed date, or null if the string is empty or malformed
     */
    public static LocalDate parseDate(String dateStr) {
        if (dateStr == null || dateStr.trim().isEmpty()) {
            return null;
        }

        try {
            return LocalDate.parse(dateStr.trim(), DATE_FORMATTER);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable date: {}, error: {}", dateStr, e.getMessage());
            return null;
        }
    }

    /**
     * Complete days elapsed from {@code start} to {@code end}; partial days are dropped.
     */
    public static long wholeDaysBetween(OffsetDateTime start, OffsetDateTime end) {
        return ChronoUnit.DAYS.between(start, end);
    }

    /**
     * Calendar days from {@code start} to {@code end}.
     */
    public static long daysBetween(LocalDate start, LocalDate end) {
        return ChronoUnit.DAYS.between(start, end);
    }
}
