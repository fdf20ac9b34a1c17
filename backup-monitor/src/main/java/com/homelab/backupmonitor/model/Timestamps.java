package com.homelab.backupmonitor.model;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.WeekFields;

/**
 * ISO-8601 handling for record timestamps.
 *
 * Timestamps are stored as the producer wrote them and compared as strings;
 * for ISO-8601 values that ordering is chronological. Cutoffs are rendered as
 * local date-times so they compare against the same prefix.
 */
public final class Timestamps {

    /** yyyy-MM-dd, optionally followed by THH:mm[:ss[.fff]] and an offset or Z. */
    private static final DateTimeFormatter ISO_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private Timestamps() {
    }

    public static boolean isValid(String text) {
        if (text == null) return false;
        try {
            ISO_TIMESTAMP.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /** Calendar date of a stored timestamp, as written (no zone conversion). */
    public static LocalDate dateOf(String text) {
        return ISO_TIMESTAMP.parse(text, LocalDate::from);
    }

    /** ISO week key such as "2026-W07", using the week-based year. */
    public static String isoWeekOf(String text) {
        LocalDate date = dateOf(text);
        int week = date.get(WeekFields.ISO.weekOfWeekBasedYear());
        int year = date.get(WeekFields.ISO.weekBasedYear());
        return String.format("%04d-W%02d", year, week);
    }

    /** Lower bound for "the trailing N days", comparable with stored timestamps. */
    public static String daysAgo(Clock clock, int days) {
        return LocalDateTime.now(clock).minusDays(days).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }
}
