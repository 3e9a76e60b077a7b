package com.openclaw.scheduler.cron;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Absolute-time parsing for one-shot schedules.
 */
public final class CronParse {

    private CronParse() {
    }

    /**
     * Parse epoch milliseconds given as digits, or an ISO-8601 date or
     * date-time. Zone-less inputs are read as UTC.
     *
     * @return epoch milliseconds, or null if parsing fails
     */
    public static Long parseAbsoluteTimeMs(String input) {
        if (input == null || input.isBlank())
            return null;
        String raw = input.trim();
        if (raw.chars().allMatch(Character::isDigit)) {
            try {
                long n = Long.parseLong(raw);
                return n > 0 ? n : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            if (raw.indexOf('T') < 0) {
                return LocalDate.parse(raw).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(raw,
                    OffsetDateTime::from, LocalDateTime::from);
            OffsetDateTime at = parsed instanceof OffsetDateTime
                    ? (OffsetDateTime) parsed
                    : ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
            return at.toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** Canonical UTC ISO string stored on "at" schedules. */
    public static String formatIso(long epochMs) {
        return Instant.ofEpochMilli(epochMs).toString();
    }
}
