package com.openclaw.scheduler.cron;

import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Next-fire-time calculation for the three schedule kinds.
 *
 * <p>
 * Cron expressions use Spring's {@link CronExpression}; classic 5-field
 * expressions get a leading seconds field. Jitter for cron schedules is drawn
 * on every call, so two computations for the same slot may differ by up to
 * {@code staggerMs}.
 * </p>
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    /** Minimum distance between the end of a cron run and its next fire. */
    public static final long MIN_REFIRE_GAP_MS = 2_000;

    /**
     * Compute the next fire time strictly after {@code fromMs}.
     *
     * @return epoch milliseconds, or null when the schedule has no further runs
     */
    public static Long computeNextRunAtMs(CronTypes.CronSchedule schedule, long fromMs) {
        if (schedule == null || schedule.getKind() == null) {
            return null;
        }
        switch (schedule.getKind()) {
            case AT: {
                Long atMs = CronParse.parseAbsoluteTimeMs(schedule.getAt());
                return atMs != null && atMs > fromMs ? atMs : null;
            }
            case EVERY: {
                long everyMs = Math.max(1, schedule.getEveryMs() == null ? 0 : schedule.getEveryMs());
                Long anchor = schedule.getAnchorMs();
                if (anchor == null) {
                    return fromMs + everyMs;
                }
                if (fromMs < anchor) {
                    return anchor;
                }
                long steps = (fromMs - anchor) / everyMs + 1;
                return anchor + steps * everyMs;
            }
            case CRON: {
                Long next = nextCronFireMs(schedule.getExpr(), schedule.getTz(), fromMs);
                return next == null ? null : next + resolveStaggerOffsetMs(schedule);
            }
            default:
                return null;
        }
    }

    /**
     * Same as {@link #computeNextRunAtMs}, but cron schedules never fire
     * earlier than {@code previousRunEndMs + MIN_REFIRE_GAP_MS}.
     */
    public static Long computeNextRunAtMsWithMinGap(CronTypes.CronSchedule schedule, long fromMs,
            long previousRunEndMs) {
        Long next = computeNextRunAtMs(schedule, fromMs);
        if (schedule == null || schedule.getKind() != CronTypes.ScheduleKind.CRON) {
            return next;
        }
        long minNext = previousRunEndMs + MIN_REFIRE_GAP_MS;
        return next != null ? Math.max(next, minNext) : minNext;
    }

    /**
     * Next instant matching a cron expression, evaluated in {@code tz}.
     */
    public static Long nextCronFireMs(String expr, String tz, long fromMs) {
        CronExpression cron = parseCronExpression(expr);
        ZonedDateTime from = Instant.ofEpochMilli(fromMs).atZone(resolveZone(tz));
        ZonedDateTime next = cron.next(from);
        return next == null ? null : next.toInstant().toEpochMilli();
    }

    /**
     * @throws IllegalArgumentException when the expression is blank or invalid
     */
    public static CronExpression parseCronExpression(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new IllegalArgumentException("cron schedule requires a non-empty expr");
        }
        String trimmed = expr.trim();
        String normalized = !trimmed.startsWith("@") && trimmed.split("\\s+").length == 5
                ? "0 " + trimmed
                : trimmed;
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid cron expression \"" + trimmed + "\": " + e.getMessage(), e);
        }
    }

    /**
     * @throws IllegalArgumentException for an unknown zone id
     */
    public static ZoneId resolveZone(String tz) {
        if (tz == null || tz.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid time zone: " + tz, e);
        }
    }

    static long resolveStaggerOffsetMs(CronTypes.CronSchedule schedule) {
        Long stagger = schedule.getStaggerMs();
        if (stagger == null || stagger <= 0 || Boolean.TRUE.equals(schedule.getExact())) {
            return 0;
        }
        return ThreadLocalRandom.current().nextLong(stagger);
    }
}
