package com.openclaw.scheduler.common.infra;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compact duration and byte-size strings used in config files
 * ("30s", "24h", "1h30m", "7d", "2mb").
 */
public final class DurationParser {

    private DurationParser() {
    }

    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|s|m|h|d)");
    private static final Pattern SIZE_RE = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(b|kb|k|mb|m|gb|g)?$");

    /**
     * Parse a duration such as "90s" or "1h30m".
     *
     * @return milliseconds, or null when the input is blank or malformed
     */
    public static Long parseDurationMs(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return Long.parseLong(trimmed);
        }
        Matcher m = DURATION_PART.matcher(trimmed);
        long total = 0;
        int consumed = 0;
        while (m.find()) {
            if (m.start() != consumed) {
                return null;
            }
            double value = Double.parseDouble(m.group(1));
            total += Math.round(value * unitMs(m.group(2)));
            consumed = m.end();
        }
        return consumed == trimmed.length() && consumed > 0 ? total : null;
    }

    /**
     * Parse a byte size such as "2000000", "512kb" or "2mb".
     *
     * @return bytes, or null when the input is blank or malformed
     */
    public static Long parseByteSize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Matcher m = SIZE_RE.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            return null;
        }
        double value = Double.parseDouble(m.group(1));
        String unit = m.group(2) == null ? "b" : m.group(2);
        long multiplier = switch (unit) {
            case "kb", "k" -> 1024L;
            case "mb", "m" -> 1024L * 1024;
            case "gb", "g" -> 1024L * 1024 * 1024;
            default -> 1L;
        };
        return Math.round(value * multiplier);
    }

    private static long unitMs(String unit) {
        return switch (unit) {
            case "ms" -> 1L;
            case "s" -> 1_000L;
            case "m" -> 60_000L;
            case "h" -> 3_600_000L;
            default -> 86_400_000L;
        };
    }
}
