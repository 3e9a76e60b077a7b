package com.openclaw.scheduler.cron;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Cron job input normalization: coerces raw user input (tool calls, RPC
 * params, older store files) into well-typed create/patch objects.
 */
public final class CronNormalize {

    private CronNormalize() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Normalize a raw schedule map (auto-detect kind, coerce at/atMs).
     */
    public static Map<String, Object> coerceSchedule(Map<String, Object> schedule) {
        Map<String, Object> next = new LinkedHashMap<>(schedule);
        String kind = schedule.get("kind") instanceof String k ? k : null;

        Object atMsRaw = schedule.get("atMs");
        Object atRaw = schedule.get("at");
        String atString = atRaw instanceof String s ? s.trim() : "";

        Long parsedAtMs = null;
        if (atMsRaw instanceof Number n) {
            parsedAtMs = n.longValue();
        } else if (atMsRaw instanceof String s) {
            parsedAtMs = CronParse.parseAbsoluteTimeMs(s);
        } else if (!atString.isEmpty()) {
            parsedAtMs = CronParse.parseAbsoluteTimeMs(atString);
        }

        if (kind == null) {
            if (schedule.containsKey("atMs") || schedule.get("at") instanceof String) {
                next.put("kind", "at");
            } else if (schedule.get("everyMs") instanceof Number) {
                next.put("kind", "every");
            } else if (schedule.get("expr") instanceof String) {
                next.put("kind", "cron");
            }
        }

        if (parsedAtMs != null) {
            next.put("at", CronParse.formatIso(parsedAtMs));
        } else if (!atString.isEmpty()) {
            next.put("at", atString);
        }
        next.remove("atMs");

        if (schedule.get("expr") instanceof String expr) {
            next.put("expr", expr.trim());
        }
        if (schedule.get("tz") instanceof String tz) {
            String trimmed = tz.trim();
            if (trimmed.isEmpty())
                next.remove("tz");
            else
                next.put("tz", trimmed);
        }

        return next;
    }

    /**
     * Normalize delivery config (mode aliases, channel/to trimming).
     */
    public static Map<String, Object> coerceDelivery(Map<String, Object> delivery) {
        Map<String, Object> next = new LinkedHashMap<>(delivery);

        if (delivery.get("mode") instanceof String mode) {
            String normalized = mode.trim().toLowerCase(Locale.ROOT);
            next.put("mode", "deliver".equals(normalized) ? "announce" : normalized);
        }
        if (delivery.get("channel") instanceof String ch) {
            String trimmed = ch.trim().toLowerCase(Locale.ROOT);
            if (trimmed.isEmpty())
                next.remove("channel");
            else
                next.put("channel", trimmed);
        }
        if (delivery.get("to") instanceof String to) {
            String trimmed = to.trim();
            if (trimmed.isEmpty())
                next.remove("to");
            else
                next.put("to", trimmed);
        }

        return next;
    }

    // =========================================================================
    // Legacy payload delivery hints
    // =========================================================================

    /**
     * Older jobs carried delivery hints on the payload itself
     * ({@code deliver}, {@code channel}, {@code to}, {@code bestEffortDeliver}).
     */
    public static boolean hasLegacyDeliveryHints(Map<String, Object> payload) {
        if (payload.get("deliver") instanceof Boolean)
            return true;
        if (payload.get("bestEffortDeliver") instanceof Boolean)
            return true;
        return payload.get("to") instanceof String to && !to.isBlank();
    }

    public static Map<String, Object> buildDeliveryFromLegacyPayload(Map<String, Object> payload) {
        Map<String, Object> next = new LinkedHashMap<>();
        next.put("mode", Boolean.FALSE.equals(payload.get("deliver")) ? "none" : "announce");
        String channel = payload.get("channel") instanceof String s ? s.trim().toLowerCase(Locale.ROOT) : "";
        String to = payload.get("to") instanceof String s ? s.trim() : "";
        if (!channel.isEmpty())
            next.put("channel", channel);
        if (!to.isEmpty())
            next.put("to", to);
        if (payload.get("bestEffortDeliver") instanceof Boolean b)
            next.put("bestEffort", b);
        return next;
    }

    public static void stripLegacyDeliveryFields(Map<String, Object> payload) {
        payload.remove("deliver");
        payload.remove("channel");
        payload.remove("to");
        payload.remove("bestEffortDeliver");
    }

    /**
     * Move legacy payload delivery hints into a {@code delivery} block. An
     * existing delivery block wins; the payload hints are dropped either way.
     *
     * @return true if the job map was changed
     */
    @SuppressWarnings("unchecked")
    public static boolean migrateLegacyDelivery(Map<String, Object> job) {
        if (!(job.get("payload") instanceof Map<?, ?> rawPayload)) {
            return false;
        }
        Map<String, Object> payload = new LinkedHashMap<>((Map<String, Object>) rawPayload);
        boolean hasHints = hasLegacyDeliveryHints(payload);
        boolean hasLegacyKeys = payload.containsKey("deliver") || payload.containsKey("channel")
                || payload.containsKey("to") || payload.containsKey("bestEffortDeliver");
        if (!hasLegacyKeys) {
            return false;
        }
        if (hasHints && !(job.get("delivery") instanceof Map)) {
            job.put("delivery", buildDeliveryFromLegacyPayload(payload));
        }
        stripLegacyDeliveryFields(payload);
        job.put("payload", payload);
        return true;
    }

    // =========================================================================
    // Create / patch
    // =========================================================================

    /**
     * Normalize a cron job create map: coerce schedule/payload/delivery and
     * apply defaults.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> normalizeCronJobCreate(Map<String, Object> raw) {
        if (raw == null)
            return null;
        Map<String, Object> next = unwrapJob(raw);
        coerceCommon(next);

        if (!next.containsKey("wakeMode")) {
            next.put("wakeMode", "next-heartbeat");
        }
        if (!(next.get("enabled") instanceof Boolean)) {
            next.put("enabled", true);
        }
        if (!next.containsKey("sessionTarget") && next.get("payload") instanceof Map<?, ?> payload) {
            Object kind = ((Map<String, Object>) payload).get("kind");
            next.put("sessionTarget", "agentTurn".equals(kind) ? "isolated" : "main");
        }
        if (!(next.get("deleteAfterRun") instanceof Boolean)
                && next.get("schedule") instanceof Map<?, ?> schedule
                && "at".equals(((Map<String, Object>) schedule).get("kind"))) {
            next.put("deleteAfterRun", true);
        }

        return next;
    }

    /**
     * Normalize a cron job patch map: coerce but do NOT apply defaults.
     */
    public static Map<String, Object> normalizeCronJobPatch(Map<String, Object> raw) {
        if (raw == null)
            return null;
        Map<String, Object> next = unwrapJob(raw);
        coerceCommon(next);
        return next;
    }

    public static CronTypes.CronJobCreate toJobCreate(Map<String, Object> raw) {
        Map<String, Object> normalized = normalizeCronJobCreate(raw);
        if (normalized == null) {
            throw new IllegalArgumentException("cron job create requires a job object");
        }
        return MAPPER.convertValue(normalized, CronTypes.CronJobCreate.class);
    }

    public static CronTypes.CronJobPatch toJobPatch(Map<String, Object> raw) {
        Map<String, Object> normalized = normalizeCronJobPatch(raw);
        if (normalized == null) {
            throw new IllegalArgumentException("cron job patch requires a patch object");
        }
        return MAPPER.convertValue(normalized, CronTypes.CronJobPatch.class);
    }

    @SuppressWarnings("unchecked")
    private static void coerceCommon(Map<String, Object> next) {
        if (next.get("schedule") instanceof Map<?, ?> sched) {
            next.put("schedule", coerceSchedule((Map<String, Object>) sched));
        }
        migrateLegacyDelivery(next);
        if (next.get("delivery") instanceof Map<?, ?> del) {
            next.put("delivery", coerceDelivery((Map<String, Object>) del));
        }
        if (next.get("name") instanceof String name) {
            next.put("name", name.trim());
        }
        if (next.get("agentId") instanceof String agentId) {
            String trimmed = agentId.trim();
            if (trimmed.isEmpty())
                next.remove("agentId");
            else
                next.put("agentId", trimmed);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> unwrapJob(Map<String, Object> raw) {
        if (raw.get("data") instanceof Map<?, ?> data) {
            return new LinkedHashMap<>((Map<String, Object>) data);
        }
        if (raw.get("job") instanceof Map<?, ?> job) {
            return new LinkedHashMap<>((Map<String, Object>) job);
        }
        return new LinkedHashMap<>(raw);
    }
}
