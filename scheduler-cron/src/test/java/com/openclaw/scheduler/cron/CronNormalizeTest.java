package com.openclaw.scheduler.cron;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CronNormalizeTest {

    private static Map<String, Object> map(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            m.put((String) kv[i], kv[i + 1]);
        }
        return m;
    }

    @Test
    void coerceSchedule_detectsKindFromFields() {
        assertEquals("every", CronNormalize.coerceSchedule(map("everyMs", 60000)).get("kind"));
        assertEquals("cron", CronNormalize.coerceSchedule(map("expr", " 0 9 * * * ")).get("kind"));

        Map<String, Object> at = CronNormalize.coerceSchedule(map("atMs", 1704110400000L));
        assertEquals("at", at.get("kind"));
        assertEquals("2024-01-01T12:00:00Z", at.get("at"));
        assertFalse(at.containsKey("atMs"));
    }

    @Test
    void coerceSchedule_zoneLessAtIsUtc_blankTzDropped() {
        Map<String, Object> at = CronNormalize.coerceSchedule(map("kind", "at", "at", "2024-01-01T12:00:00"));
        assertEquals("2024-01-01T12:00:00Z", at.get("at"));

        Map<String, Object> cron = CronNormalize.coerceSchedule(map("kind", "cron", "expr", "0 * * * *", "tz", " "));
        assertFalse(cron.containsKey("tz"));
    }

    @Test
    void coerceDelivery_aliasesAndTrims() {
        Map<String, Object> delivery = CronNormalize.coerceDelivery(
                map("mode", "Deliver", "channel", " Telegram ", "to", " 12345 "));
        assertEquals("announce", delivery.get("mode"));
        assertEquals("telegram", delivery.get("channel"));
        assertEquals("12345", delivery.get("to"));
    }

    @Test
    void migrateLegacyDelivery_movesPayloadHintsIntoDelivery() {
        Map<String, Object> job = new HashMap<>();
        job.put("payload", map("kind", "agentTurn", "message", "hi", "deliver", true,
                "channel", "Slack", "to", "#ops", "bestEffortDeliver", true));

        assertTrue(CronNormalize.migrateLegacyDelivery(job));

        @SuppressWarnings("unchecked")
        Map<String, Object> delivery = (Map<String, Object>) job.get("delivery");
        assertEquals("announce", delivery.get("mode"));
        assertEquals("slack", delivery.get("channel"));
        assertEquals("#ops", delivery.get("to"));
        assertEquals(true, delivery.get("bestEffort"));
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) job.get("payload");
        assertEquals(Map.of("kind", "agentTurn", "message", "hi"), payload);
    }

    @Test
    void migrateLegacyDelivery_existingDeliveryWins() {
        Map<String, Object> job = new HashMap<>();
        job.put("delivery", map("mode", "none"));
        job.put("payload", map("kind", "agentTurn", "message", "hi", "to", "+1555"));

        assertTrue(CronNormalize.migrateLegacyDelivery(job));
        assertEquals(map("mode", "none"), job.get("delivery"));
    }

    @Test
    void migrateLegacyDelivery_noLegacyKeys_unchanged() {
        Map<String, Object> job = new HashMap<>();
        job.put("payload", map("kind", "systemEvent", "text", "ping"));
        assertFalse(CronNormalize.migrateLegacyDelivery(job));
    }

    @Test
    void toJobCreate_appliesDefaults() {
        CronTypes.CronJobCreate create = CronNormalize.toJobCreate(map(
                "name", "  reminder ",
                "schedule", map("at", "2030-01-01T08:00:00Z"),
                "payload", map("kind", "systemEvent", "text", "stand up")));

        assertEquals("reminder", create.getName());
        assertEquals(CronTypes.ScheduleKind.AT, create.getSchedule().getKind());
        assertEquals(CronTypes.SessionTarget.MAIN, create.getSessionTarget());
        assertEquals(CronTypes.WakeMode.NEXT_HEARTBEAT, create.getWakeMode());
        assertEquals(Boolean.TRUE, create.getEnabled());
        assertEquals(Boolean.TRUE, create.getDeleteAfterRun());
    }

    @Test
    void toJobCreate_unwrapsJobEnvelope_andInfersIsolatedTarget() {
        CronTypes.CronJobCreate create = CronNormalize.toJobCreate(map("job", map(
                "name", "digest",
                "schedule", map("everyMs", 3600000),
                "payload", map("kind", "agentTurn", "message", "summarize"))));

        assertEquals(CronTypes.SessionTarget.ISOLATED, create.getSessionTarget());
        assertEquals(3600000L, create.getSchedule().getEveryMs());
        assertNull(create.getDeleteAfterRun());
    }

    @Test
    void toJobPatch_doesNotApplyDefaults() {
        CronTypes.CronJobPatch patch = CronNormalize.toJobPatch(map("enabled", false));
        assertEquals(Boolean.FALSE, patch.getEnabled());
        assertNull(patch.getWakeMode());
        assertNull(patch.getSessionTarget());
    }

    @Test
    void toJobCreate_failureAlertFalseIsSuppression() {
        CronTypes.CronJobCreate create = CronNormalize.toJobCreate(map(
                "name", "quiet",
                "schedule", map("everyMs", 1000),
                "payload", map("kind", "systemEvent", "text", "x"),
                "failureAlert", false));
        assertTrue(create.getFailureAlert().isDisabled());
    }

    @Test
    void toJobCreate_unknownScheduleKind_throws() {
        assertThrows(IllegalArgumentException.class, () -> CronNormalize.toJobCreate(map(
                "name", "bad",
                "schedule", map("kind", "hourly"),
                "payload", map("kind", "systemEvent", "text", "x"))));
    }

    @Test
    void toJobCreate_nullInput_throws() {
        assertThrows(IllegalArgumentException.class, () -> CronNormalize.toJobCreate(null));
    }
}
