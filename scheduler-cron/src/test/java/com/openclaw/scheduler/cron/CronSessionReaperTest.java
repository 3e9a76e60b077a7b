package com.openclaw.scheduler.cron;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openclaw.scheduler.common.config.SchedulerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CronSessionReaperTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final long NOW = 1_800_000_000_000L;
    private static final long HOUR = 3_600_000L;

    @TempDir
    Path tempDir;

    private Path writeSessions(Map<String, Long> updatedAtByKey) throws IOException {
        Map<String, Object> store = new LinkedHashMap<>();
        updatedAtByKey.forEach((key, updatedAt) -> store.put(key, Map.of("sessionId", key, "updatedAt", updatedAt)));
        Path path = tempDir.resolve("sessions.json");
        Files.writeString(path, JSON.writeValueAsString(store));
        return path;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> read(Path path) throws IOException {
        return JSON.readValue(Files.readString(path), Map.class);
    }

    private static SchedulerConfig.CronConfig retention(String value) {
        SchedulerConfig.CronConfig config = new SchedulerConfig.CronConfig();
        config.setSessionRetention(value);
        return config;
    }

    @Test
    void prunesOnlyExpiredCronRunSessions() throws IOException {
        Map<String, Long> sessions = new LinkedHashMap<>();
        sessions.put("agent:main:main", NOW - 48 * HOUR);
        sessions.put("agent:main:cron:job-1", NOW - 48 * HOUR);
        sessions.put("agent:main:cron:job-1:run:old", NOW - 25 * HOUR);
        sessions.put("agent:main:cron:job-1:run:new", NOW - 23 * HOUR);
        Path path = writeSessions(sessions);

        CronSessionReaper.SweepResult result = new CronSessionReaper().sweep(null, path, NOW);

        assertTrue(result.swept());
        assertEquals(1, result.pruned());
        Map<String, Object> remaining = read(path);
        assertEquals(3, remaining.size());
        assertFalse(remaining.containsKey("agent:main:cron:job-1:run:old"));
    }

    @Test
    void customRetentionAndDisabledPruning() throws IOException {
        Path path = writeSessions(Map.of("agent:ops:cron:j:run:r", NOW - 2 * HOUR));

        assertEquals(new CronSessionReaper.SweepResult(false, 0),
                new CronSessionReaper().sweep(retention("false"), path, NOW));
        assertEquals(1, read(path).size());

        assertEquals(1, new CronSessionReaper().sweep(retention("1h"), path, NOW).pruned());
        assertTrue(read(path).isEmpty());
    }

    @Test
    void sweepsAreThrottledPerPath() throws IOException {
        Path path = writeSessions(Map.of("agent:main:cron:j:run:a", NOW - 2 * HOUR));
        CronSessionReaper reaper = new CronSessionReaper();
        SchedulerConfig.CronConfig config = retention("1h");

        assertTrue(reaper.sweep(config, path, NOW).swept());
        writeSessions(Map.of("agent:main:cron:j:run:b", NOW - 2 * HOUR));
        assertFalse(reaper.sweep(config, path, NOW + 60_000).swept());
        assertEquals(1, read(path).size());

        CronSessionReaper.SweepResult later = reaper.sweep(config, path, NOW + CronSessionReaper.MIN_SWEEP_INTERVAL_MS);
        assertTrue(later.swept());
        assertEquals(1, later.pruned());
    }

    @Test
    void missingStoreIsANoOp() throws IOException {
        CronSessionReaper.SweepResult result = new CronSessionReaper().sweep(null, tempDir.resolve("none.json"), NOW);
        assertEquals(0, result.pruned());
        assertFalse(Files.exists(tempDir.resolve("none.json")));
    }

    @Test
    void retentionParsing() {
        assertEquals(CronSessionReaper.DEFAULT_RETENTION_MS, CronSessionReaper.resolveRetentionMs(null));
        assertEquals(7 * 24 * HOUR, CronSessionReaper.resolveRetentionMs(retention("7d")));
        assertEquals(CronSessionReaper.DEFAULT_RETENTION_MS, CronSessionReaper.resolveRetentionMs(retention("soon")));
        assertNull(CronSessionReaper.resolveRetentionMs(retention("FALSE")));
    }

    @Test
    void cronRunSessionKeyPattern() {
        assertTrue(CronSessionReaper.isCronRunSessionKey("agent:main:cron:abc:run:123"));
        assertFalse(CronSessionReaper.isCronRunSessionKey("agent:main:cron:abc"));
        assertFalse(CronSessionReaper.isCronRunSessionKey(null));
    }
}
