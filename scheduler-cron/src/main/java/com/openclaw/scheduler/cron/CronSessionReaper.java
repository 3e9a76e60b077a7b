package com.openclaw.scheduler.cron;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.openclaw.scheduler.common.config.SchedulerConfig;
import com.openclaw.scheduler.common.infra.DurationParser;
import com.openclaw.scheduler.common.infra.JsonFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Prunes finished isolated-run sessions ({@code ...:cron:<jobId>:run:<runId>})
 * from a session store once they are older than the configured retention.
 * Sweeps are throttled per store path.
 */
@Slf4j
public class CronSessionReaper {

    public static final long DEFAULT_RETENTION_MS = 24L * 3600_000;
    public static final long MIN_SWEEP_INTERVAL_MS = 5L * 60_000;

    private static final Pattern CRON_RUN_SESSION_KEY = Pattern.compile(":cron:[^:]+:run:");
    private static final TypeReference<LinkedHashMap<String, Object>> STORE_TYPE = new TypeReference<>() {
    };
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public record SweepResult(boolean swept, int pruned) {
        static final SweepResult SKIPPED = new SweepResult(false, 0);
    }

    private final Map<Path, Long> lastSweepAtMs = new ConcurrentHashMap<>();

    /**
     * Resolve the retention window, or null when pruning is disabled.
     */
    public static Long resolveRetentionMs(SchedulerConfig.CronConfig config) {
        String raw = config != null ? config.getSessionRetention() : null;
        if (raw == null || raw.isBlank()) {
            return DEFAULT_RETENTION_MS;
        }
        if ("false".equalsIgnoreCase(raw.trim())) {
            return null;
        }
        Long parsed = DurationParser.parseDurationMs(raw);
        if (parsed == null) {
            log.warn("cron: invalid sessionRetention '{}', using default", raw);
            return DEFAULT_RETENTION_MS;
        }
        return parsed;
    }

    public static boolean isCronRunSessionKey(String key) {
        return key != null && CRON_RUN_SESSION_KEY.matcher(key).find();
    }

    /**
     * Sweep one session store. Returns without touching the file when the
     * path was swept within the last five minutes or pruning is disabled.
     */
    public SweepResult sweep(SchedulerConfig.CronConfig config, Path sessionStorePath, long nowMs)
            throws IOException {
        if (sessionStorePath == null) {
            return SweepResult.SKIPPED;
        }
        Path key = sessionStorePath.toAbsolutePath().normalize();
        Long last = lastSweepAtMs.get(key);
        if (last != null && nowMs - last < MIN_SWEEP_INTERVAL_MS) {
            return SweepResult.SKIPPED;
        }
        Long retentionMs = resolveRetentionMs(config);
        if (retentionMs == null) {
            return SweepResult.SKIPPED;
        }
        lastSweepAtMs.put(key, nowMs);

        String content = JsonFile.readString(sessionStorePath);
        if (content == null || content.isBlank()) {
            return new SweepResult(true, 0);
        }
        Map<String, Object> sessions;
        try {
            sessions = MAPPER.readValue(content, STORE_TYPE);
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to parse session store at " + sessionStorePath + ": "
                    + e.getOriginalMessage(), e);
        }

        long cutoff = nowMs - retentionMs;
        int pruned = 0;
        Iterator<Map.Entry<String, Object>> it = sessions.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Object> entry = it.next();
            if (!isCronRunSessionKey(entry.getKey())) {
                continue;
            }
            Long updatedAt = readUpdatedAt(entry.getValue());
            if (updatedAt != null && updatedAt < cutoff) {
                it.remove();
                pruned++;
            }
        }
        if (pruned > 0) {
            JsonFile.writeAtomic(sessionStorePath, MAPPER.writeValueAsString(sessions) + "\n", false);
            log.info("cron: pruned {} expired cron run session(s) from {}", pruned, sessionStorePath);
        }
        return new SweepResult(true, pruned);
    }

    private static Long readUpdatedAt(Object entry) {
        if (entry instanceof Map<?, ?> map && map.get("updatedAt") instanceof Number n) {
            return n.longValue();
        }
        return null;
    }
}
