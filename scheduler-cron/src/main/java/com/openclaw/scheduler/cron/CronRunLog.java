package com.openclaw.scheduler.cron;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openclaw.scheduler.common.config.SchedulerConfig;
import com.openclaw.scheduler.common.infra.DurationParser;
import com.openclaw.scheduler.common.infra.JsonFile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Per-job JSONL run history under {@code <storeDir>/runs/<jobId>.jsonl}.
 */
@Slf4j
public final class CronRunLog {

    private CronRunLog() {
    }

    public static final long DEFAULT_MAX_BYTES = 2_000_000;
    public static final int DEFAULT_KEEP_LINES = 2_000;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * One finished run.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        private long ts;
        private String jobId;
        @Builder.Default
        private String action = "finished";
        private CronTypes.RunStatus status;
        private String error;
        private String summary;
        private CronTypes.DeliveryStatus deliveryStatus;
        private Long runAtMs;
        private Long durationMs;
        private Long nextRunAtMs;
        private String model;
        private String provider;
        private String sessionId;
        private String sessionKey;
        private Map<String, Object> usage;

        public static Entry fromEvent(CronState.CronEvent event, long ts) {
            return Entry.builder()
                    .ts(ts)
                    .jobId(event.getJobId())
                    .status(event.getStatus())
                    .error(event.getError())
                    .summary(event.getSummary())
                    .deliveryStatus(event.getDeliveryStatus())
                    .runAtMs(event.getRunAtMs())
                    .durationMs(event.getDurationMs())
                    .nextRunAtMs(event.getNextRunAtMs())
                    .model(event.getModel())
                    .provider(event.getProvider())
                    .sessionId(event.getSessionId())
                    .sessionKey(event.getSessionKey())
                    .usage(event.getUsage())
                    .build();
        }
    }

    public static Path resolveRunLogPath(Path storePath, String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }
        if (jobId.contains("/") || jobId.contains("\\") || jobId.contains("..") || jobId.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("invalid cron run log job id: " + jobId);
        }
        Path dir = storePath.toAbsolutePath().getParent();
        return dir.resolve("runs").resolve(jobId + ".jsonl");
    }

    public static long resolveMaxBytes(SchedulerConfig.CronConfig config) {
        SchedulerConfig.RunLogConfig runLog = config != null ? config.getRunLog() : null;
        Long parsed = runLog != null ? DurationParser.parseByteSize(runLog.getMaxBytes()) : null;
        return parsed != null && parsed > 0 ? parsed : DEFAULT_MAX_BYTES;
    }

    public static int resolveKeepLines(SchedulerConfig.CronConfig config) {
        SchedulerConfig.RunLogConfig runLog = config != null ? config.getRunLog() : null;
        Integer keep = runLog != null ? runLog.getKeepLines() : null;
        return keep != null && keep > 0 ? keep : DEFAULT_KEEP_LINES;
    }

    /**
     * Append one entry; when the file grows past {@code maxBytes} it is
     * rewritten with only the last {@code keepLines} lines.
     */
    public static synchronized void appendEntry(Path filePath, Entry entry, long maxBytes, int keepLines)
            throws IOException {
        Files.createDirectories(filePath.toAbsolutePath().getParent());
        String line = MAPPER.writeValueAsString(entry) + "\n";
        Files.writeString(filePath, line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        pruneIfNeeded(filePath, maxBytes, keepLines);
    }

    private static void pruneIfNeeded(Path filePath, long maxBytes, int keepLines) throws IOException {
        if (Files.size(filePath) <= maxBytes) {
            return;
        }
        List<String> lines = nonBlankLines(filePath);
        List<String> kept = lines.subList(Math.max(0, lines.size() - keepLines), lines.size());
        JsonFile.writeAtomic(filePath, String.join("\n", kept) + "\n", false);
        log.debug("cron: pruned run log {} to {} lines", filePath, kept.size());
    }

    /**
     * Read up to {@code limit} entries, newest first. Malformed lines are
     * skipped.
     */
    public static List<Entry> readEntries(Path filePath, int limit) throws IOException {
        if (!Files.exists(filePath)) {
            return List.of();
        }
        int max = Math.max(1, limit);
        List<String> lines = nonBlankLines(filePath);
        List<Entry> entries = new ArrayList<>();
        for (int i = lines.size() - 1; i >= 0 && entries.size() < max; i--) {
            try {
                Entry entry = MAPPER.readValue(lines.get(i), Entry.class);
                if (entry.getJobId() != null && "finished".equals(entry.getAction())) {
                    entries.add(entry);
                }
            } catch (IOException e) {
                log.debug("cron: skipping malformed run log line in {}", filePath);
            }
        }
        return entries;
    }

    private static List<String> nonBlankLines(Path filePath) throws IOException {
        String content = JsonFile.readString(filePath);
        if (content == null) {
            return Collections.emptyList();
        }
        List<String> lines = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (!line.isBlank()) {
                lines.add(line.trim());
            }
        }
        return lines;
    }
}
