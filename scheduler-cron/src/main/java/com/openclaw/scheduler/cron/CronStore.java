package com.openclaw.scheduler.cron;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.openclaw.scheduler.common.config.ConfigPaths;
import com.openclaw.scheduler.common.infra.JsonFile;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cron store persistence: the {@code {"version":1,"jobs":[...]}} file format
 * plus the lock-scoped load/persist used by the service.
 */
@Slf4j
public final class CronStore {

    private CronStore() {
    }

    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    /**
     * Default store location: {@code <stateDir>/cron/jobs.json}. A configured
     * path may start with "~", which expands to OPENCLAW_HOME when set.
     */
    public static Path resolveCronStorePath(String configured, Map<String, String> env) {
        if (configured != null && !configured.isBlank()) {
            return ConfigPaths.resolveUserPath(configured, env);
        }
        return ConfigPaths.resolveStateDir(env).resolve("cron").resolve("jobs.json");
    }

    // =========================================================================
    // File format
    // =========================================================================

    /**
     * Load the store file. A missing or blank file is an empty store.
     *
     * @throws IOException when the file exists but is not a valid store
     */
    @SuppressWarnings("unchecked")
    public static CronTypes.CronStoreFile loadCronStore(Path storePath) throws IOException {
        String content = JsonFile.readString(storePath);
        if (content == null || content.isBlank()) {
            return new CronTypes.CronStoreFile();
        }
        Map<String, Object> raw;
        try {
            raw = MAPPER.readValue(content, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to parse cron store at " + storePath + ": " + e.getOriginalMessage(), e);
        }

        List<CronTypes.CronJob> jobs = new ArrayList<>();
        if (raw != null && raw.get("jobs") instanceof List<?> entries) {
            for (Object entry : entries) {
                if (!(entry instanceof Map<?, ?> jobMap)) {
                    continue;
                }
                Map<String, Object> job = new LinkedHashMap<>((Map<String, Object>) jobMap);
                CronNormalize.migrateLegacyDelivery(job);
                try {
                    CronTypes.CronJob parsed = MAPPER.convertValue(job, CronTypes.CronJob.class);
                    if (parsed.getState() == null) {
                        parsed.setState(new CronTypes.CronJobState());
                    }
                    jobs.add(parsed);
                } catch (IllegalArgumentException e) {
                    log.warn("cron: skipping malformed job entry {} in {}: {}", job.get("id"), storePath,
                            e.getMessage());
                }
            }
        }
        int version = raw != null && raw.get("version") instanceof Number n ? n.intValue() : 1;
        return CronTypes.CronStoreFile.builder().version(version).jobs(jobs).build();
    }

    /**
     * Save the store atomically, backing up differing previous content to
     * {@code <store>.bak}.
     *
     * @return true if the file changed
     */
    public static boolean saveCronStore(Path storePath, CronTypes.CronStoreFile store) throws IOException {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("version", store.getVersion());
        output.put("jobs", store.getJobs());
        String json = MAPPER.writeValueAsString(output) + "\n";
        return JsonFile.writeAtomic(storePath, json, true);
    }

    // =========================================================================
    // Lock-scoped access
    // =========================================================================

    /**
     * Load the store into memory if needed. Must be called under the lock.
     *
     * @param forceReload   re-read the file even when already cached
     * @param skipRecompute keep stored nextRunAtMs values untouched
     */
    public static void ensureLoaded(CronServiceState state, boolean forceReload, boolean skipRecompute)
            throws IOException {
        if (state.store() != null && !forceReload) {
            return;
        }
        CronTypes.CronStoreFile loaded = loadCronStore(state.deps().getStorePath());
        state.setStore(loaded);
        if (!skipRecompute) {
            CronJobs.recomputeNextRuns(state);
        }
    }

    public static void ensureLoaded(CronServiceState state) throws IOException {
        ensureLoaded(state, false, false);
    }

    /**
     * Persist the cached store. Must be called under the lock.
     */
    public static void persist(CronServiceState state) throws IOException {
        CronTypes.CronStoreFile store = state.store();
        if (store == null) {
            return;
        }
        boolean written = saveCronStore(state.deps().getStorePath(), store);
        if (written) {
            log.debug("cron: store saved to {} ({} jobs)", state.deps().getStorePath(), store.getJobs().size());
        }
    }
}
