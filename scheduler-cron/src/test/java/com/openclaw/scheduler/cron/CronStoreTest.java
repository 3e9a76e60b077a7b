package com.openclaw.scheduler.cron;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CronStoreTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tempDir;

    private static CronTypes.CronStoreFile storeWith(CronTypes.CronJob job) {
        CronTypes.CronStoreFile store = new CronTypes.CronStoreFile();
        store.getJobs().add(job);
        return store;
    }

    @Test
    void resolveCronStorePath_expandsTildeAgainstOpenclawHome() {
        Path resolved = CronStore.resolveCronStorePath("~/cron/jobs.json", Map.of("OPENCLAW_HOME", "/srv/openclaw-home"));
        assertEquals(Path.of("/srv/openclaw-home", "cron", "jobs.json"), resolved);
    }

    @Test
    void resolveCronStorePath_defaultsUnderStateDir() {
        Path resolved = CronStore.resolveCronStorePath(null, Map.of("OPENCLAW_STATE_DIR", "/var/lib/openclaw"));
        assertEquals(Path.of("/var/lib/openclaw", "cron", "jobs.json"), resolved);
    }

    @Test
    void load_missingFile_isEmptyStore() throws IOException {
        CronTypes.CronStoreFile store = CronStore.loadCronStore(tempDir.resolve("jobs.json"));
        assertEquals(1, store.getVersion());
        assertTrue(store.getJobs().isEmpty());
    }

    @Test
    void load_invalidJson_throws() throws IOException {
        Path path = tempDir.resolve("jobs.json");
        Files.writeString(path, "{ not json");
        IOException e = assertThrows(IOException.class, () -> CronStore.loadCronStore(path));
        assertTrue(e.getMessage().startsWith("Failed to parse cron store"));
    }

    @Test
    void save_unchangedContent_createsNoBackup() throws IOException {
        Path path = tempDir.resolve("jobs.json");
        CronTypes.CronStoreFile store = storeWith(
                CronTestFixtures.mainJob("job-1", CronTypes.CronSchedule.every(60_000), "tick-1"));

        assertTrue(CronStore.saveCronStore(path, store));
        assertFalse(CronStore.saveCronStore(path, store));
        assertFalse(Files.exists(tempDir.resolve("jobs.json.bak")));
    }

    @Test
    void save_changedContent_backsUpPrevious() throws IOException {
        Path path = tempDir.resolve("jobs.json");
        CronStore.saveCronStore(path, storeWith(
                CronTestFixtures.mainJob("job-1", CronTypes.CronSchedule.every(60_000), "tick-1")));
        CronStore.saveCronStore(path, storeWith(
                CronTestFixtures.mainJob("job-2", CronTypes.CronSchedule.every(60_000), "tick-2")));

        JsonNode current = JSON.readTree(Files.readString(path));
        JsonNode backup = JSON.readTree(Files.readString(tempDir.resolve("jobs.json.bak")));
        assertEquals("job-2", current.get("jobs").get(0).get("id").asText());
        assertEquals("job-1", backup.get("jobs").get(0).get("id").asText());
        assertEquals(1, current.get("version").asInt());
    }

    @Test
    void roundTrip_preservesWireKeysAndSuppressedAlert() throws IOException {
        Path path = tempDir.resolve("jobs.json");
        CronTypes.CronJob job = CronTestFixtures.isolatedJob("job-1",
                CronTypes.CronSchedule.cron("0 9 * * *", "UTC"), "digest");
        job.setWakeMode(CronTypes.WakeMode.NOW);
        job.setFailureAlert(CronTypes.CronFailureAlert.suppressed());
        job.getState().setLastDeliveryStatus(CronTypes.DeliveryStatus.NOT_REQUESTED);
        CronStore.saveCronStore(path, storeWith(job));

        JsonNode raw = JSON.readTree(Files.readString(path)).get("jobs").get(0);
        assertEquals("isolated", raw.get("sessionTarget").asText());
        assertEquals("now", raw.get("wakeMode").asText());
        assertEquals("agentTurn", raw.get("payload").get("kind").asText());
        assertTrue(raw.get("failureAlert").isBoolean());
        assertEquals("not-requested", raw.get("state").get("lastDeliveryStatus").asText());

        CronTypes.CronJob loaded = CronStore.loadCronStore(path).getJobs().get(0);
        assertEquals(job, loaded);
    }

    @Test
    void load_migratesLegacyPayloadDelivery_andSkipsMalformedEntries() throws IOException {
        Path path = tempDir.resolve("jobs.json");
        Files.writeString(path, """
                {"version":1,"jobs":[
                  {"id":"legacy","name":"legacy","enabled":true,
                   "schedule":{"kind":"every","everyMs":60000},
                   "sessionTarget":"isolated","wakeMode":"next-heartbeat",
                   "payload":{"kind":"agentTurn","message":"hi","deliver":true,"channel":"telegram","to":"42"},
                   "state":{}},
                  {"id":"broken","schedule":{"kind":"fortnightly"}},
                  "not-a-job"
                ]}
                """);

        CronTypes.CronStoreFile store = CronStore.loadCronStore(path);
        assertEquals(1, store.getJobs().size());
        CronTypes.CronJob job = store.getJobs().get(0);
        assertEquals(CronTypes.DeliveryMode.ANNOUNCE, job.getDelivery().getMode());
        assertEquals("telegram", job.getDelivery().getChannel());
        assertEquals("42", job.getDelivery().getTo());
    }
}
