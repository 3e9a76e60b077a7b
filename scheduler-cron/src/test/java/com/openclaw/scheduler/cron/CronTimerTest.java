package com.openclaw.scheduler.cron;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openclaw.scheduler.common.infra.HeartbeatRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CronTimerTest {

    private static final long T0 = 1_800_000_000_000L;

    @TempDir
    Path tempDir;

    private Path storePath;
    private CronTestFixtures.FakeClock clock;
    private CronTestFixtures.ManualWakeScheduler wake;
    private CronTestFixtures.RecordingHost host;
    private final List<CronServiceState> states = new ArrayList<>();

    @BeforeEach
    void setUp() {
        storePath = tempDir.resolve("cron").resolve("jobs.json");
        clock = new CronTestFixtures.FakeClock(T0);
        wake = new CronTestFixtures.ManualWakeScheduler();
        host = new CronTestFixtures.RecordingHost();
    }

    @AfterEach
    void tearDown() {
        states.forEach(CronServiceState::shutdown);
    }

    private CronServiceState newState(CronState.CronServiceDeps deps) {
        CronServiceState state = new CronServiceState(deps);
        states.add(state);
        return state;
    }

    private CronServiceState newState() {
        return newState(CronTestFixtures.deps(storePath, clock, wake, host).build());
    }

    private static CronTypes.CronJob dueAt(CronTypes.CronJob job, long nextRunAtMs) {
        job.getState().setNextRunAtMs(nextRunAtMs);
        return job;
    }

    private CronTypes.CronJob stored(String id) throws IOException {
        for (CronTypes.CronJob job : CronStore.loadCronStore(storePath).getJobs()) {
            if (job.getId().equals(id)) {
                return job;
            }
        }
        return null;
    }

    // =========================================================================
    // Arming
    // =========================================================================

    @Test
    void armTimer_clampsDelayToOneMinute() throws IOException {
        CronTestFixtures.writeStore(storePath,
                dueAt(CronTestFixtures.mainJob("far", CronTypes.CronSchedule.every(3_600_000), "x"), T0 + 600_000));
        CronServiceState state = newState();
        state.locked(() -> {
            CronStore.ensureLoaded(state, false, true);
            return null;
        });

        CronTimer.armTimer(state);
        assertEquals(CronTimer.MAX_TIMER_DELAY_MS, wake.pending().delayMs);
    }

    @Test
    void armTimer_pastDueFiresImmediately_nearFiresOnTime() throws IOException {
        CronTestFixtures.writeStore(storePath,
                dueAt(CronTestFixtures.mainJob("soon", CronTypes.CronSchedule.every(60_000), "x"), T0 + 5_000));
        CronServiceState state = newState();
        state.locked(() -> {
            CronStore.ensureLoaded(state, false, true);
            return null;
        });

        CronTimer.armTimer(state);
        assertEquals(5_000, wake.pending().delayMs);

        clock.advance(10_000);
        CronTimer.armTimer(state);
        assertEquals(0, wake.pending().delayMs);
        assertEquals(1, wake.armed.stream().filter(h -> !h.cancelled).count());
    }

    @Test
    void armTimer_disabledSchedulerOrNoJobs_armsNothing() throws IOException {
        CronServiceState state = newState(CronTestFixtures.deps(storePath, clock, wake, host)
                .cronEnabled(false).build());
        CronTimer.armTimer(state);
        assertNull(wake.pending());

        CronServiceState empty = newState();
        empty.locked(() -> {
            CronStore.ensureLoaded(empty, false, true);
            return null;
        });
        CronTimer.armTimer(empty);
        assertNull(wake.pending());
    }

    // =========================================================================
    // Tick
    // =========================================================================

    @Test
    void onTimer_runsDueMainJobAndSchedulesNext() throws IOException {
        CronTestFixtures.writeStore(storePath,
                dueAt(CronTestFixtures.mainJob("tick", CronTypes.CronSchedule.every(60_000), "check inbox"), T0 - 1));
        CronServiceState state = newState();

        CronTimer.onTimer(state);

        assertEquals(List.of("check inbox"), host.enqueued);
        assertEquals("cron:tick", host.targets.get(0).contextKey());
        assertEquals(1, host.heartbeatRequests.size());
        assertTrue(host.heartbeatRuns.isEmpty());
        assertEquals(1, host.events(CronState.CronEventAction.STARTED).size());
        CronState.CronEvent finished = host.events(CronState.CronEventAction.FINISHED).get(0);
        assertEquals(CronTypes.RunStatus.OK, finished.getStatus());
        assertEquals(T0 + 60_000, finished.getNextRunAtMs());

        CronTypes.CronJob job = stored("tick");
        assertNull(job.getState().getRunningAtMs());
        assertEquals(CronTypes.RunStatus.OK, job.getState().getLastStatus());
        assertEquals(T0 + 60_000, job.getState().getNextRunAtMs());
        assertFalse(state.running().get());
        assertEquals(CronTimer.MAX_TIMER_DELAY_MS, wake.pending().delayMs);
    }

    @Test
    void onTimer_finalRearmHoldsStoreLock() throws IOException {
        CronTestFixtures.writeStore(storePath,
                dueAt(CronTestFixtures.mainJob("tick", CronTypes.CronSchedule.every(60_000), "x"), T0 - 1));
        AtomicReference<CronServiceState> current = new AtomicReference<>();
        List<Boolean> lockHeldOnSchedule = new CopyOnWriteArrayList<>();
        WakeScheduler recording = (task, delayMs) -> {
            CronServiceState s = current.get();
            lockHeldOnSchedule.add(s != null && s.isLockedByCurrentThread());
            return wake.schedule(task, delayMs);
        };
        CronServiceState state = newState(CronTestFixtures.deps(storePath, clock, wake, host)
                .wakeScheduler(recording).build());
        current.set(state);

        CronTimer.onTimer(state);

        assertEquals(List.of("x"), host.enqueued);
        // recheck arm at tick start, then the final arm once the job finished
        assertEquals(List.of(false, true), lockHeldOnSchedule);
        assertEquals(60_000, wake.pending().delayMs);
    }

    @Test
    void onTimer_nothingDue_onlyRearms() throws IOException {
        CronTestFixtures.writeStore(storePath,
                dueAt(CronTestFixtures.mainJob("later", CronTypes.CronSchedule.every(60_000), "x"), T0 + 30_000));
        CronServiceState state = newState();

        CronTimer.onTimer(state);

        assertTrue(host.events.isEmpty());
        assertEquals(30_000, wake.pending().delayMs);
    }

    @Test
    void onTimer_whileTickInProgress_keepsWatchdogArmed() throws IOException {
        AtomicInteger recheckDelays = new AtomicInteger();
        CronTestFixtures.writeStore(storePath,
                dueAt(CronTestFixtures.isolatedJob("slow", CronTypes.CronSchedule.every(600_000), "work"), T0));
        CronServiceState state = newState(CronTestFixtures.deps(storePath, clock, wake, host)
                .runIsolatedAgentJob(request -> {
                    // The watchdog wake fires while this body is still running.
                    CronTestFixtures.ManualWakeScheduler.Armed pending = wake.pending();
                    recheckDelays.set((int) pending.delayMs);
                    wake.firePending();
                    assertNotNull(wake.pending(), "overlapping tick must leave a wake armed");
                    assertEquals(CronTimer.MAX_TIMER_DELAY_MS, wake.pending().delayMs);
                    return CronState.IsolatedRunResult.builder().status(CronTypes.RunStatus.OK).build();
                })
                .build());

        CronTimer.onTimer(state);

        assertEquals(CronTimer.MAX_TIMER_DELAY_MS, recheckDelays.get());
        assertEquals(CronTypes.RunStatus.OK, stored("slow").getState().getLastStatus());
        assertEquals(1, host.events(CronState.CronEventAction.STARTED).size());
        assertNotNull(wake.pending());
    }

    @Test
    void onTimer_jobBecomingDueDuringTick_isNotSkipped() throws IOException {
        CronTestFixtures.writeStore(storePath,
                dueAt(CronTestFixtures.isolatedJob("long", CronTypes.CronSchedule.every(3_600_000), "work"), T0),
                dueAt(CronTestFixtures.mainJob("short", CronTypes.CronSchedule.every(60_000), "ping"), T0 + 30_000));
        CronServiceState state = newState(CronTestFixtures.deps(storePath, clock, wake, host)
                .runIsolatedAgentJob(request -> {
                    clock.advance(120_000);
                    return CronState.IsolatedRunResult.builder().status(CronTypes.RunStatus.OK).build();
                })
                .build());

        CronTimer.onTimer(state);

        assertEquals(T0 + 30_000, stored("short").getState().getNextRunAtMs());
        assertEquals(0, wake.pending().delayMs);
        assertTrue(host.enqueued.isEmpty());

        wake.firePending();
        assertEquals(List.of("ping"), host.enqueued);
        assertEquals(clock.now() + 60_000, stored("short").getState().getNextRunAtMs());
    }

    @Test
    void onTimer_runsUpToMaxConcurrentRunsInParallel() throws Exception {
        CronTestFixtures.writeStore(storePath,
                dueAt(CronTestFixtures.isolatedJob("a", CronTypes.CronSchedule.every(60_000), "a"), T0),
                dueAt(CronTestFixtures.isolatedJob("b", CronTypes.CronSchedule.every(60_000), "b"), T0));
        CountDownLatch bothStarted = new CountDownLatch(2);
        CronState.CronServiceDeps deps = CronTestFixtures.deps(storePath, clock, wake, host)
                .runIsolatedAgentJob(request -> {
                    bothStarted.countDown();
                    boolean overlapped = bothStarted.await(5, TimeUnit.SECONDS);
                    return CronState.IsolatedRunResult.builder()
                            .status(overlapped ? CronTypes.RunStatus.OK : CronTypes.RunStatus.ERROR)
                            .error(overlapped ? null : "ran sequentially")
                            .build();
                })
                .build();
        deps.getCronConfig().setMaxConcurrentRuns(2);
        CronServiceState state = newState(deps);

        CronTimer.onTimer(state);

        assertEquals(CronTypes.RunStatus.OK, stored("a").getState().getLastStatus());
        assertEquals(CronTypes.RunStatus.OK, stored("b").getState().getLastStatus());
    }

    @Test
    void onTimer_timedOutBodyResolvesToTimeoutError() throws IOException {
        CronTypes.CronJob job = CronTestFixtures.isolatedJob("hang", CronTypes.CronSchedule.every(600_000), "wait");
        job.getPayload().setTimeoutSeconds(1);
        CronTestFixtures.writeStore(storePath, dueAt(job, T0));
        CronServiceState state = newState(CronTestFixtures.deps(storePath, clock, wake, host)
                .runIsolatedAgentJob(request -> {
                    request.cancellation().sleep(10_000);
                    return CronState.IsolatedRunResult.builder().status(CronTypes.RunStatus.OK).build();
                })
                .build());

        CronTimer.onTimer(state);

        CronTypes.CronJob after = stored("hang");
        assertEquals(CronTypes.RunStatus.ERROR, after.getState().getLastStatus());
        assertEquals(CronExecutor.TIMEOUT_ERROR, after.getState().getLastError());
        assertNull(after.getState().getRunningAtMs());
    }

    @Test
    void onTimer_throwingEventListenerDoesNotBreakTick() throws IOException {
        CronTestFixtures.writeStore(storePath,
                dueAt(CronTestFixtures.mainJob("tick", CronTypes.CronSchedule.every(60_000), "x"), T0));
        CronServiceState state = newState(CronTestFixtures.deps(storePath, clock, wake, host)
                .onEvent(event -> {
                    throw new IllegalStateException("listener broke");
                })
                .build());

        assertDoesNotThrow(() -> CronTimer.onTimer(state));
        assertEquals(CronTypes.RunStatus.OK, stored("tick").getState().getLastStatus());
    }

    @Test
    void onTimer_oneShotSuccessIsRemoved() throws IOException {
        CronTypes.CronJob job = CronTestFixtures.mainJob("once", CronTypes.CronSchedule.at(CronParse.formatIso(T0)), "x");
        job.setDeleteAfterRun(true);
        CronTestFixtures.writeStore(storePath, dueAt(job, T0));
        CronServiceState state = newState();

        CronTimer.onTimer(state);

        assertNull(stored("once"));
        assertEquals(1, host.events(CronState.CronEventAction.REMOVED).size());
        assertNull(wake.pending());
    }

    // =========================================================================
    // Main target heartbeat handling
    // =========================================================================

    @Test
    void mainJob_wakeNow_waitsForBusyHeartbeatThenFallsBack() throws IOException {
        CronTypes.CronJob job = CronTestFixtures.mainJob("now", CronTypes.CronSchedule.every(60_000), "urgent");
        job.setWakeMode(CronTypes.WakeMode.NOW);
        CronTestFixtures.writeStore(storePath, dueAt(job, T0));
        AtomicInteger attempts = new AtomicInteger();
        CronServiceState state = newState(CronTestFixtures.deps(storePath, clock, wake, host)
                .wakeNowHeartbeatBusyMaxWaitMs(50)
                .wakeNowHeartbeatBusyRetryDelayMs(1)
                .runHeartbeatOnce(request -> {
                    attempts.incrementAndGet();
                    clock.advance(20);
                    return HeartbeatRunner.RunResult.skipped(HeartbeatRunner.REASON_IN_FLIGHT);
                })
                .build());

        CronTimer.onTimer(state);

        assertTrue(attempts.get() >= 3);
        assertEquals(1, host.heartbeatRequests.size());
        assertEquals("cron:now", host.heartbeatRequests.get(0).reason());
        assertEquals(CronTypes.RunStatus.OK, stored("now").getState().getLastStatus());
    }

    @Test
    void mainJob_heartbeatSkipIsRecorded() throws IOException {
        CronTypes.CronJob job = CronTestFixtures.mainJob("now", CronTypes.CronSchedule.every(60_000), "urgent");
        job.setWakeMode(CronTypes.WakeMode.NOW);
        CronTestFixtures.writeStore(storePath, dueAt(job, T0));
        CronServiceState state = newState(CronTestFixtures.deps(storePath, clock, wake, host)
                .runHeartbeatOnce(request -> HeartbeatRunner.RunResult.skipped("quiet-hours"))
                .build());

        CronTimer.onTimer(state);

        CronTypes.CronJob after = stored("now");
        assertEquals(CronTypes.RunStatus.SKIPPED, after.getState().getLastStatus());
        assertEquals("quiet-hours", after.getState().getLastError());
    }

    @Test
    void mainJob_withoutText_isSkipped() throws IOException {
        CronTypes.CronJob job = CronTestFixtures.mainJob("empty", CronTypes.CronSchedule.every(60_000), "  ");
        CronTestFixtures.writeStore(storePath, dueAt(job, T0));

        CronTimer.onTimer(newState());

        CronTypes.CronJob after = stored("empty");
        assertEquals(CronTypes.RunStatus.SKIPPED, after.getState().getLastStatus());
        assertEquals("main job requires non-empty systemEvent text", after.getState().getLastError());
        assertTrue(host.enqueued.isEmpty());
    }

    // =========================================================================
    // Isolated summaries
    // =========================================================================

    @Test
    void isolatedJob_undeliveredSummaryIsPostedToMainTimeline() throws IOException {
        CronTypes.CronJob job = CronTestFixtures.isolatedJob("digest", CronTypes.CronSchedule.every(60_000), "sum");
        job.setDelivery(CronTypes.CronDelivery.builder().mode(CronTypes.DeliveryMode.ANNOUNCE).build());
        CronTestFixtures.writeStore(storePath, dueAt(job, T0));

        CronTimer.onTimer(newState());

        assertEquals(List.of("Cron: done"), host.enqueued);
        assertEquals(CronTypes.DeliveryStatus.UNKNOWN, stored("digest").getState().getLastDeliveryStatus());
    }

    @Test
    void isolatedJob_withoutRequestedDelivery_postsNothing() throws IOException {
        CronTestFixtures.writeStore(storePath,
                dueAt(CronTestFixtures.isolatedJob("quiet", CronTypes.CronSchedule.every(60_000), "sum"), T0));

        CronTimer.onTimer(newState());

        assertTrue(host.enqueued.isEmpty());
        assertEquals(CronTypes.DeliveryStatus.NOT_REQUESTED, stored("quiet").getState().getLastDeliveryStatus());
    }

    @Test
    void isolatedJob_runnerExceptionBecomesErrorOutcome() throws IOException {
        CronTestFixtures.writeStore(storePath,
                dueAt(CronTestFixtures.isolatedJob("bad", CronTypes.CronSchedule.every(60_000), "sum"), T0));
        CronServiceState state = newState(CronTestFixtures.deps(storePath, clock, wake, host)
                .runIsolatedAgentJob(request -> {
                    throw new IllegalStateException("model unavailable");
                })
                .build());

        CronTimer.onTimer(state);

        CronTypes.CronJob after = stored("bad");
        assertEquals(CronTypes.RunStatus.ERROR, after.getState().getLastStatus());
        assertEquals("model unavailable", after.getState().getLastError());
        assertEquals(1, after.getState().getConsecutiveErrors());
        // Natural next (one interval) is later than the first backoff rung.
        assertEquals(T0 + 60_000, after.getState().getNextRunAtMs());
    }

    // =========================================================================
    // Missed jobs
    // =========================================================================

    @Test
    void runMissedJobs_runsOverdueJobsOnce() throws IOException {
        CronTypes.CronJob once = CronTestFixtures.mainJob("once",
                CronTypes.CronSchedule.at(CronParse.formatIso(T0 - 3_600_000)), "overdue reminder");
        once.setDeleteAfterRun(true);
        CronTestFixtures.writeStore(storePath,
                dueAt(once, T0 - 3_600_000),
                dueAt(CronTestFixtures.mainJob("future", CronTypes.CronSchedule.every(60_000), "later"), T0 + 60_000));
        CronServiceState state = newState();

        CronTimer.runMissedJobs(state);

        assertEquals(List.of("overdue reminder"), host.enqueued);
        assertNull(stored("once"));
        assertNotNull(stored("future"));
    }

    @Test
    void runMissedJobs_skipsOneShotThatAlreadyRan() throws IOException {
        CronTypes.CronJob done = CronTestFixtures.mainJob("done",
                CronTypes.CronSchedule.at(CronParse.formatIso(T0 - 3_600_000)), "x");
        done.getState().setNextRunAtMs(T0 - 3_600_000);
        done.getState().setLastStatus(CronTypes.RunStatus.OK);
        done.getState().setLastRunAtMs(T0 - 3_600_000);
        CronTestFixtures.writeStore(storePath, done);

        CronTimer.runMissedJobs(newState());

        assertTrue(host.enqueued.isEmpty());
    }

    // =========================================================================
    // Session reaper + wake
    // =========================================================================

    @Test
    void onTimer_sweepsExpiredCronRunSessions() throws IOException {
        Path sessions = tempDir.resolve("sessions.json");
        Files.writeString(sessions, new ObjectMapper().writeValueAsString(Map.of(
                "agent:main:main", Map.of("updatedAt", T0 - 90_000_000L),
                "agent:main:cron:job1:run:abc", Map.of("updatedAt", T0 - 90_000_000L),
                "agent:main:cron:job1:run:def", Map.of("updatedAt", T0 - 1_000L))));
        CronTestFixtures.writeStore(storePath);
        CronServiceState state = newState(CronTestFixtures.deps(storePath, clock, wake, host)
                .sessionStorePath(sessions)
                .build());

        CronTimer.onTimer(state);

        @SuppressWarnings("unchecked")
        Map<String, Object> remaining = new ObjectMapper().readValue(Files.readString(sessions), Map.class);
        assertEquals(2, remaining.size());
        assertFalse(remaining.containsKey("agent:main:cron:job1:run:abc"));
    }

    @Test
    void wake_enqueuesTextAndRequestsHeartbeatForNow() {
        CronServiceState state = newState();

        assertFalse(CronTimer.wake(state, CronTypes.WakeMode.NOW, "   "));
        assertTrue(CronTimer.wake(state, CronTypes.WakeMode.NEXT_HEARTBEAT, " check mail "));
        assertTrue(host.heartbeatRequests.isEmpty());
        assertTrue(CronTimer.wake(state, CronTypes.WakeMode.NOW, "now please"));

        assertEquals(List.of("check mail", "now please"), host.enqueued);
        assertEquals(1, host.heartbeatRequests.size());
        assertEquals("wake", host.heartbeatRequests.get(0).reason());
    }
}
