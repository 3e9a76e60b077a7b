package com.openclaw.scheduler.cron;

import com.openclaw.scheduler.common.infra.ErrorUtils;
import com.openclaw.scheduler.common.infra.HeartbeatRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The wake timer and the tick it drives: due-job discovery, bounded
 * concurrent execution, result application and the piggybacked session
 * sweep. Also hosts startup catch-up of missed jobs.
 */
@Slf4j
public final class CronTimer {

    private CronTimer() {
    }

    /** Longest the timer sleeps; also the watchdog recheck interval. */
    public static final long MAX_TIMER_DELAY_MS = 60_000;

    record TimedOutcome(String jobId, CronRunOutcome outcome, long startedAt, long endedAt) {
    }

    // =========================================================================
    // Arming
    // =========================================================================

    public static void armTimer(CronServiceState state) {
        state.clearTimer();
        if (!state.deps().isCronEnabled()) {
            log.debug("cron: armTimer skipped - scheduler disabled");
            return;
        }
        Long nextAt = CronJobs.nextWakeAtMs(state);
        if (nextAt == null) {
            log.debug("cron: armTimer skipped - no jobs with nextRunAtMs");
            return;
        }
        long delay = Math.max(nextAt - state.nowMs(), 0);
        long clamped = Math.min(delay, MAX_TIMER_DELAY_MS);
        state.replaceTimer(() -> fire(state), clamped);
        log.debug("cron: timer armed (nextAt={}, delayMs={}, clamped={})", nextAt, clamped,
                delay > MAX_TIMER_DELAY_MS);
    }

    static void armRunningRecheckTimer(CronServiceState state) {
        state.replaceTimer(() -> fire(state), MAX_TIMER_DELAY_MS);
    }

    public static void stopTimer(CronServiceState state) {
        state.clearTimer();
    }

    private static void fire(CronServiceState state) {
        try {
            onTimer(state);
        } catch (Exception e) {
            log.error("cron: timer tick failed: {}", ErrorUtils.formatErrorMessage(e), e);
        }
    }

    // =========================================================================
    // Tick
    // =========================================================================

    public static void onTimer(CronServiceState state) throws IOException {
        if (!state.running().compareAndSet(false, true)) {
            // A tick is still executing; keep one wake pending so a long job
            // body cannot leave the scheduler without a timer.
            armRunningRecheckTimer(state);
            return;
        }
        armRunningRecheckTimer(state);
        try {
            List<CronTypes.CronJob> dueJobs = state.locked(() -> {
                CronStore.ensureLoaded(state, true, true);
                long now = state.nowMs();
                List<CronTypes.CronJob> due = CronJobs.collectRunnableJobs(state, now);
                if (due.isEmpty()) {
                    if (CronJobs.recomputeNextRunsForMaintenance(state)) {
                        CronStore.persist(state);
                    }
                    return List.of();
                }
                for (CronTypes.CronJob job : due) {
                    job.getState().setRunningAtMs(now);
                    job.getState().setLastError(null);
                }
                CronStore.persist(state);
                return due;
            });

            List<TimedOutcome> completed = runWithConcurrency(state, dueJobs);

            if (!completed.isEmpty()) {
                state.locked(() -> {
                    CronStore.ensureLoaded(state, true, true);
                    for (TimedOutcome outcome : completed) {
                        applyOutcomeToStoredJob(state, outcome);
                    }
                    CronJobs.recomputeNextRunsForMaintenance(state);
                    CronStore.persist(state);
                    return null;
                });
            }

            sweepSessions(state);
        } finally {
            state.running().set(false);
            state.withLock(() -> armTimer(state));
        }
    }

    /**
     * Run due jobs through at most {@code maxConcurrentRuns} workers that pull
     * from a shared cursor.
     */
    static List<TimedOutcome> runWithConcurrency(CronServiceState state, List<CronTypes.CronJob> dueJobs) {
        if (dueJobs.isEmpty()) {
            return List.of();
        }
        int concurrency = Math.min(resolveRunConcurrency(state), dueJobs.size());
        TimedOutcome[] results = new TimedOutcome[dueJobs.size()];
        AtomicInteger cursor = new AtomicInteger();
        Runnable worker = () -> {
            for (;;) {
                int index = cursor.getAndIncrement();
                if (index >= dueJobs.size()) {
                    return;
                }
                results[index] = runDueJob(state, dueJobs.get(index));
            }
        };

        List<Future<?>> workers = new ArrayList<>();
        for (int i = 1; i < concurrency; i++) {
            workers.add(state.executor().submit(worker));
        }
        worker.run();
        for (Future<?> f : workers) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ExecutionException e) {
                log.error("cron: worker failed: {}", ErrorUtils.formatErrorMessage(e));
            }
        }

        List<TimedOutcome> completed = new ArrayList<>();
        for (TimedOutcome result : results) {
            if (result != null) {
                completed.add(result);
            }
        }
        return completed;
    }

    static int resolveRunConcurrency(CronServiceState state) {
        Integer raw = state.deps().getCronConfig() != null ? state.deps().getCronConfig().getMaxConcurrentRuns() : null;
        return raw == null ? 1 : Math.max(1, raw);
    }

    private static TimedOutcome runDueJob(CronServiceState state, CronTypes.CronJob job) {
        long startedAt = state.nowMs();
        job.getState().setRunningAtMs(startedAt);
        emit(state, CronState.CronEvent.builder()
                .jobId(job.getId())
                .action(CronState.CronEventAction.STARTED)
                .runAtMs(startedAt)
                .build());
        CronRunOutcome outcome = CronExecutor.executeSafely(state, job);
        return new TimedOutcome(job.getId(), outcome, startedAt, state.nowMs());
    }

    // =========================================================================
    // Result application
    // =========================================================================

    /**
     * Apply one outcome to the freshly loaded copy of its job. Must be called
     * under the lock.
     */
    static void applyOutcomeToStoredJob(CronServiceState state, TimedOutcome result) {
        CronTypes.CronStoreFile store = state.store();
        if (store == null) {
            return;
        }
        CronTypes.CronJob job = CronJobs.findJob(state, result.jobId());
        if (job == null) {
            log.debug("cron: job {} vanished before its result was applied", result.jobId());
            return;
        }
        CronRunOutcome outcome = result.outcome();
        boolean shouldDelete = CronResultPolicy.applyJobResult(state, job, new CronResultPolicy.JobResult(
                outcome.getStatus(), outcome.getError(), outcome.getDelivered(), result.startedAt(),
                result.endedAt()));

        emitJobFinished(state, job, outcome, result.startedAt());

        if (shouldDelete) {
            store.getJobs().removeIf(entry -> job.getId().equals(entry.getId()));
            emit(state, CronState.CronEvent.builder()
                    .jobId(job.getId())
                    .action(CronState.CronEventAction.REMOVED)
                    .build());
        }
    }

    static void emitJobFinished(CronServiceState state, CronTypes.CronJob job, CronRunOutcome outcome,
            long runAtMs) {
        CronTypes.CronJobState st = job.getState();
        emit(state, CronState.CronEvent.builder()
                .jobId(job.getId())
                .action(CronState.CronEventAction.FINISHED)
                .status(outcome.getStatus())
                .error(outcome.getError())
                .summary(outcome.getSummary())
                .delivered(outcome.getDelivered())
                .deliveryStatus(st.getLastDeliveryStatus())
                .deliveryError(st.getLastDeliveryError())
                .sessionId(outcome.getSessionId())
                .sessionKey(outcome.getSessionKey())
                .runAtMs(runAtMs)
                .durationMs(st.getLastDurationMs())
                .nextRunAtMs(st.getNextRunAtMs())
                .model(outcome.getModel())
                .provider(outcome.getProvider())
                .usage(outcome.getUsage())
                .build());
    }

    // =========================================================================
    // Missed jobs
    // =========================================================================

    /**
     * Startup catch-up: run jobs whose slot elapsed while the process was
     * down, one at a time. Jobs that become due meanwhile wait for the next
     * tick.
     */
    public static void runMissedJobs(CronServiceState state) throws IOException {
        List<CronTypes.CronJob> candidates = state.locked(() -> {
            CronStore.ensureLoaded(state, false, true);
            long now = state.nowMs();
            List<CronTypes.CronJob> missed = CronJobs.collectRunnableJobs(state, now);
            if (missed.isEmpty()) {
                return List.of();
            }
            log.info("cron: running {} missed job(s) after restart: {}", missed.size(),
                    missed.stream().map(CronTypes.CronJob::getId).toList());
            for (CronTypes.CronJob job : missed) {
                job.getState().setRunningAtMs(now);
                job.getState().setLastError(null);
            }
            CronStore.persist(state);
            return missed;
        });
        if (candidates.isEmpty()) {
            return;
        }

        List<TimedOutcome> outcomes = new ArrayList<>();
        for (CronTypes.CronJob job : candidates) {
            outcomes.add(runDueJob(state, job));
        }

        state.locked(() -> {
            CronStore.ensureLoaded(state, true, true);
            for (TimedOutcome outcome : outcomes) {
                applyOutcomeToStoredJob(state, outcome);
            }
            CronJobs.recomputeNextRunsForMaintenance(state);
            CronStore.persist(state);
            return null;
        });
    }

    // =========================================================================
    // Session reaper
    // =========================================================================

    static void sweepSessions(CronServiceState state) {
        CronState.CronServiceDeps deps = state.deps();
        Set<Path> storePaths = new LinkedHashSet<>();
        if (deps.getResolveSessionStorePath() != null) {
            CronTypes.CronStoreFile store = state.store();
            if (store != null && !store.getJobs().isEmpty()) {
                for (CronTypes.CronJob job : store.getJobs()) {
                    String agentId = job.getAgentId() != null && !job.getAgentId().isBlank()
                            ? job.getAgentId()
                            : deps.getDefaultAgentId();
                    storePaths.add(deps.getResolveSessionStorePath().apply(agentId));
                }
            } else {
                storePaths.add(deps.getResolveSessionStorePath().apply(deps.getDefaultAgentId()));
            }
        } else if (deps.getSessionStorePath() != null) {
            storePaths.add(deps.getSessionStorePath());
        }

        long now = state.nowMs();
        for (Path storePath : storePaths) {
            try {
                state.sessionReaper().sweep(deps.getCronConfig(), storePath, now);
            } catch (Exception e) {
                log.warn("cron: session reaper sweep failed for {}: {}", storePath, ErrorUtils.formatErrorMessage(e));
            }
        }
    }

    // =========================================================================
    // Wake / events
    // =========================================================================

    /**
     * Enqueue a free-text system event; {@code NOW} also requests a heartbeat.
     *
     * @return false when the text is blank
     */
    public static boolean wake(CronServiceState state, CronTypes.WakeMode mode, String text) {
        String trimmed = text != null ? text.trim() : "";
        if (trimmed.isEmpty()) {
            return false;
        }
        state.deps().getEnqueueSystemEvent().enqueue(trimmed, CronState.SystemEventTarget.none());
        if (mode == CronTypes.WakeMode.NOW) {
            state.deps().getRequestHeartbeatNow().requestNow(HeartbeatRunner.Request.of("wake"));
        }
        return true;
    }

    public static void emit(CronServiceState state, CronState.CronEvent event) {
        var listener = state.deps().getOnEvent();
        if (listener == null) {
            return;
        }
        try {
            listener.accept(event);
        } catch (Exception e) {
            log.debug("cron: event listener failed: {}", e.getMessage());
        }
    }
}
