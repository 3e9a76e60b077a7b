package com.openclaw.scheduler.cron;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Job creation, patching, next-run computation and due selection.
 */
@Slf4j
public final class CronJobs {

    private CronJobs() {
    }

    /** A runningAtMs marker older than this is treated as a lost run. */
    static final long STUCK_RUN_MS = 2 * 60 * 60_000L;

    // =========================================================================
    // Create / patch
    // =========================================================================

    public static CronTypes.CronJob createJob(CronServiceState state, CronTypes.CronJobCreate input) {
        if (input == null) {
            throw new IllegalArgumentException("cron job create requires a job object");
        }
        long now = state.nowMs();
        String name = input.getName() != null ? input.getName().trim() : "";
        if (name.isEmpty()) {
            throw new IllegalArgumentException("cron job name is required");
        }
        CronTypes.CronPayload payload = input.getPayload();
        CronTypes.SessionTarget target = input.getSessionTarget();
        if (target == null && payload != null) {
            target = payload.getKind() == CronTypes.PayloadKind.AGENT_TURN
                    ? CronTypes.SessionTarget.ISOLATED
                    : CronTypes.SessionTarget.MAIN;
        }
        CronTypes.CronSchedule schedule = input.getSchedule();
        Boolean deleteAfterRun = input.getDeleteAfterRun();
        if (deleteAfterRun == null && schedule != null && schedule.getKind() == CronTypes.ScheduleKind.AT) {
            deleteAfterRun = true;
        }

        CronTypes.CronJob job = CronTypes.CronJob.builder()
                .id(UUID.randomUUID().toString())
                .agentId(blankToNull(input.getAgentId()))
                .sessionKey(blankToNull(input.getSessionKey()))
                .name(name)
                .description(blankToNull(input.getDescription()))
                .enabled(input.getEnabled() == null || input.getEnabled())
                .deleteAfterRun(deleteAfterRun)
                .createdAtMs(now)
                .updatedAtMs(now)
                .schedule(schedule)
                .sessionTarget(target)
                .wakeMode(input.getWakeMode() != null ? input.getWakeMode() : CronTypes.WakeMode.NEXT_HEARTBEAT)
                .payload(payload)
                .delivery(input.getDelivery())
                .failureAlert(input.getFailureAlert())
                .state(new CronTypes.CronJobState())
                .build();
        assertSupportedJobSpec(job);
        job.getState().setNextRunAtMs(computeJobNextRunAtMs(job, now));
        return job;
    }

    public static void applyJobPatch(CronTypes.CronJob job, CronTypes.CronJobPatch patch, long now) {
        if (patch == null) {
            return;
        }
        boolean scheduleChanged = false;
        boolean enabledChanged = false;
        if (patch.getName() != null) {
            String name = patch.getName().trim();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("cron job name is required");
            }
            job.setName(name);
        }
        if (patch.getDescription() != null)
            job.setDescription(blankToNull(patch.getDescription()));
        if (patch.getAgentId() != null)
            job.setAgentId(blankToNull(patch.getAgentId()));
        if (patch.getSessionKey() != null)
            job.setSessionKey(blankToNull(patch.getSessionKey()));
        if (patch.getEnabled() != null) {
            enabledChanged = patch.getEnabled() != job.isEnabled();
            job.setEnabled(patch.getEnabled());
        }
        if (patch.getDeleteAfterRun() != null)
            job.setDeleteAfterRun(patch.getDeleteAfterRun());
        if (patch.getSchedule() != null) {
            scheduleChanged = true;
            job.setSchedule(patch.getSchedule());
            if (patch.getSchedule().getKind() == CronTypes.ScheduleKind.AT) {
                // A rescheduled one-shot starts a fresh lifecycle.
                job.getState().setLastStatus(null);
                job.getState().setLastRunStatus(null);
                job.getState().setConsecutiveErrors(0);
            }
        }
        if (patch.getSessionTarget() != null)
            job.setSessionTarget(patch.getSessionTarget());
        if (patch.getWakeMode() != null)
            job.setWakeMode(patch.getWakeMode());
        if (patch.getPayload() != null)
            job.setPayload(mergePayload(job.getPayload(), patch.getPayload()));
        if (patch.getDelivery() != null)
            job.setDelivery(mergeDelivery(job.getDelivery(), patch.getDelivery()));
        if (patch.getFailureAlert() != null)
            job.setFailureAlert(patch.getFailureAlert());

        assertSupportedJobSpec(job);
        job.setUpdatedAtMs(now);
        if (scheduleChanged || enabledChanged) {
            job.getState().setNextRunAtMs(job.isEnabled() ? computeJobNextRunAtMs(job, now) : null);
        }
    }

    private static CronTypes.CronPayload mergePayload(CronTypes.CronPayload current, CronTypes.CronPayload patch) {
        if (current == null || (patch.getKind() != null && patch.getKind() != current.getKind())) {
            return patch;
        }
        return CronTypes.CronPayload.builder()
                .kind(current.getKind())
                .text(patch.getText() != null ? patch.getText() : current.getText())
                .message(patch.getMessage() != null ? patch.getMessage() : current.getMessage())
                .model(patch.getModel() != null ? patch.getModel() : current.getModel())
                .thinking(patch.getThinking() != null ? patch.getThinking() : current.getThinking())
                .timeoutSeconds(patch.getTimeoutSeconds() != null ? patch.getTimeoutSeconds()
                        : current.getTimeoutSeconds())
                .build();
    }

    private static CronTypes.CronDelivery mergeDelivery(CronTypes.CronDelivery current,
            CronTypes.CronDelivery patch) {
        if (current == null) {
            return patch;
        }
        return CronTypes.CronDelivery.builder()
                .mode(patch.getMode() != null ? patch.getMode() : current.getMode())
                .channel(patch.getChannel() != null ? patch.getChannel() : current.getChannel())
                .to(patch.getTo() != null ? patch.getTo() : current.getTo())
                .bestEffort(patch.getBestEffort() != null ? patch.getBestEffort() : current.getBestEffort())
                .build();
    }

    /**
     * @throws IllegalArgumentException when the schedule, target or payload is unusable
     */
    static void assertSupportedJobSpec(CronTypes.CronJob job) {
        CronTypes.CronSchedule schedule = job.getSchedule();
        if (schedule == null || schedule.getKind() == null) {
            throw new IllegalArgumentException("cron job requires a schedule");
        }
        switch (schedule.getKind()) {
            case AT -> {
                if (CronParse.parseAbsoluteTimeMs(schedule.getAt()) == null) {
                    throw new IllegalArgumentException("invalid at time: " + schedule.getAt());
                }
            }
            case EVERY -> {
                if (schedule.getEveryMs() == null || schedule.getEveryMs() <= 0) {
                    throw new IllegalArgumentException("every schedule requires everyMs > 0");
                }
            }
            case CRON -> {
                CronSchedules.parseCronExpression(schedule.getExpr());
                if (schedule.getTz() != null) {
                    CronSchedules.resolveZone(schedule.getTz());
                }
            }
        }
        CronTypes.CronPayload payload = job.getPayload();
        if (payload == null || payload.getKind() == null) {
            throw new IllegalArgumentException("cron job requires a payload");
        }
        if (job.getSessionTarget() == CronTypes.SessionTarget.MAIN
                && payload.getKind() != CronTypes.PayloadKind.SYSTEM_EVENT) {
            throw new IllegalArgumentException("main cron jobs require payload.kind=\"systemEvent\"");
        }
        if (job.getSessionTarget() == CronTypes.SessionTarget.MAIN && resolveJobPayloadTextForMain(job) == null) {
            throw new IllegalArgumentException("main cron jobs require non-empty systemEvent text");
        }
        if (job.getSessionTarget() == CronTypes.SessionTarget.ISOLATED
                && payload.getKind() != CronTypes.PayloadKind.AGENT_TURN) {
            throw new IllegalArgumentException("isolated cron jobs require payload.kind=\"agentTurn\"");
        }
    }

    // =========================================================================
    // Next-run computation
    // =========================================================================

    /**
     * Natural next run for a job, measured from {@code nowMs}.
     */
    public static Long computeJobNextRunAtMs(CronTypes.CronJob job, long nowMs) {
        if (!job.isEnabled() || job.getSchedule() == null) {
            return null;
        }
        CronTypes.CronJobState st = job.getState();
        if (job.getSchedule().getKind() == CronTypes.ScheduleKind.AT) {
            Long pending = st.getNextRunAtMs();
            Long lastRun = st.getLastRunAtMs();
            if (st.getLastStatus() == CronTypes.RunStatus.ERROR && pending != null && lastRun != null
                    && pending > lastRun) {
                return pending;
            }
            Long atMs = CronParse.parseAbsoluteTimeMs(job.getSchedule().getAt());
            if (atMs == null) {
                return null;
            }
            // One-shot stays due until it has run at or after its slot.
            if (lastRun != null && st.getLastStatus() != null && lastRun >= atMs) {
                return null;
            }
            return atMs;
        }
        return CronSchedules.computeNextRunAtMs(job.getSchedule(), nowMs);
    }

    /**
     * Full recompute used on start: fills missing or past-due nextRunAtMs
     * values and clears stuck running markers.
     *
     * @return true if any job changed
     */
    public static boolean recomputeNextRuns(CronServiceState state) {
        return walkJobs(state, true);
    }

    /**
     * Maintenance recompute used inside ticks: only fills a missing
     * nextRunAtMs. A past-due value is left alone so it still executes.
     *
     * @return true if any job changed
     */
    public static boolean recomputeNextRunsForMaintenance(CronServiceState state) {
        return walkJobs(state, false);
    }

    private static boolean walkJobs(CronServiceState state, boolean recomputeExpired) {
        CronTypes.CronStoreFile store = state.store();
        if (store == null) {
            return false;
        }
        long now = state.nowMs();
        boolean changed = false;
        for (CronTypes.CronJob job : store.getJobs()) {
            if (job.getState() == null) {
                job.setState(new CronTypes.CronJobState());
                changed = true;
            }
            CronTypes.CronJobState st = job.getState();
            if (!job.isEnabled()) {
                if (st.getNextRunAtMs() != null) {
                    st.setNextRunAtMs(null);
                    changed = true;
                }
                continue;
            }
            Long runningAt = st.getRunningAtMs();
            if (runningAt != null && now - runningAt > STUCK_RUN_MS) {
                log.warn("cron: clearing stuck running marker for job {} (runningAtMs={})", job.getId(), runningAt);
                st.setRunningAtMs(null);
                changed = true;
            }
            Long next = st.getNextRunAtMs();
            boolean missing = next == null;
            boolean expired = next != null && now >= next;
            if (missing || (recomputeExpired && expired)) {
                Long computed = safeCompute(job, now);
                if (!Objects.equals(computed, next)) {
                    st.setNextRunAtMs(computed);
                    changed = true;
                }
            }
        }
        return changed;
    }

    private static Long safeCompute(CronTypes.CronJob job, long now) {
        try {
            return computeJobNextRunAtMs(job, now);
        } catch (IllegalArgumentException e) {
            log.warn("cron: cannot compute next run for job {}: {}", job.getId(), e.getMessage());
            return null;
        }
    }

    /**
     * Earliest nextRunAtMs across enabled jobs.
     */
    public static Long nextWakeAtMs(CronServiceState state) {
        CronTypes.CronStoreFile store = state.store();
        if (store == null) {
            return null;
        }
        Long min = null;
        for (CronTypes.CronJob job : store.getJobs()) {
            Long next = job.getState() != null ? job.getState().getNextRunAtMs() : null;
            if (job.isEnabled() && next != null && (min == null || next < min)) {
                min = next;
            }
        }
        return min;
    }

    // =========================================================================
    // Due selection
    // =========================================================================

    /**
     * A job is runnable when enabled, not running and past its nextRunAtMs.
     * One-shot jobs that already recorded a status are only runnable again
     * for a pending transient-error retry.
     */
    static boolean isRunnableJob(CronTypes.CronJob job, long nowMs, boolean skipAtIfAlreadyRan) {
        if (job.getState() == null) {
            job.setState(new CronTypes.CronJobState());
        }
        CronTypes.CronJobState st = job.getState();
        if (!job.isEnabled() || st.getRunningAtMs() != null) {
            return false;
        }
        if (skipAtIfAlreadyRan && job.getSchedule() != null
                && job.getSchedule().getKind() == CronTypes.ScheduleKind.AT && st.getLastStatus() != null) {
            Long lastRun = st.getLastRunAtMs();
            Long nextRun = st.getNextRunAtMs();
            if (st.getLastStatus() == CronTypes.RunStatus.ERROR && nextRun != null && lastRun != null
                    && nextRun > lastRun) {
                return nowMs >= nextRun;
            }
            return false;
        }
        Long next = st.getNextRunAtMs();
        return next != null && nowMs >= next;
    }

    static List<CronTypes.CronJob> collectRunnableJobs(CronServiceState state, long nowMs) {
        List<CronTypes.CronJob> out = new ArrayList<>();
        CronTypes.CronStoreFile store = state.store();
        if (store == null) {
            return out;
        }
        for (CronTypes.CronJob job : store.getJobs()) {
            if (isRunnableJob(job, nowMs, true)) {
                out.add(job);
            }
        }
        return out;
    }

    static boolean isJobDue(CronTypes.CronJob job, long nowMs, boolean forced) {
        if (forced) {
            return true;
        }
        Long next = job.getState() != null ? job.getState().getNextRunAtMs() : null;
        return job.isEnabled() && next != null && nowMs >= next;
    }

    static CronTypes.CronJob findJob(CronServiceState state, String id) {
        CronTypes.CronStoreFile store = state.store();
        if (store == null || id == null) {
            return null;
        }
        for (CronTypes.CronJob job : store.getJobs()) {
            if (id.equals(job.getId())) {
                return job;
            }
        }
        return null;
    }

    /**
     * Detached copy of a job for callers outside the lock.
     */
    static CronTypes.CronJob copyJob(CronTypes.CronJob job) {
        return CronStore.MAPPER.convertValue(CronStore.MAPPER.valueToTree(job), CronTypes.CronJob.class);
    }

    /**
     * Text a main-target job injects, or null when the payload is unusable.
     */
    static String resolveJobPayloadTextForMain(CronTypes.CronJob job) {
        CronTypes.CronPayload payload = job.getPayload();
        if (payload == null || payload.getKind() != CronTypes.PayloadKind.SYSTEM_EVENT) {
            return null;
        }
        String text = payload.getText() != null ? payload.getText().trim() : "";
        return text.isEmpty() ? null : text;
    }

    private static String blankToNull(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
