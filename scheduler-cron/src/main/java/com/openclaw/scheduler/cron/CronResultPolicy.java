package com.openclaw.scheduler.cron;

import com.openclaw.scheduler.common.config.SchedulerConfig;
import com.openclaw.scheduler.common.infra.ErrorUtils;
import com.openclaw.scheduler.common.infra.HeartbeatRunner;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Turns a run outcome into updated job state: telemetry, delivery status,
 * consecutive-error tracking with failure alerts, one-shot lifecycle and
 * backoff scheduling.
 */
@Slf4j
public final class CronResultPolicy {

    private CronResultPolicy() {
    }

    /** Delays indexed by consecutive error count; the last entry repeats. */
    public static final List<Long> DEFAULT_BACKOFF_SCHEDULE_MS = List.of(
            30_000L, 60_000L, 5 * 60_000L, 15 * 60_000L, 60 * 60_000L);
    public static final int DEFAULT_MAX_TRANSIENT_RETRIES = 3;
    public static final int DEFAULT_FAILURE_ALERT_AFTER = 2;
    public static final long DEFAULT_FAILURE_ALERT_COOLDOWN_MS = 60 * 60_000L;
    static final int ALERT_ERROR_MAX_CHARS = 200;

    public record JobResult(CronTypes.RunStatus status, String error, Boolean delivered, long startedAt,
            long endedAt) {
    }

    public record RetryConfig(int maxAttempts, List<Long> backoffMs, List<String> retryOn) {
    }

    public record AlertConfig(int after, long cooldownMs, String channel, String to) {
    }

    // =========================================================================
    // Backoff / retry
    // =========================================================================

    public static long errorBackoffMs(int consecutiveErrors, List<Long> scheduleMs) {
        int idx = Math.min(consecutiveErrors - 1, scheduleMs.size() - 1);
        return scheduleMs.get(Math.max(0, idx));
    }

    public static RetryConfig resolveRetryConfig(SchedulerConfig.CronConfig cronConfig) {
        SchedulerConfig.RetryConfig retry = cronConfig != null ? cronConfig.getRetry() : null;
        int maxAttempts = retry != null && retry.getMaxAttempts() != null
                ? retry.getMaxAttempts()
                : DEFAULT_MAX_TRANSIENT_RETRIES;
        List<Long> backoff = retry != null && retry.getBackoffMs() != null && !retry.getBackoffMs().isEmpty()
                ? List.copyOf(retry.getBackoffMs())
                : DEFAULT_BACKOFF_SCHEDULE_MS.subList(0, 3);
        List<String> retryOn = retry != null && retry.getRetryOn() != null && !retry.getRetryOn().isEmpty()
                ? List.copyOf(retry.getRetryOn())
                : null;
        return new RetryConfig(maxAttempts, backoff, retryOn);
    }

    // =========================================================================
    // Delivery status
    // =========================================================================

    static CronTypes.DeliveryStatus resolveDeliveryStatus(CronServiceState state, CronTypes.CronJob job,
            Boolean delivered) {
        if (Boolean.TRUE.equals(delivered)) {
            return CronTypes.DeliveryStatus.DELIVERED;
        }
        if (Boolean.FALSE.equals(delivered)) {
            return CronTypes.DeliveryStatus.NOT_DELIVERED;
        }
        return state.deps().getResolveDeliveryPlan().apply(job).isRequested()
                ? CronTypes.DeliveryStatus.UNKNOWN
                : CronTypes.DeliveryStatus.NOT_REQUESTED;
    }

    // =========================================================================
    // Failure alerts
    // =========================================================================

    /**
     * Effective alert policy for a job, or null when alerts are off for it.
     * Job values win over process-wide values, which win over defaults.
     */
    public static AlertConfig resolveFailureAlert(SchedulerConfig.CronConfig cronConfig, CronTypes.CronJob job) {
        CronTypes.CronFailureAlert jobConfig = job.getFailureAlert();
        if (jobConfig != null && jobConfig.isDisabled()) {
            return null;
        }
        SchedulerConfig.FailureAlertConfig global = cronConfig != null ? cronConfig.getFailureAlert() : null;
        if (jobConfig == null && (global == null || !Boolean.TRUE.equals(global.getEnabled()))) {
            return null;
        }
        Integer after = jobConfig != null && jobConfig.getAfter() != null ? jobConfig.getAfter()
                : global != null ? global.getAfter() : null;
        Long cooldown = jobConfig != null && jobConfig.getCooldownMs() != null ? jobConfig.getCooldownMs()
                : global != null ? global.getCooldownMs() : null;
        String channel = firstNonNull(
                CronDeliveryResolver.normalizeChannel(jobConfig != null ? jobConfig.getChannel() : null),
                CronDeliveryResolver.normalizeChannel(job.getDelivery() != null ? job.getDelivery().getChannel() : null),
                "last");
        String to = firstNonNull(
                CronDeliveryResolver.normalizeTo(jobConfig != null ? jobConfig.getTo() : null),
                CronDeliveryResolver.normalizeTo(job.getDelivery() != null ? job.getDelivery().getTo() : null),
                null);
        return new AlertConfig(
                after != null && after >= 1 ? after : DEFAULT_FAILURE_ALERT_AFTER,
                cooldown != null && cooldown >= 0 ? cooldown : DEFAULT_FAILURE_ALERT_COOLDOWN_MS,
                channel,
                to);
    }

    static String formatFailureAlertText(CronTypes.CronJob job, String error, int consecutiveErrors) {
        String name = job.getName() != null && !job.getName().isEmpty() ? job.getName() : job.getId();
        String trimmed = error != null ? error.trim() : "";
        String lastError = ErrorUtils.truncate(trimmed.isEmpty() ? "unknown error" : trimmed, ALERT_ERROR_MAX_CHARS);
        return "Cron job \"" + name + "\" failed " + consecutiveErrors + " times\nLast error: " + lastError;
    }

    static void emitFailureAlert(CronServiceState state, CronTypes.CronJob job, String error,
            int consecutiveErrors, AlertConfig config) {
        String text = formatFailureAlertText(job, error, consecutiveErrors);
        CronState.FailureAlertSender sender = state.deps().getSendCronFailureAlert();
        if (sender != null) {
            try {
                sender.send(new CronState.FailureAlert(job, text, config.channel(), config.to()));
            } catch (Exception e) {
                log.warn("cron: failure alert delivery failed for job {}: {}", job.getId(),
                        ErrorUtils.formatErrorMessage(e));
            }
            return;
        }
        state.deps().getEnqueueSystemEvent().enqueue(text,
                new CronState.SystemEventTarget(job.getAgentId(), null, null));
        if (job.getWakeMode() == CronTypes.WakeMode.NOW) {
            state.deps().getRequestHeartbeatNow().requestNow(new HeartbeatRunner.Request(
                    "cron:" + job.getId() + ":failure-alert", job.getAgentId(), null, null));
        }
    }

    // =========================================================================
    // Apply
    // =========================================================================

    /**
     * Apply the result of a job execution to the job's state. Must be called
     * under the lock.
     *
     * @return true if the job should be deleted from the store
     */
    public static boolean applyJobResult(CronServiceState state, CronTypes.CronJob job, JobResult result) {
        CronTypes.CronJobState st = job.getState();
        st.setRunningAtMs(null);
        st.setLastRunAtMs(result.startedAt());
        st.setLastRunStatus(result.status());
        st.setLastStatus(result.status());
        st.setLastDurationMs(Math.max(0, result.endedAt() - result.startedAt()));
        st.setLastError(result.error());
        st.setLastDelivered(result.delivered());
        CronTypes.DeliveryStatus deliveryStatus = resolveDeliveryStatus(state, job, result.delivered());
        st.setLastDeliveryStatus(deliveryStatus);
        st.setLastDeliveryError(deliveryStatus == CronTypes.DeliveryStatus.NOT_DELIVERED && result.error() != null
                ? result.error()
                : null);
        job.setUpdatedAtMs(result.endedAt());

        if (result.status() == CronTypes.RunStatus.ERROR) {
            st.setConsecutiveErrors(st.getConsecutiveErrors() + 1);
            AlertConfig alertConfig = resolveFailureAlert(state.deps().getCronConfig(), job);
            if (alertConfig != null && st.getConsecutiveErrors() >= alertConfig.after()) {
                long now = state.nowMs();
                Long lastAlert = st.getLastFailureAlertAtMs();
                boolean inCooldown = lastAlert != null && now - lastAlert < Math.max(0, alertConfig.cooldownMs());
                if (!inCooldown) {
                    emitFailureAlert(state, job, result.error(), st.getConsecutiveErrors(), alertConfig);
                    st.setLastFailureAlertAtMs(now);
                }
            }
        } else {
            st.setConsecutiveErrors(0);
            st.setLastFailureAlertAtMs(null);
        }

        boolean isAt = job.getSchedule() != null && job.getSchedule().getKind() == CronTypes.ScheduleKind.AT;
        boolean shouldDelete = isAt && Boolean.TRUE.equals(job.getDeleteAfterRun())
                && result.status() == CronTypes.RunStatus.OK;
        if (shouldDelete) {
            return true;
        }

        if (isAt) {
            if (result.status() != CronTypes.RunStatus.ERROR) {
                job.setEnabled(false);
                st.setNextRunAtMs(null);
            } else {
                applyOneShotError(state, job, result);
            }
        } else if (result.status() == CronTypes.RunStatus.ERROR && job.isEnabled()) {
            long backoff = errorBackoffMs(Math.max(1, st.getConsecutiveErrors()), DEFAULT_BACKOFF_SCHEDULE_MS);
            Long normalNext = CronJobs.computeJobNextRunAtMs(job, result.endedAt());
            long backoffNext = result.endedAt() + backoff;
            st.setNextRunAtMs(normalNext != null ? Math.max(normalNext, backoffNext) : backoffNext);
            log.info("cron: applying error backoff to job {} (consecutiveErrors={}, backoffMs={}, nextRunAtMs={})",
                    job.getId(), st.getConsecutiveErrors(), backoff, st.getNextRunAtMs());
        } else if (job.isEnabled()) {
            st.setNextRunAtMs(CronSchedules.computeNextRunAtMsWithMinGap(job.getSchedule(), result.endedAt(),
                    result.endedAt()));
        } else {
            st.setNextRunAtMs(null);
        }
        return false;
    }

    private static void applyOneShotError(CronServiceState state, CronTypes.CronJob job, JobResult result) {
        CronTypes.CronJobState st = job.getState();
        RetryConfig retry = resolveRetryConfig(state.deps().getCronConfig());
        boolean transientError = state.deps().getErrorClassifier().isTransient(result.error(), retry.retryOn());
        int consecutive = st.getConsecutiveErrors();
        if (transientError && consecutive <= retry.maxAttempts()) {
            long backoff = errorBackoffMs(consecutive, retry.backoffMs());
            st.setNextRunAtMs(result.endedAt() + backoff);
            log.info("cron: scheduling one-shot retry after transient error for job {} "
                    + "(consecutiveErrors={}, backoffMs={}, nextRunAtMs={})",
                    job.getId(), consecutive, backoff, st.getNextRunAtMs());
        } else {
            // Kept in the store so the error stays visible.
            job.setEnabled(false);
            st.setNextRunAtMs(null);
            log.warn("cron: disabling one-shot job {} after error ({}): {}", job.getId(),
                    transientError ? "max retries exhausted" : "permanent error", result.error());
        }
    }

    private static String firstNonNull(String a, String b, String fallback) {
        if (a != null)
            return a;
        if (b != null)
            return b;
        return fallback;
    }
}
