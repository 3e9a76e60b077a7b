package com.openclaw.scheduler.cron;

import com.openclaw.scheduler.common.infra.ErrorUtils;
import com.openclaw.scheduler.common.infra.HeartbeatRunner;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes one job body: main-timeline injection or an isolated agent turn,
 * optionally raced against the job's timeout.
 */
@Slf4j
public final class CronExecutor {

    private CronExecutor() {
    }

    public static final String TIMEOUT_ERROR = "cron: job execution timed out";
    static final String HEARTBEAT_TARGET_LAST = "last";

    /**
     * Run the job body with its resolved timeout. On timeout the cancellation
     * token fires and the run resolves to a timeout error; the body itself is
     * not stopped by force.
     */
    public static CronRunOutcome executeJobCoreWithTimeout(CronServiceState state, CronTypes.CronJob job)
            throws Exception {
        Long timeoutMs = CronTimeoutPolicy.resolveJobTimeoutMs(job);
        CancellationToken token = new CancellationToken();
        if (timeoutMs == null) {
            return executeJobCore(state, job, token);
        }
        Future<CronRunOutcome> future = state.executor().submit(() -> executeJobCore(state, job, token));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            token.cancel(TIMEOUT_ERROR);
            future.cancel(true);
            throw new CronTimeoutException(timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }

    /**
     * Raised when a job body outlives its timeout.
     */
    public static class CronTimeoutException extends Exception {
        private final long timeoutMs;

        public CronTimeoutException(long timeoutMs) {
            super(TIMEOUT_ERROR);
            this.timeoutMs = timeoutMs;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }
    }

    public static CronRunOutcome executeJobCore(CronServiceState state, CronTypes.CronJob job,
            CancellationToken token) throws Exception {
        if (token.isCancelled()) {
            return CronRunOutcome.error(TIMEOUT_ERROR);
        }
        if (job.getSessionTarget() == CronTypes.SessionTarget.MAIN) {
            return executeMain(state, job, token);
        }
        return executeIsolated(state, job, token);
    }

    // =========================================================================
    // Main target
    // =========================================================================

    private static CronRunOutcome executeMain(CronServiceState state, CronTypes.CronJob job,
            CancellationToken token) throws InterruptedException {
        CronState.CronServiceDeps deps = state.deps();
        String text = CronJobs.resolveJobPayloadTextForMain(job);
        if (text == null) {
            boolean systemEvent = job.getPayload() != null
                    && job.getPayload().getKind() == CronTypes.PayloadKind.SYSTEM_EVENT;
            return CronRunOutcome.skipped(systemEvent
                    ? "main job requires non-empty systemEvent text"
                    : "main job requires payload.kind=\"systemEvent\"");
        }
        String reason = "cron:" + job.getId();
        deps.getEnqueueSystemEvent().enqueue(text,
                new CronState.SystemEventTarget(job.getAgentId(), job.getSessionKey(), reason));

        if (job.getWakeMode() == CronTypes.WakeMode.NOW && deps.getRunHeartbeatOnce() != null) {
            long waitStartedAt = state.nowMs();
            HeartbeatRunner.RunResult result;
            while (true) {
                if (token.isCancelled()) {
                    return CronRunOutcome.error(TIMEOUT_ERROR);
                }
                result = deps.getRunHeartbeatOnce().runOnce(new HeartbeatRunner.Request(
                        reason, job.getAgentId(), job.getSessionKey(), HEARTBEAT_TARGET_LAST));
                if (result == null || !result.isBusy()) {
                    break;
                }
                if (state.nowMs() - waitStartedAt > deps.getWakeNowHeartbeatBusyMaxWaitMs()) {
                    if (token.isCancelled()) {
                        return CronRunOutcome.error(TIMEOUT_ERROR);
                    }
                    deps.getRequestHeartbeatNow().requestNow(
                            new HeartbeatRunner.Request(reason, job.getAgentId(), job.getSessionKey(), null));
                    return CronRunOutcome.ok(text);
                }
                token.sleep(deps.getWakeNowHeartbeatBusyRetryDelayMs());
            }
            if (result == null || "ran".equals(result.status())) {
                return CronRunOutcome.ok(text);
            }
            CronTypes.RunStatus status = "skipped".equals(result.status())
                    ? CronTypes.RunStatus.SKIPPED
                    : CronTypes.RunStatus.ERROR;
            return CronRunOutcome.builder().status(status).error(result.reason()).summary(text).build();
        }

        if (token.isCancelled()) {
            return CronRunOutcome.error(TIMEOUT_ERROR);
        }
        deps.getRequestHeartbeatNow().requestNow(
                new HeartbeatRunner.Request(reason, job.getAgentId(), job.getSessionKey(), null));
        return CronRunOutcome.ok(text);
    }

    // =========================================================================
    // Isolated target
    // =========================================================================

    private static CronRunOutcome executeIsolated(CronServiceState state, CronTypes.CronJob job,
            CancellationToken token) throws Exception {
        CronState.CronServiceDeps deps = state.deps();
        CronTypes.CronPayload payload = job.getPayload();
        if (payload == null || payload.getKind() != CronTypes.PayloadKind.AGENT_TURN) {
            return CronRunOutcome.skipped("isolated job requires payload.kind=agentTurn");
        }
        if (token.isCancelled()) {
            return CronRunOutcome.error(TIMEOUT_ERROR);
        }

        CronState.IsolatedRunResult res = deps.getRunIsolatedAgentJob().run(
                new CronState.IsolatedRunRequest(job, payload.getMessage(), token));
        if (token.isCancelled()) {
            return CronRunOutcome.error(TIMEOUT_ERROR);
        }
        if (res == null) {
            return CronRunOutcome.error("isolated run returned no result");
        }
        CronTypes.RunStatus status = res.getStatus() != null ? res.getStatus() : CronTypes.RunStatus.OK;

        // Post the summary to the main timeline only when delivery was
        // requested and no outbound delivery path ran.
        String summaryText = res.getSummary() != null ? res.getSummary().trim() : "";
        CronDeliveryResolver.DeliveryPlan plan = deps.getResolveDeliveryPlan().apply(job);
        boolean suppressMainSummary = status == CronTypes.RunStatus.ERROR
                && "delivery-target".equals(res.getErrorKind()) && plan.isRequested();
        if (!summaryText.isEmpty()
                && plan.isRequested()
                && !Boolean.TRUE.equals(res.getDelivered())
                && !Boolean.TRUE.equals(res.getDeliveryAttempted())
                && !suppressMainSummary) {
            String label = status == CronTypes.RunStatus.ERROR
                    ? "Cron (error): " + summaryText
                    : "Cron: " + summaryText;
            String reason = "cron:" + job.getId();
            deps.getEnqueueSystemEvent().enqueue(label,
                    new CronState.SystemEventTarget(job.getAgentId(), job.getSessionKey(), reason));
            if (job.getWakeMode() == CronTypes.WakeMode.NOW) {
                deps.getRequestHeartbeatNow().requestNow(
                        new HeartbeatRunner.Request(reason, job.getAgentId(), job.getSessionKey(), null));
            }
        }

        return CronRunOutcome.builder()
                .status(status)
                .error(res.getError())
                .summary(res.getSummary())
                .delivered(res.getDelivered())
                .deliveryAttempted(res.getDeliveryAttempted())
                .sessionId(res.getSessionId())
                .sessionKey(res.getSessionKey())
                .model(res.getModel())
                .provider(res.getProvider())
                .usage(res.getUsage())
                .build();
    }

    /**
     * Run the body and convert any failure into an error outcome.
     */
    static CronRunOutcome executeSafely(CronServiceState state, CronTypes.CronJob job) {
        try {
            return executeJobCoreWithTimeout(state, job);
        } catch (CronTimeoutException e) {
            log.warn("cron: job failed: {} (job={}, timeoutMs={})", TIMEOUT_ERROR, job.getId(), e.getTimeoutMs());
            return CronRunOutcome.error(TIMEOUT_ERROR);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CronRunOutcome.error("cron: job execution interrupted");
        } catch (Exception e) {
            String error = ErrorUtils.formatErrorMessage(e);
            log.warn("cron: job failed: {} (job={})", error, job.getId());
            return CronRunOutcome.error(error);
        }
    }
}
