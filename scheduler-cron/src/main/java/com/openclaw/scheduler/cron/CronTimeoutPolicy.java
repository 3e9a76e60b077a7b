package com.openclaw.scheduler.cron;

/**
 * Per-job execution deadline.
 */
public final class CronTimeoutPolicy {

    private CronTimeoutPolicy() {
    }

    public static final long DEFAULT_JOB_TIMEOUT_MS = 10 * 60_000L;

    /**
     * @return timeout in milliseconds, or null when the job runs unbounded
     */
    public static Long resolveJobTimeoutMs(CronTypes.CronJob job) {
        CronTypes.CronPayload payload = job.getPayload();
        if (payload == null) {
            return null;
        }
        Integer seconds = payload.getTimeoutSeconds();
        if (seconds != null && seconds > 0) {
            return seconds * 1000L;
        }
        return payload.getKind() == CronTypes.PayloadKind.AGENT_TURN ? DEFAULT_JOB_TIMEOUT_MS : null;
    }
}
