package com.openclaw.scheduler.cron;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Structured result of one job execution, before it is applied to the job.
 */
@Data
@Builder
public class CronRunOutcome {
    private CronTypes.RunStatus status;
    private String error;
    private String summary;
    private Boolean delivered;
    private Boolean deliveryAttempted;
    private String sessionId;
    private String sessionKey;
    private String model;
    private String provider;
    private Map<String, Object> usage;

    public static CronRunOutcome ok(String summary) {
        return CronRunOutcome.builder().status(CronTypes.RunStatus.OK).summary(summary).build();
    }

    public static CronRunOutcome skipped(String reason) {
        return CronRunOutcome.builder().status(CronTypes.RunStatus.SKIPPED).error(reason).build();
    }

    public static CronRunOutcome error(String error) {
        return CronRunOutcome.builder().status(CronTypes.RunStatus.ERROR).error(error).build();
    }
}
