package com.openclaw.scheduler.common.config;

import lombok.Data;

import java.util.List;

/**
 * Root configuration type for the scheduler process.
 * Only the sections the scheduler reads are modelled; unknown keys in the
 * config file are ignored on load.
 */
@Data
public class SchedulerConfig {

    /** Cron/scheduling settings. */
    private CronConfig cron;

    /** Session settings. */
    private SessionConfig session;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class CronConfig {
        private Boolean enabled;
        /** Store path; "~" expands to OPENCLAW_HOME when set. */
        private String store;
        private Integer maxConcurrentRuns;
        private RetryConfig retry;
        private FailureAlertConfig failureAlert;
        /** Duration string ("24h", "7d", "1h30m") or "false" to disable pruning. */
        private String sessionRetention;
        private RunLogConfig runLog;
    }

    /**
     * Retry policy for one-shot jobs that fail with a transient error.
     */
    @Data
    public static class RetryConfig {
        private Integer maxAttempts;
        private List<Long> backoffMs;
        /** rate_limit | network | timeout | server_error */
        private List<String> retryOn;
    }

    @Data
    public static class FailureAlertConfig {
        private Boolean enabled;
        private Integer after;
        private Long cooldownMs;
    }

    @Data
    public static class RunLogConfig {
        /** Byte count or size string ("2mb"). */
        private String maxBytes;
        private Integer keepLines;
    }

    @Data
    public static class SessionConfig {
        /** Session store path template; "{agentId}" is substituted. */
        private String store;
        /** Main session key. */
        private String mainKey;
    }

    @Data
    public static class LoggingConfig {
        private String level = "info";
    }
}
