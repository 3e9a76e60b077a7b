package com.openclaw.scheduler.cron;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.openclaw.scheduler.common.config.ConfigPaths;
import com.openclaw.scheduler.common.config.SchedulerConfig;
import com.openclaw.scheduler.common.infra.HeartbeatRunner;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Cron service state types: events, dependencies and the collaborator
 * contracts the host application implements.
 */
public final class CronState {

    private CronState() {
    }

    // =========================================================================
    // Event types
    // =========================================================================

    public enum CronEventAction {
        ADDED, UPDATED, REMOVED, STARTED, FINISHED;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Cron lifecycle event.
     */
    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronEvent {
        private String jobId;
        private CronEventAction action;
        private Long runAtMs;
        private Long durationMs;
        private CronTypes.RunStatus status;
        private String error;
        private String summary;
        private Boolean delivered;
        private CronTypes.DeliveryStatus deliveryStatus;
        private String deliveryError;
        private String sessionId;
        private String sessionKey;
        private Long nextRunAtMs;
        private String model;
        private String provider;
        private Map<String, Object> usage;
    }

    // =========================================================================
    // Collaborator contracts
    // =========================================================================

    /** Where a system event lands; null fields fall back to the host's main session. */
    public record SystemEventTarget(String agentId, String sessionKey, String contextKey) {

        public static SystemEventTarget none() {
            return new SystemEventTarget(null, null, null);
        }
    }

    /** Injects text into a conversation timeline. */
    @FunctionalInterface
    public interface SystemEventSink {
        void enqueue(String text, SystemEventTarget target);
    }

    /** Fire-and-forget heartbeat trigger. */
    @FunctionalInterface
    public interface HeartbeatRequester {
        void requestNow(HeartbeatRunner.Request request);
    }

    /**
     * Synchronous heartbeat attempt; reports {@code skipped / requests-in-flight}
     * while another heartbeat is executing.
     */
    @FunctionalInterface
    public interface HeartbeatRunOnce {
        HeartbeatRunner.RunResult runOnce(HeartbeatRunner.Request request);
    }

    public record IsolatedRunRequest(CronTypes.CronJob job, String message, CancellationToken cancellation) {
    }

    /**
     * Outcome of an isolated agent turn.
     */
    @Data
    @Builder
    public static class IsolatedRunResult {
        private CronTypes.RunStatus status;
        private String error;
        /** "delivery-target" when the run failed because its delivery target was unusable. */
        private String errorKind;
        private String summary;
        private Boolean delivered;
        private Boolean deliveryAttempted;
        private String sessionId;
        private String sessionKey;
        private String model;
        private String provider;
        private Map<String, Object> usage;
    }

    /** Runs an agentTurn payload as a standalone agent turn. */
    @FunctionalInterface
    public interface IsolatedJobRunner {
        IsolatedRunResult run(IsolatedRunRequest request) throws Exception;
    }

    public record FailureAlert(CronTypes.CronJob job, String text, String channel, String to) {
    }

    @FunctionalInterface
    public interface FailureAlertSender {
        void send(FailureAlert alert) throws Exception;
    }

    // =========================================================================
    // Dependencies
    // =========================================================================

    /**
     * Dependencies for cron service initialization.
     */
    @Data
    @Builder
    public static class CronServiceDeps {
        private Path storePath;
        private boolean cronEnabled;
        private SchedulerConfig.CronConfig cronConfig;
        @Builder.Default
        private String defaultAgentId = ConfigPaths.DEFAULT_AGENT_ID;
        @Builder.Default
        private LongSupplier nowMs = System::currentTimeMillis;
        /** Timer implementation; a daemon scheduled executor when absent. */
        private WakeScheduler wakeScheduler;

        private SystemEventSink enqueueSystemEvent;
        private HeartbeatRequester requestHeartbeatNow;
        private HeartbeatRunOnce runHeartbeatOnce;
        private IsolatedJobRunner runIsolatedAgentJob;
        private FailureAlertSender sendCronFailureAlert;
        @Builder.Default
        private Function<CronTypes.CronJob, CronDeliveryResolver.DeliveryPlan> resolveDeliveryPlan = CronDeliveryResolver::resolve;

        /** Per-agent session store for the reaper; takes precedence over sessionStorePath. */
        private Function<String, Path> resolveSessionStorePath;
        private Path sessionStorePath;

        private Consumer<CronEvent> onEvent;

        @Builder.Default
        private long wakeNowHeartbeatBusyMaxWaitMs = 120_000;
        @Builder.Default
        private long wakeNowHeartbeatBusyRetryDelayMs = 250;
        @Builder.Default
        private CronErrorClassifier errorClassifier = CronErrorClassifier.defaults();
    }

    // =========================================================================
    // Result types
    // =========================================================================

    /** Result of running a cron job on demand. */
    public sealed interface CronRunResult {
        boolean ran();
    }

    public record CronRanOk() implements CronRunResult {
        @Override
        public boolean ran() {
            return true;
        }
    }

    /** reason: "not-due" or "already-running". */
    public record CronNotRun(String reason) implements CronRunResult {
        @Override
        public boolean ran() {
            return false;
        }
    }

    /** Result of removing a cron job. */
    public record CronRemoveResult(boolean ok, boolean removed) {
    }

    // =========================================================================
    // Enums
    // =========================================================================

    public enum CronRunMode {
        DUE, FORCE
    }

    // =========================================================================
    // Status & listing
    // =========================================================================

    /**
     * Cron status summary for diagnostics.
     */
    @Data
    @Builder
    public static class CronStatusSummary {
        private boolean enabled;
        private String storePath;
        private int jobs;
        private Long nextWakeAtMs;
    }

    public enum EnabledFilter {
        ALL, ENABLED, DISABLED
    }

    public enum SortBy {
        NEXT_RUN_AT_MS, UPDATED_AT_MS, NAME
    }

    public enum SortDir {
        ASC, DESC
    }

    @Data
    @Builder
    public static class CronListPageOptions {
        /** Case-insensitive match against id, name, description and agentId. */
        private String query;
        @Builder.Default
        private EnabledFilter enabled = EnabledFilter.ALL;
        @Builder.Default
        private SortBy sortBy = SortBy.NEXT_RUN_AT_MS;
        @Builder.Default
        private SortDir sortDir = SortDir.ASC;
        private Integer offset;
        private Integer limit;
    }

    public record CronListPage(List<CronTypes.CronJob> jobs, int total, int offset, int limit,
            boolean hasMore, Integer nextOffset) {
    }
}
