package com.openclaw.scheduler.cron;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Cron job type definitions: schedules, payloads, delivery, run state and the
 * create/patch DTOs. Enum values serialize to their lower-case wire keys.
 */
public final class CronTypes {

    private CronTypes() {
    }

    // =========================================================================
    // Schedule
    // =========================================================================

    public enum ScheduleKind {
        AT, EVERY, CRON;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static ScheduleKind fromKey(String key) {
            if (key != null) {
                for (ScheduleKind kind : values()) {
                    if (kind.key().equalsIgnoreCase(key.trim())) {
                        return kind;
                    }
                }
            }
            throw new IllegalArgumentException("unknown schedule kind: " + key);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronSchedule {
        private ScheduleKind kind;
        /** ISO-8601 timestamp for "at" schedules. */
        private String at;
        /** Interval in milliseconds for "every" schedules. */
        private Long everyMs;
        /** Grid anchor for "every" schedules; runs land on anchorMs + k*everyMs. */
        private Long anchorMs;
        /** Cron expression for "cron" schedules (5 or 6 fields). */
        private String expr;
        /** IANA time zone for "cron" schedules; process zone when absent. */
        private String tz;
        /** Random jitter window added to cron fire times. */
        private Long staggerMs;
        /** Disables jitter even when staggerMs is set. */
        private Boolean exact;

        public static CronSchedule at(String at) {
            return CronSchedule.builder().kind(ScheduleKind.AT).at(at).build();
        }

        public static CronSchedule every(long everyMs) {
            return CronSchedule.builder().kind(ScheduleKind.EVERY).everyMs(everyMs).build();
        }

        public static CronSchedule cron(String expr, String tz) {
            return CronSchedule.builder().kind(ScheduleKind.CRON).expr(expr).tz(tz).build();
        }
    }

    // =========================================================================
    // Session/wake modes
    // =========================================================================

    public enum SessionTarget {
        MAIN, ISOLATED;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static SessionTarget fromKey(String key) {
            if ("isolated".equalsIgnoreCase(key))
                return ISOLATED;
            if ("main".equalsIgnoreCase(key))
                return MAIN;
            throw new IllegalArgumentException("unknown session target: " + key);
        }
    }

    public enum WakeMode {
        NEXT_HEARTBEAT, NOW;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }

        @JsonCreator
        public static WakeMode fromKey(String key) {
            if ("now".equalsIgnoreCase(key))
                return NOW;
            return NEXT_HEARTBEAT;
        }
    }

    // =========================================================================
    // Payload
    // =========================================================================

    public enum PayloadKind {
        SYSTEM_EVENT, AGENT_TURN;

        @JsonValue
        public String key() {
            return this == SYSTEM_EVENT ? "systemEvent" : "agentTurn";
        }

        @JsonCreator
        public static PayloadKind fromKey(String key) {
            if ("agentTurn".equalsIgnoreCase(key))
                return AGENT_TURN;
            return SYSTEM_EVENT;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronPayload {
        private PayloadKind kind;
        /** Text for systemEvent payloads. */
        private String text;
        /** Prompt for agentTurn payloads. */
        private String message;
        private String model;
        private String thinking;
        private Integer timeoutSeconds;

        public static CronPayload systemEvent(String text) {
            return CronPayload.builder().kind(PayloadKind.SYSTEM_EVENT).text(text).build();
        }

        public static CronPayload agentTurn(String message) {
            return CronPayload.builder().kind(PayloadKind.AGENT_TURN).message(message).build();
        }
    }

    // =========================================================================
    // Delivery
    // =========================================================================

    public enum DeliveryMode {
        NONE, ANNOUNCE, WEBHOOK;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static DeliveryMode fromKey(String key) {
            if ("announce".equalsIgnoreCase(key) || "deliver".equalsIgnoreCase(key))
                return ANNOUNCE;
            if ("webhook".equalsIgnoreCase(key))
                return WEBHOOK;
            return NONE;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronDelivery {
        private DeliveryMode mode;
        private String channel;
        private String to;
        private Boolean bestEffort;
    }

    // =========================================================================
    // Failure alerts
    // =========================================================================

    /**
     * Per-job failure alert override. Serialized as {@code false} when alerts
     * are suppressed for the job; a missing value inherits the process-wide
     * policy.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonSerialize(using = FailureAlertSerializer.class)
    @JsonDeserialize(using = FailureAlertDeserializer.class)
    public static class CronFailureAlert {
        private Integer after;
        private Long cooldownMs;
        private String channel;
        private String to;
        @JsonIgnore
        private boolean disabled;

        public static CronFailureAlert suppressed() {
            return CronFailureAlert.builder().disabled(true).build();
        }
    }

    static class FailureAlertSerializer extends JsonSerializer<CronFailureAlert> {
        @Override
        public void serialize(CronFailureAlert value, JsonGenerator gen, SerializerProvider provider)
                throws IOException {
            if (value.isDisabled()) {
                gen.writeBoolean(false);
                return;
            }
            gen.writeStartObject();
            if (value.getAfter() != null)
                gen.writeNumberField("after", value.getAfter());
            if (value.getCooldownMs() != null)
                gen.writeNumberField("cooldownMs", value.getCooldownMs());
            if (value.getChannel() != null)
                gen.writeStringField("channel", value.getChannel());
            if (value.getTo() != null)
                gen.writeStringField("to", value.getTo());
            gen.writeEndObject();
        }
    }

    static class FailureAlertDeserializer extends JsonDeserializer<CronFailureAlert> {
        @Override
        public CronFailureAlert deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            if (node.isBoolean()) {
                return node.booleanValue() ? new CronFailureAlert() : CronFailureAlert.suppressed();
            }
            if (!node.isObject()) {
                return null;
            }
            CronFailureAlert alert = new CronFailureAlert();
            if (node.hasNonNull("after"))
                alert.setAfter(node.get("after").asInt());
            if (node.hasNonNull("cooldownMs"))
                alert.setCooldownMs(node.get("cooldownMs").asLong());
            if (node.hasNonNull("channel"))
                alert.setChannel(node.get("channel").asText());
            if (node.hasNonNull("to"))
                alert.setTo(node.get("to").asText());
            return alert;
        }
    }

    // =========================================================================
    // Run status
    // =========================================================================

    public enum RunStatus {
        OK, ERROR, SKIPPED;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static RunStatus fromKey(String key) {
            if ("error".equalsIgnoreCase(key))
                return ERROR;
            if ("skipped".equalsIgnoreCase(key))
                return SKIPPED;
            return OK;
        }
    }

    public enum DeliveryStatus {
        DELIVERED, NOT_DELIVERED, UNKNOWN, NOT_REQUESTED;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }

        @JsonCreator
        public static DeliveryStatus fromKey(String key) {
            for (DeliveryStatus status : values()) {
                if (status.key().equalsIgnoreCase(key)) {
                    return status;
                }
            }
            return UNKNOWN;
        }
    }

    // =========================================================================
    // Job state
    // =========================================================================

    /**
     * Run telemetry, owned by the scheduler.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronJobState {
        private Long nextRunAtMs;
        private Long runningAtMs;
        private Long lastRunAtMs;
        private RunStatus lastRunStatus;
        /** Mirrors lastRunStatus; older stores only carry this field. */
        private RunStatus lastStatus;
        private String lastError;
        private Long lastDurationMs;
        private Boolean lastDelivered;
        private DeliveryStatus lastDeliveryStatus;
        private String lastDeliveryError;
        private int consecutiveErrors;
        private Long lastFailureAlertAtMs;
    }

    // =========================================================================
    // Job model
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class CronJob {
        private String id;
        private String agentId;
        /** Originating session; main-target reminders route follow-through back to it. */
        private String sessionKey;
        private String name;
        private String description;
        private boolean enabled;
        private Boolean deleteAfterRun;
        private long createdAtMs;
        private long updatedAtMs;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronDelivery delivery;
        private CronFailureAlert failureAlert;
        @Builder.Default
        private CronJobState state = new CronJobState();
    }

    // =========================================================================
    // Create/Patch DTOs
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobCreate {
        private String agentId;
        private String sessionKey;
        private String name;
        private String description;
        private Boolean enabled;
        private Boolean deleteAfterRun;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronDelivery delivery;
        private CronFailureAlert failureAlert;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronJobPatch {
        private String agentId;
        private String sessionKey;
        private String name;
        private String description;
        private Boolean enabled;
        private Boolean deleteAfterRun;
        private CronSchedule schedule;
        private SessionTarget sessionTarget;
        private WakeMode wakeMode;
        private CronPayload payload;
        private CronDelivery delivery;
        private CronFailureAlert failureAlert;
    }

    // =========================================================================
    // Store format
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CronStoreFile {
        @Builder.Default
        private int version = 1;
        @Builder.Default
        private List<CronJob> jobs = new ArrayList<>();
    }
}
