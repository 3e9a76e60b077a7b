package com.openclaw.scheduler.cron;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Cron delivery plan resolution.
 * Determines whether & how an isolated run's summary is announced.
 */
public final class CronDeliveryResolver {

    private CronDeliveryResolver() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DeliveryPlan {
        private CronTypes.DeliveryMode mode;
        private String channel;
        private String to;
        /** Where the delivery config came from: "delivery" or "default". */
        private String source;
        private boolean requested;
    }

    /**
     * Resolve the delivery plan for a job.
     */
    public static DeliveryPlan resolve(CronTypes.CronJob job) {
        CronTypes.CronDelivery delivery = job.getDelivery();
        if (delivery == null) {
            return DeliveryPlan.builder()
                    .mode(CronTypes.DeliveryMode.NONE)
                    .channel("last")
                    .source("default")
                    .requested(false)
                    .build();
        }

        CronTypes.DeliveryMode mode = delivery.getMode() != null ? delivery.getMode() : CronTypes.DeliveryMode.NONE;
        String channel = normalizeChannel(delivery.getChannel());
        String to = normalizeTo(delivery.getTo());

        boolean requested = switch (mode) {
            case ANNOUNCE -> true;
            case WEBHOOK -> to != null;
            default -> false;
        };

        return DeliveryPlan.builder()
                .mode(mode)
                .channel(channel != null ? channel : "last")
                .to(to)
                .source("delivery")
                .requested(requested)
                .build();
    }

    static String normalizeChannel(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }

    static String normalizeTo(String value) {
        if (value == null)
            return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
