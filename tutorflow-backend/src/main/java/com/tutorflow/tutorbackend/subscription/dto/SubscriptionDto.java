package com.tutorflow.tutorbackend.subscription.dto;

import com.tutorflow.tutorbackend.subscription.Subscription;

import java.math.BigDecimal;
import java.time.Instant;

public record SubscriptionDto(
        Long id,
        String planSlug,
        String planName,
        String billingInterval,
        BigDecimal price,
        String status,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        boolean cancelAtPeriodEnd,
        Instant canceledAt,
        Instant trialEnd,
        Instant endedAt,
        String planLabel
) {
    public static SubscriptionDto from(Subscription sub) {
        return new SubscriptionDto(
                sub.getId(),
                sub.getPlan().getSlug(),
                sub.getPlan().getName(),
                sub.getBillingInterval().name(),
                sub.getPrice(),
                sub.getStatus().name(),
                sub.getCurrentPeriodStart(),
                sub.getCurrentPeriodEnd(),
                sub.isCancelAtPeriodEnd(),
                sub.getCanceledAt(),
                sub.getTrialEnd(),
                sub.getEndedAt(),
                formatLabel(sub.getPlan().getName(), sub.getBillingInterval().name())
        );
    }

    private static String formatLabel(String planName, String interval) {
        if (planName == null || planName.isBlank()) return "Unknown Plan";
        return planName + " " + interval.substring(0, 1) + interval.substring(1).toLowerCase();
    }
}
