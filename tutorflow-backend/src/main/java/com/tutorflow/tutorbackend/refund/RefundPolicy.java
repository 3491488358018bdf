package com.tutorflow.tutorbackend.refund;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * @param maxDaysAfterPurchase refunds are refused once more whole days than this have passed
 * @param maxProgressPercent   refunds are refused once any purchased course is further along than this
 * @param autoApproveUnder     orders at or below this total skip admin review, unless approval is required
 * @param requiresApproval     every refund waits for an admin when true
 */
@ConfigurationProperties(prefix = "app.refunds")
public record RefundPolicy(
        Integer maxDaysAfterPurchase,
        Integer maxProgressPercent,
        BigDecimal autoApproveUnder,
        Boolean requiresApproval
) {
    public RefundPolicy {
        if (maxDaysAfterPurchase == null) maxDaysAfterPurchase = 30;
        if (maxProgressPercent == null) maxProgressPercent = 30;
        if (autoApproveUnder == null) autoApproveUnder = new BigDecimal("10.00");
        if (requiresApproval == null) requiresApproval = Boolean.TRUE;
    }

    public boolean autoApproves(BigDecimal amount) {
        return !requiresApproval && amount.compareTo(autoApproveUnder) <= 0;
    }
}
