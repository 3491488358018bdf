package com.tutorflow.tutorbackend.revenue;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Instructor revenue settings.
 *
 * - platformFeePercent: share of every sale kept by the platform, 0..100
 * - minimumPayout: smallest payout an instructor may request
 * - earningsHoldDays: days an earning stays pending before it can be withdrawn
 */
@ConfigurationProperties(prefix = "app.revenue")
public record RevenueProperties(
        BigDecimal platformFeePercent,
        BigDecimal minimumPayout,
        int earningsHoldDays
) {
    public RevenueProperties {
        if (platformFeePercent == null) platformFeePercent = new BigDecimal("30");
        if (minimumPayout == null) minimumPayout = new BigDecimal("50.00");
        if (earningsHoldDays < 0) earningsHoldDays = 0;
    }
}
