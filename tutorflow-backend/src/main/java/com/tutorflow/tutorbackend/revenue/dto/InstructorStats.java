package com.tutorflow.tutorbackend.revenue.dto;

import java.math.BigDecimal;

/**
 * @param lifetimeEarnings everything earned and not reversed
 * @param pendingEarnings  still inside the hold period
 * @param availableBalance what can be requested as a payout right now
 * @param pendingPayouts   requested but not yet paid out
 * @param totalWithdrawn   paid out
 */
public record InstructorStats(
        BigDecimal lifetimeEarnings,
        BigDecimal pendingEarnings,
        BigDecimal availableBalance,
        BigDecimal pendingPayouts,
        BigDecimal totalWithdrawn,
        String currency
) {}
