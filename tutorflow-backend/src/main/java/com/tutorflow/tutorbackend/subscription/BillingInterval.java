package com.tutorflow.tutorbackend.subscription;

import java.math.BigDecimal;
import java.time.ZonedDateTime;

public enum BillingInterval {
    MONTHLY("month"),
    YEARLY("year");

    private final String providerInterval;

    BillingInterval(String providerInterval) {
        this.providerInterval = providerInterval;
    }

    // calendar arithmetic: Jan 31 + 1 month = Feb 28/29
    public ZonedDateTime advance(ZonedDateTime from) {
        return this == YEARLY ? from.plusYears(1) : from.plusMonths(1);
    }

    public BigDecimal priceOf(SubscriptionPlan plan) {
        return this == YEARLY ? plan.getYearlyPrice() : plan.getMonthlyPrice();
    }

    public String providerInterval() {
        return providerInterval;
    }
}
