package com.tutorflow.tutorbackend.payment;

import java.util.List;
import java.util.Map;

/**
 * @param amountMinor      total in minor currency units
 * @param recurringInterval "month" or "year" for subscription checkouts, null for one-off payments
 * @param metadata         echoed back by the provider on every related webhook; carries order_number
 *                         or subscription_id for correlation
 */
public record PaymentSessionRequest(
        long amountMinor,
        String currency,
        List<LineItem> lineItems,
        String customerEmail,
        Map<String, String> metadata,
        String recurringInterval
) {
    public boolean isSubscription() {
        return recurringInterval != null;
    }

    public record LineItem(String name, long unitAmountMinor, int quantity) {}
}
