package com.tutorflow.tutorbackend.payment;

import java.util.Map;

/**
 * A refund to send to the provider. {@code idempotencyKey} is stable per refund row, so a call
 * repeated after a lost commit returns the original provider refund instead of a second one.
 */
public record RefundCommand(
        String paymentReference,
        long amountMinor,
        String currency,
        Map<String, String> metadata,
        String idempotencyKey
) {}
