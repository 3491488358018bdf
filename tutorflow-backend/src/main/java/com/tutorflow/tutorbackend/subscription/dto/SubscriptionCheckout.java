package com.tutorflow.tutorbackend.subscription.dto;

/**
 * A new subscription plus the payment session the client completes. {@code paymentUrl} is null
 * for free plans and the local provider.
 */
public record SubscriptionCheckout(
        SubscriptionDto subscription,
        String provider,
        String sessionId,
        String paymentUrl,
        boolean requiresRedirect
) {}
