package com.tutorflow.tutorbackend.payment;

public record PaymentSession(
        String provider,
        String sessionId,
        String paymentUrl,
        boolean requiresRedirect
) {}
