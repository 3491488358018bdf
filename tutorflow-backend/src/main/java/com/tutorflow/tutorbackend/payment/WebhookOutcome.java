package com.tutorflow.tutorbackend.payment;

public enum WebhookOutcome {
    PROCESSED,
    DUPLICATE,
    IGNORED
}
