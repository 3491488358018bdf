package com.tutorflow.tutorbackend.payment;

public enum WebhookEventStatus {
    PENDING,
    PROCESSED,
    FAILED
}
