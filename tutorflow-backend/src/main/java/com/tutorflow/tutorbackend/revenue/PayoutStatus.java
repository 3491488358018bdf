package com.tutorflow.tutorbackend.revenue;

public enum PayoutStatus {
    PENDING,
    PAID,
    FAILED
}
