package com.tutorflow.tutorbackend.refund;

public enum RefundStatus {
    PENDING,
    APPROVED,
    REJECTED,
    PROCESSED
}
