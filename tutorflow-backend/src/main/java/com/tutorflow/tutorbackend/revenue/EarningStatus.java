package com.tutorflow.tutorbackend.revenue;

public enum EarningStatus {
    PENDING,
    AVAILABLE,
    PAID,
    REVERSED
}
