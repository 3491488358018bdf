package com.tutorflow.tutorbackend.order;

public enum OrderStatus {
    PENDING,
    COMPLETED,
    REFUNDED,
    FAILED
}
