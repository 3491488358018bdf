package com.tutorflow.tutorbackend.notification;

public enum NotificationType {
    PURCHASE,
    SUBSCRIPTION,
    REFUND,
    PAYOUT,
    SYSTEM
}
