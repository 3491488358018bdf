package com.tutorflow.tutorbackend.notification;

public enum RelatedType {
    ORDER,
    SUBSCRIPTION,
    REFUND,
    PAYOUT,
    BUNDLE
}
