package com.tutorflow.tutorbackend.refund;

public enum RefundReason {
    NOT_AS_DESCRIBED,
    DUPLICATE,
    TECHNICAL_ISSUE,
    NO_LONGER_NEEDED,
    OTHER
}
