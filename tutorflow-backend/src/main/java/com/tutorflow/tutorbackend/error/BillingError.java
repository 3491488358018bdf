package com.tutorflow.tutorbackend.error;

/**
 * Business failure codes returned to API callers. Each code belongs to exactly one {@link ErrorKind}.
 */
public enum BillingError {
    NOT_FOUND(ErrorKind.NOT_FOUND),

    ALREADY_SUBSCRIBED(ErrorKind.CONFLICT),
    DUPLICATE_REFUND(ErrorKind.CONFLICT),
    ALREADY_ENROLLED(ErrorKind.CONFLICT),
    ALREADY_IN_BUNDLE(ErrorKind.CONFLICT),
    CONFLICT(ErrorKind.CONFLICT),

    PLAN_UNAVAILABLE(ErrorKind.POLICY_VIOLATION),
    OUT_OF_WINDOW(ErrorKind.POLICY_VIOLATION),
    ALREADY_REFUNDED(ErrorKind.POLICY_VIOLATION),
    ORDER_NOT_SETTLED(ErrorKind.POLICY_VIOLATION),
    NOT_PROCESSABLE(ErrorKind.POLICY_VIOLATION),
    INSUFFICIENT_FUNDS(ErrorKind.POLICY_VIOLATION),
    BELOW_MINIMUM(ErrorKind.POLICY_VIOLATION),
    BUNDLE_UNAVAILABLE(ErrorKind.POLICY_VIOLATION),
    EXCESSIVE_PROGRESS(ErrorKind.POLICY_VIOLATION),
    COURSE_NOT_PUBLISHED(ErrorKind.POLICY_VIOLATION),
    NOT_SCHEDULED_FOR_CANCELLATION(ErrorKind.POLICY_VIOLATION),
    NO_ACTIVE_SUBSCRIPTION(ErrorKind.POLICY_VIOLATION),

    FORBIDDEN(ErrorKind.UNAUTHORIZED),

    PAYMENT_PROVIDER_FAILURE(ErrorKind.EXTERNAL_PROVIDER),

    INVALID_INPUT(ErrorKind.VALIDATION),
    EMPTY_BUNDLE(ErrorKind.VALIDATION);

    private final ErrorKind kind;

    BillingError(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
