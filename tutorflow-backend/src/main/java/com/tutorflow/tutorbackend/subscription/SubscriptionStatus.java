package com.tutorflow.tutorbackend.subscription;

import java.util.List;

public enum SubscriptionStatus {
    TRIALING,
    ACTIVE,
    PAST_DUE,
    CANCELED,
    EXPIRED;

    public boolean isTerminal() {
        return this == CANCELED || this == EXPIRED;
    }

    public static final List<SubscriptionStatus> LIVE = List.of(TRIALING, ACTIVE, PAST_DUE);
}
