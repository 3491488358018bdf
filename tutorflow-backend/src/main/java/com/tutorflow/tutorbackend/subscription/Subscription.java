package com.tutorflow.tutorbackend.subscription;

import com.tutorflow.tutorbackend.user.User;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "subscriptions")
@Getter
@Setter
@NoArgsConstructor
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "plan_id", nullable = false)
    private SubscriptionPlan plan;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SubscriptionStatus status;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private BillingInterval billingInterval;

    // price at the time of sale; plan price changes do not touch it
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(nullable = false)
    private Instant currentPeriodStart;

    @Column(nullable = false)
    private Instant currentPeriodEnd;

    private boolean cancelAtPeriodEnd = false;
    private Instant canceledAt;
    private Instant trialEnd;
    private Instant endedAt;

    @Column(length = 32)
    private String paymentProvider;

    @Column(unique = true)
    private String providerSubscriptionId;

    private Instant lastProviderEventAt;

    // user id while live, null once terminal; unique so a user can hold one live subscription
    @Column(unique = true)
    private Long liveUserId;

    @Column(nullable = false)
    private Instant createdAt;

    public boolean isLive() {
        return !status.isTerminal();
    }
}
