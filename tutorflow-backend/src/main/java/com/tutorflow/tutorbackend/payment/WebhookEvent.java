package com.tutorflow.tutorbackend.payment;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * One row per provider event ever received. The (provider, event_id) unique key is what makes
 * webhook handling at-most-once.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(uniqueConstraints = @UniqueConstraint(name = "uk_webhook_provider_event", columnNames = {"provider", "event_id"}))
public class WebhookEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 16)
    private String provider;

    @Column(name = "event_id", nullable = false, length = 255)
    private String eventId;

    @Column(nullable = false, length = 128)
    private String eventType;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WebhookEventStatus status = WebhookEventStatus.PENDING;

    @Column(length = 1024)
    private String error;

    @Column(nullable = false)
    private Instant createdAt;

    // Start of the current processing attempt; a PENDING row whose claim is too old was abandoned
    private Instant claimedAt;

    private Instant processedAt;
}
