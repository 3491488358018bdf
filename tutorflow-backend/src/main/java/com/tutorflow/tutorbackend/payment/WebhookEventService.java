package com.tutorflow.tutorbackend.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Idempotency layer backed by the (provider, event_id) unique constraint.
 * {@link #tryStart} returns empty when the event was already seen and must not be processed again.
 * Events that previously FAILED are handed out once more so provider redelivery can complete them,
 * and so are PENDING events whose claim is older than {@link #CLAIM_LEASE} (the process died or a
 * handler threw an {@link Error} before the outcome was recorded). Each call commits on its own so
 * the log survives a failing handler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookEventService {

    static final Duration CLAIM_LEASE = Duration.ofMinutes(5);

    private final WebhookEventRepository events;
    private final Clock clock;

    public Optional<WebhookEvent> tryStart(String provider, String eventId, String eventType, String payloadJson) {
        Optional<WebhookEvent> existing = events.findByProviderAndEventId(provider, eventId);
        if (existing.isPresent()) {
            return reclaim(existing.get());
        }

        WebhookEvent e = new WebhookEvent();
        e.setProvider(provider);
        e.setEventId(eventId);
        e.setEventType(eventType);
        e.setPayload(payloadJson);
        e.setStatus(WebhookEventStatus.PENDING);
        Instant now = Instant.now(clock);
        e.setCreatedAt(now);
        e.setClaimedAt(now);
        try {
            return Optional.of(events.saveAndFlush(e));
        } catch (DataIntegrityViolationException dup) {
            log.info("Concurrent delivery of {} event {} already recorded", provider, eventId);
            return Optional.empty();
        }
    }

    private Optional<WebhookEvent> reclaim(WebhookEvent event) {
        if (event.getStatus() == WebhookEventStatus.PROCESSED) {
            return Optional.empty();
        }
        Instant now = Instant.now(clock);
        if (events.reclaim(event.getId(), now, now.minus(CLAIM_LEASE)) == 0) {
            // processed meanwhile, or another delivery is still within its lease
            return Optional.empty();
        }
        if (event.getStatus() == WebhookEventStatus.FAILED) {
            log.info("Retrying previously failed {} event {}", event.getProvider(), event.getEventId());
        } else {
            log.warn("Reclaiming {} event {} abandoned since {}", event.getProvider(), event.getEventId(),
                    event.getClaimedAt() != null ? event.getClaimedAt() : event.getCreatedAt());
        }
        event.setStatus(WebhookEventStatus.PENDING);
        event.setError(null);
        event.setClaimedAt(now);
        return Optional.of(event);
    }

    public void markProcessed(Long rowId) {
        events.findById(rowId).ifPresent(e -> {
            e.setStatus(WebhookEventStatus.PROCESSED);
            e.setProcessedAt(Instant.now(clock));
            events.save(e);
        });
    }

    public void markFailed(Long rowId, String error) {
        events.findById(rowId).ifPresent(e -> {
            e.setStatus(WebhookEventStatus.FAILED);
            e.setError(error == null ? null : error.substring(0, Math.min(error.length(), 1024)));
            e.setProcessedAt(Instant.now(clock));
            events.save(e);
        });
    }
}
