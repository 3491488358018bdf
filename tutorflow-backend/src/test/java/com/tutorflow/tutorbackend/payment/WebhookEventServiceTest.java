package com.tutorflow.tutorbackend.payment;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class WebhookEventServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private WebhookEventRepository events;

    private WebhookEventService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new WebhookEventService(events, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private WebhookEvent stored(WebhookEventStatus status) {
        WebhookEvent e = new WebhookEvent();
        e.setId(4L);
        e.setProvider("stripe");
        e.setEventId("evt_1");
        e.setStatus(status);
        when(events.findByProviderAndEventId("stripe", "evt_1")).thenReturn(Optional.of(e));
        when(events.findById(4L)).thenReturn(Optional.of(e));
        return e;
    }

    @Test
    void firstDeliveryIsRecordedPending() {
        when(events.saveAndFlush(any(WebhookEvent.class))).thenAnswer(i -> i.getArgument(0));

        Optional<WebhookEvent> started = service.tryStart("stripe", "evt_1", "invoice.paid", "{}");

        assertTrue(started.isPresent());
        assertEquals(WebhookEventStatus.PENDING, started.get().getStatus());
        assertEquals(NOW, started.get().getCreatedAt());
        assertEquals(NOW, started.get().getClaimedAt());
    }

    @Test
    void processedEventIsNotHandedOutAgain() {
        stored(WebhookEventStatus.PROCESSED);

        assertTrue(service.tryStart("stripe", "evt_1", "invoice.paid", "{}").isEmpty());
        verify(events, never()).saveAndFlush(any());
    }

    @Test
    void failedEventIsReclaimedOnce() {
        WebhookEvent e = stored(WebhookEventStatus.FAILED);
        e.setError("boom");
        when(events.reclaim(4L, NOW, NOW.minus(WebhookEventService.CLAIM_LEASE))).thenReturn(1, 0);

        Optional<WebhookEvent> first = service.tryStart("stripe", "evt_1", "invoice.paid", "{}");
        assertTrue(first.isPresent());
        assertNull(first.get().getError());

        e.setStatus(WebhookEventStatus.FAILED);
        assertTrue(service.tryStart("stripe", "evt_1", "invoice.paid", "{}").isEmpty());
    }

    @Test
    void abandonedPendingEventIsReclaimedAfterLease() {
        WebhookEvent e = stored(WebhookEventStatus.PENDING);
        e.setClaimedAt(NOW.minus(Duration.ofMinutes(30)));
        when(events.reclaim(4L, NOW, NOW.minus(WebhookEventService.CLAIM_LEASE))).thenReturn(1);

        Optional<WebhookEvent> started = service.tryStart("stripe", "evt_1", "payment_intent.succeeded", "{}");

        assertTrue(started.isPresent());
        assertEquals(WebhookEventStatus.PENDING, started.get().getStatus());
        assertEquals(NOW, started.get().getClaimedAt());
    }

    @Test
    void pendingEventWithinLeaseIsStillADuplicate() {
        WebhookEvent e = stored(WebhookEventStatus.PENDING);
        e.setClaimedAt(NOW.minusSeconds(20));
        when(events.reclaim(4L, NOW, NOW.minus(WebhookEventService.CLAIM_LEASE))).thenReturn(0);

        assertTrue(service.tryStart("stripe", "evt_1", "payment_intent.succeeded", "{}").isEmpty());
    }

    @Test
    void processedEventIsNeverReclaimed() {
        stored(WebhookEventStatus.PROCESSED);

        service.tryStart("stripe", "evt_1", "invoice.paid", "{}");

        verify(events, never()).reclaim(any(), any(), any());
    }

    @Test
    void concurrentInsertCountsAsDuplicate() {
        when(events.saveAndFlush(any(WebhookEvent.class))).thenThrow(new DataIntegrityViolationException("uk_webhook_provider_event"));

        assertTrue(service.tryStart("stripe", "evt_9", "invoice.paid", "{}").isEmpty());
    }

    @Test
    void failureReasonIsTruncated() {
        WebhookEvent e = stored(WebhookEventStatus.PENDING);

        service.markFailed(4L, "x".repeat(2000));

        assertEquals(WebhookEventStatus.FAILED, e.getStatus());
        assertEquals(1024, e.getError().length());
        assertEquals(NOW, e.getProcessedAt());
    }
}
