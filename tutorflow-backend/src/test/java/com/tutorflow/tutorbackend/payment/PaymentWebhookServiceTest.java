package com.tutorflow.tutorbackend.payment;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class PaymentWebhookServiceTest {

    @Mock private WebhookEventService webhookEventService;
    @Mock private PaymentGateway paymentGateway;
    @Mock private PaymentEventHandler orderHandler;
    @Mock private PaymentEventHandler refundHandler;

    private PaymentWebhookService service;
    private ProviderEvent event;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        service = new PaymentWebhookService(webhookEventService, List.of(orderHandler, refundHandler), paymentGateway);
        when(paymentGateway.name()).thenReturn("stripe");
        when(orderHandler.supports("payment_intent.succeeded")).thenReturn(true);
        when(refundHandler.supports("charge.refunded")).thenReturn(true);

        event = ProviderEvent.parse(new ObjectMapper().readTree("""
                {"id":"evt_1","type":"payment_intent.succeeded","data":{"object":{"id":"pi_1"}}}
                """));
    }

    private WebhookEvent row() {
        WebhookEvent row = new WebhookEvent();
        row.setId(11L);
        return row;
    }

    @Test
    void newEventIsDispatchedToMatchingHandlers() {
        when(webhookEventService.tryStart(eq("stripe"), eq("evt_1"), eq("payment_intent.succeeded"), anyString()))
                .thenReturn(Optional.of(row()));

        assertEquals(WebhookOutcome.PROCESSED, service.receive(event, "{}"));

        verify(orderHandler).handle(event);
        verify(refundHandler, never()).handle(any());
        verify(webhookEventService).markProcessed(11L);
    }

    @Test
    void redeliveredEventIsAcknowledgedOnly() {
        when(webhookEventService.tryStart(any(), any(), any(), any())).thenReturn(Optional.empty());

        assertEquals(WebhookOutcome.DUPLICATE, service.receive(event, "{}"));

        verify(orderHandler, never()).handle(any());
        verify(webhookEventService, never()).markProcessed(any());
    }

    @Test
    void unknownTypeIsRecordedAndIgnored() throws Exception {
        ProviderEvent other = ProviderEvent.parse(new ObjectMapper().readTree("""
                {"id":"evt_2","type":"customer.created","data":{"object":{"id":"cus_1"}}}
                """));
        when(webhookEventService.tryStart(any(), any(), any(), any())).thenReturn(Optional.of(row()));

        assertEquals(WebhookOutcome.IGNORED, service.receive(other, "{}"));
        verify(webhookEventService).markProcessed(11L);
    }

    @Test
    void handlerFailureMarksEventFailedAndRethrows() {
        when(webhookEventService.tryStart(any(), any(), any(), any())).thenReturn(Optional.of(row()));
        doThrow(new IllegalStateException("db down")).when(orderHandler).handle(event);

        assertThrows(IllegalStateException.class, () -> service.receive(event, "{}"));

        verify(webhookEventService).markFailed(11L, "db down");
        verify(webhookEventService, never()).markProcessed(any());
    }
}
