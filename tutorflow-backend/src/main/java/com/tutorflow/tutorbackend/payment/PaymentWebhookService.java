package com.tutorflow.tutorbackend.payment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentWebhookService {

    private final WebhookEventService webhookEventService;
    private final List<PaymentEventHandler> handlers;
    private final PaymentGateway paymentGateway;

    /**
     * Records the event and dispatches it to every handler that supports its type.
     * A handler failure marks the event FAILED and is rethrown so the provider redelivers it.
     */
    public WebhookOutcome receive(ProviderEvent event, String rawPayload) {
        String provider = paymentGateway.name();

        Optional<WebhookEvent> started = webhookEventService.tryStart(provider, event.id(), event.type(), rawPayload);
        if (started.isEmpty()) {
            log.info("Duplicate {} event {} ({}) acknowledged without reprocessing", provider, event.id(), event.type());
            return WebhookOutcome.DUPLICATE;
        }
        Long rowId = started.get().getId();

        List<PaymentEventHandler> matching = handlers.stream()
                .filter(h -> h.supports(event.type()))
                .toList();
        if (matching.isEmpty()) {
            log.debug("Ignoring unhandled event type {}", event.type());
            webhookEventService.markProcessed(rowId);
            return WebhookOutcome.IGNORED;
        }

        try {
            for (PaymentEventHandler handler : matching) {
                handler.handle(event);
            }
        } catch (RuntimeException ex) {
            log.error("Handling {} event {} ({}) failed", provider, event.id(), event.type(), ex);
            webhookEventService.markFailed(rowId, ex.getMessage());
            throw ex;
        }

        webhookEventService.markProcessed(rowId);
        log.info("Processed {} event {} ({})", provider, event.id(), event.type());
        return WebhookOutcome.PROCESSED;
    }
}
