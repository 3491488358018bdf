package com.tutorflow.tutorbackend.payment;

/**
 * Consumer of provider events. Handlers must be idempotent: an event may arrive more than once,
 * out of order, or be retried after an earlier failure.
 */
public interface PaymentEventHandler {

    boolean supports(String eventType);

    void handle(ProviderEvent event);
}
