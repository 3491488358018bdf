package com.tutorflow.tutorbackend.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Simulated provider for local development and tests. Sessions need no redirect and are settled
 * through the local confirm endpoint; refunds always succeed.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.payments.provider", havingValue = "test", matchIfMissing = true)
public class LocalPaymentGateway implements PaymentGateway {

    public static final String NAME = "test";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PaymentSession createCheckoutSession(PaymentSessionRequest request) {
        String sessionId = "local_" + UUID.randomUUID();
        log.info("Simulated checkout session {} for {} {} (metadata={})",
                sessionId, request.amountMinor(), request.currency(), request.metadata());
        return new PaymentSession(NAME, sessionId, null, false);
    }

    @Override
    public ProviderRefund refund(RefundCommand command) {
        String refundId = "local_re_" + UUID.randomUUID();
        log.info("Simulated refund {} of {} {} against {}",
                refundId, command.amountMinor(), command.currency(), command.paymentReference());
        return new ProviderRefund(refundId, "succeeded");
    }

    @Override
    public boolean isLocal() {
        return true;
    }
}
