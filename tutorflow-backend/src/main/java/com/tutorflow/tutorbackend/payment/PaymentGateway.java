package com.tutorflow.tutorbackend.payment;

/**
 * Client handle for the external payment provider. Exactly one implementation is active,
 * chosen by {@code app.payments.provider}. Implementations throw {@link PaymentGatewayException}
 * on any provider-side failure; they never return a partial result.
 */
public interface PaymentGateway {

    String name();

    PaymentSession createCheckoutSession(PaymentSessionRequest request);

    ProviderRefund refund(RefundCommand command);

    default boolean isLocal() {
        return false;
    }
}
