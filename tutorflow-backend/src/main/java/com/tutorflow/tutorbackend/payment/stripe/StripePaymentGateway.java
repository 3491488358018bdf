package com.tutorflow.tutorbackend.payment.stripe;

import com.tutorflow.tutorbackend.payment.PaymentGateway;
import com.tutorflow.tutorbackend.payment.PaymentGatewayException;
import com.tutorflow.tutorbackend.payment.PaymentProperties;
import com.tutorflow.tutorbackend.payment.PaymentSession;
import com.tutorflow.tutorbackend.payment.PaymentSessionRequest;
import com.tutorflow.tutorbackend.payment.ProviderRefund;
import com.tutorflow.tutorbackend.payment.RefundCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Stripe REST client. Checkout Sessions for payments and subscriptions, Refunds for money back.
 * Requests are form-encoded as the Stripe API expects.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.payments.provider", havingValue = "stripe")
public class StripePaymentGateway implements PaymentGateway {

    public static final String NAME = "stripe";
    private static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final RestClient restClient;
    private final PaymentProperties props;

    public StripePaymentGateway(RestClient.Builder builder, PaymentProperties props) {
        if (props.stripeSecretKey() == null || props.stripeSecretKey().isBlank()) {
            throw new IllegalStateException("app.payments.stripe-secret-key must be set when provider=stripe");
        }
        this.props = props;
        this.restClient = builder
                .baseUrl(props.stripeApiBase())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.stripeSecretKey())
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PaymentSession createCheckoutSession(PaymentSessionRequest request) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("mode", request.isSubscription() ? "subscription" : "payment");
        form.add("success_url", props.successUrl() + "?session_id={CHECKOUT_SESSION_ID}");
        form.add("cancel_url", props.cancelUrl());
        if (request.customerEmail() != null) {
            form.add("customer_email", request.customerEmail());
        }

        int i = 0;
        for (PaymentSessionRequest.LineItem item : request.lineItems()) {
            String prefix = "line_items[" + i++ + "]";
            form.add(prefix + "[quantity]", String.valueOf(item.quantity()));
            form.add(prefix + "[price_data][currency]", request.currency());
            form.add(prefix + "[price_data][unit_amount]", String.valueOf(item.unitAmountMinor()));
            form.add(prefix + "[price_data][product_data][name]", item.name());
            if (request.isSubscription()) {
                form.add(prefix + "[price_data][recurring][interval]", request.recurringInterval());
            }
        }

        request.metadata().forEach((k, v) -> {
            form.add("metadata[" + k + "]", v);
            // payment intents and subscriptions get their own copy so later webhooks can be correlated
            if (request.isSubscription()) {
                form.add("subscription_data[metadata][" + k + "]", v);
            } else {
                form.add("payment_intent_data[metadata][" + k + "]", v);
            }
        });

        Map<?, ?> response = post("/v1/checkout/sessions", form, null);
        String id = (String) response.get("id");
        if (id == null) {
            throw new PaymentGatewayException("Stripe returned a checkout session without id");
        }
        log.info("Stripe checkout session {} created ({} {})", id, request.amountMinor(), request.currency());
        return new PaymentSession(NAME, id, (String) response.get("url"), true);
    }

    @Override
    public ProviderRefund refund(RefundCommand command) {
        if (command.paymentReference() == null || command.paymentReference().isBlank()) {
            throw new PaymentGatewayException("No payment reference to refund against");
        }
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("payment_intent", command.paymentReference());
        form.add("amount", String.valueOf(command.amountMinor()));
        command.metadata().forEach((k, v) -> form.add("metadata[" + k + "]", v));

        Map<?, ?> response = post("/v1/refunds", form, command.idempotencyKey());
        String id = (String) response.get("id");
        if (id == null) {
            throw new PaymentGatewayException("Stripe returned a refund without id");
        }
        return new ProviderRefund(id, (String) response.get("status"));
    }

    private Map<?, ?> post(String path, MultiValueMap<String, String> form, String idempotencyKey) {
        try {
            Map<?, ?> response = restClient.post()
                    .uri(path)
                    .headers(h -> {
                        if (idempotencyKey != null) {
                            h.set(IDEMPOTENCY_HEADER, idempotencyKey);
                        }
                    })
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(Map.class);
            if (response == null) {
                throw new PaymentGatewayException("Empty response from Stripe " + path);
            }
            return response;
        } catch (RestClientException e) {
            throw new PaymentGatewayException("Stripe call " + path + " failed: " + e.getMessage(), e);
        }
    }
}
