package com.tutorflow.tutorbackend.payment.stripe;

import com.tutorflow.tutorbackend.payment.PaymentGatewayException;
import com.tutorflow.tutorbackend.payment.PaymentProperties;
import com.tutorflow.tutorbackend.payment.PaymentSession;
import com.tutorflow.tutorbackend.payment.PaymentSessionRequest;
import com.tutorflow.tutorbackend.payment.ProviderRefund;
import com.tutorflow.tutorbackend.payment.RefundCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class StripePaymentGatewayTest {

    private MockRestServiceServer server;
    private StripePaymentGateway gateway;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        PaymentProperties props = new PaymentProperties("stripe", "usd", "https://app.example/success",
                "https://app.example/cancel", "https://stripe.test", "sk_test_123", null);
        gateway = new StripePaymentGateway(builder, props);
    }

    @Test
    void checkoutSessionIsFormEncodedWithMetadata() {
        server.expect(requestTo("https://stripe.test/v1/checkout/sessions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk_test_123"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andExpect(content().string(containsString("mode=payment")))
                .andExpect(content().string(containsString("metadata%5Border_number%5D=ORD-1")))
                .andRespond(withSuccess("{\"id\":\"cs_1\",\"url\":\"https://checkout.stripe.test/cs_1\"}",
                        MediaType.APPLICATION_JSON));

        PaymentSession session = gateway.createCheckoutSession(new PaymentSessionRequest(
                4999, "usd", List.of(new PaymentSessionRequest.LineItem("Java 101", 4999, 1)),
                "buyer@tutorflow.test", Map.of("order_number", "ORD-1"), null));

        assertEquals("cs_1", session.sessionId());
        assertEquals("https://checkout.stripe.test/cs_1", session.paymentUrl());
        assertTrue(session.requiresRedirect());
        server.verify();
    }

    @Test
    void refundReturnsProviderId() {
        server.expect(requestTo("https://stripe.test/v1/refunds"))
                .andExpect(header("Idempotency-Key", "refund-7"))
                .andExpect(content().string(containsString("payment_intent=pi_1")))
                .andRespond(withSuccess("{\"id\":\"re_1\",\"status\":\"succeeded\"}", MediaType.APPLICATION_JSON));

        ProviderRefund refund = gateway.refund(new RefundCommand("pi_1", 1000, "usd", Map.of("refund_id", "7"), "refund-7"));

        assertEquals("re_1", refund.refundId());
        assertEquals("succeeded", refund.status());
    }

    @Test
    void serverErrorBecomesGatewayException() {
        server.expect(requestTo("https://stripe.test/v1/refunds")).andRespond(withServerError());

        assertThrows(PaymentGatewayException.class,
                () -> gateway.refund(new RefundCommand("pi_1", 1000, "usd", Map.of(), "refund-8")));
    }

    @Test
    void missingSecretKeyFailsFast() {
        PaymentProperties props = new PaymentProperties("stripe", "usd", null, null, null, " ", null);

        assertThrows(IllegalStateException.class, () -> new StripePaymentGateway(RestClient.builder(), props));
    }
}
