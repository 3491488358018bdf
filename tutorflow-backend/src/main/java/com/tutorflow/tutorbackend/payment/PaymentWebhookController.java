package com.tutorflow.tutorbackend.payment;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/payments/webhook")
@RequiredArgsConstructor
public class PaymentWebhookController {

    private final PaymentWebhookService webhookService;
    private final PaymentProperties paymentProperties;

    @PostMapping
    public ResponseEntity<Map<String, String>> receive(
            @RequestBody JsonNode payload,
            @RequestHeader(value = "X-Webhook-Token", required = false) String token) {

        if (paymentProperties.webhookTokenRequired() && !paymentProperties.webhookToken().equals(token)) {
            log.warn("Webhook rejected: bad token");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("status", "denied"));
        }

        ProviderEvent event;
        try {
            event = ProviderEvent.parse(payload);
        } catch (IllegalArgumentException ex) {
            log.warn("Malformed webhook payload: {}", ex.getMessage());
            return ResponseEntity.badRequest().body(Map.of("status", "malformed"));
        }

        try {
            WebhookOutcome outcome = webhookService.receive(event, payload.toString());
            return ResponseEntity.ok(Map.of("status", outcome.name().toLowerCase()));
        } catch (RuntimeException ex) {
            // already logged and recorded as FAILED; a 5xx makes the provider redeliver
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("status", "retry"));
        }
    }
}
