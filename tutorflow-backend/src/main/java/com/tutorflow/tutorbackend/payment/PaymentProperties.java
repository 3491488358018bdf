package com.tutorflow.tutorbackend.payment;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Payment provider config, bound once at start-up.
 *
 * provider: "test" (local simulated payments) or "stripe".
 * webhookToken: when set, provider callbacks must echo it in the X-Webhook-Token header.
 */
@ConfigurationProperties(prefix = "app.payments")
public record PaymentProperties(
        String provider,
        String currency,
        String successUrl,
        String cancelUrl,
        String stripeApiBase,
        String stripeSecretKey,
        String webhookToken
) {
    public PaymentProperties {
        if (provider == null || provider.isBlank()) provider = "test";
        if (currency == null || currency.isBlank()) currency = "usd";
        if (stripeApiBase == null || stripeApiBase.isBlank()) stripeApiBase = "https://api.stripe.com";
    }

    public boolean webhookTokenRequired() {
        return webhookToken != null && !webhookToken.isBlank();
    }
}
