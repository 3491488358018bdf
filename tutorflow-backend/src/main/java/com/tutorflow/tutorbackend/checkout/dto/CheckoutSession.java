package com.tutorflow.tutorbackend.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutSession {
    private String orderNumber;
    private String provider;          // "test", "stripe", or "free" for zero-total orders
    private String sessionId;         // provider checkout session id
    private String paymentUrl;        // hosted payment page, null for local/free
    private boolean requiresRedirect; // whether the frontend should open paymentUrl
    private BigDecimal total;
    private String currency;
    private String status;            // order status after this call
}
