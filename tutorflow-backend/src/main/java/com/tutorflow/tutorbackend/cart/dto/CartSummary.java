package com.tutorflow.tutorbackend.cart.dto;

import java.math.BigDecimal;
import java.util.List;

public record CartSummary(
        String sessionId,
        List<CartLine> items,
        int itemCount,
        BigDecimal subtotal,
        BigDecimal discount,
        BigDecimal total,
        String currency
) {}
