package com.tutorflow.tutorbackend.cart.dto;

import java.math.BigDecimal;

public record CartLine(
        Long courseId,
        String title,
        String slug,
        BigDecimal price,
        BigDecimal effectivePrice,
        boolean available
) {}
