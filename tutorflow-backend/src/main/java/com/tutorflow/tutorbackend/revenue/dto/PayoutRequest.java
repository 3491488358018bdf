package com.tutorflow.tutorbackend.revenue.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record PayoutRequest(
        @NotNull BigDecimal amount,
        @Size(max = 32) String method
) {}
