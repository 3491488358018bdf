package com.tutorflow.tutorbackend.bundle.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record BundleCreateRequest(
        @NotBlank @Size(max = 200) String title,
        @Size(max = 4000) String description,
        List<Long> courseIds,
        @NotNull BigDecimal discountPercent,
        Instant startDate,
        Instant endDate,
        @Min(1) Integer maxPurchases
) {}
