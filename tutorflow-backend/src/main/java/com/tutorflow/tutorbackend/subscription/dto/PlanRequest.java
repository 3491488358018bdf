package com.tutorflow.tutorbackend.subscription.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.List;

public record PlanRequest(
        @NotBlank @Size(max = 120) String name,
        @Size(max = 2000) String description,
        @DecimalMin("0.00") BigDecimal monthlyPrice,
        @DecimalMin("0.00") BigDecimal yearlyPrice,
        List<String> features,
        @Min(1) Integer maxCourses,
        @Min(0) Integer trialDays,
        Integer priority,
        Boolean active
) {}
