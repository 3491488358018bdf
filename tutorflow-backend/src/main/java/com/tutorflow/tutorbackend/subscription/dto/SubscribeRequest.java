package com.tutorflow.tutorbackend.subscription.dto;

import com.tutorflow.tutorbackend.subscription.BillingInterval;
import jakarta.validation.constraints.NotBlank;

public record SubscribeRequest(
        @NotBlank String planSlug,
        BillingInterval interval // MONTHLY when omitted
) {}
