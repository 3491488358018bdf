package com.tutorflow.tutorbackend.subscription.dto;

import jakarta.validation.constraints.NotBlank;

public record ChangePlanRequest(@NotBlank String planSlug) {}
