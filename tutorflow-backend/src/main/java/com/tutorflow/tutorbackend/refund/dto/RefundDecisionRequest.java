package com.tutorflow.tutorbackend.refund.dto;

import jakarta.validation.constraints.Size;

public record RefundDecisionRequest(@Size(max = 2000) String notes) {}
