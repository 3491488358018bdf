package com.tutorflow.tutorbackend.refund.dto;

import com.tutorflow.tutorbackend.refund.RefundReason;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RefundRequest(
        @NotBlank String orderNumber,
        @NotNull RefundReason reason,
        @Size(max = 2000) String description
) {}
