package com.tutorflow.tutorbackend.revenue.dto;

import com.tutorflow.tutorbackend.revenue.Payout;

import java.math.BigDecimal;
import java.time.Instant;

public record PayoutDto(
        Long id,
        Long instructorId,
        BigDecimal amount,
        String currency,
        String method,
        String status,
        String transactionId,
        String failureReason,
        Instant createdAt,
        Instant processedAt
) {
    public static PayoutDto from(Payout p) {
        return new PayoutDto(
                p.getId(),
                p.getInstructor().getId(),
                p.getAmount(),
                p.getCurrency(),
                p.getMethod(),
                p.getStatus().name(),
                p.getTransactionId(),
                p.getFailureReason(),
                p.getCreatedAt(),
                p.getProcessedAt()
        );
    }
}
