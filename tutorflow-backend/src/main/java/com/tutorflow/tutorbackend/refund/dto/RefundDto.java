package com.tutorflow.tutorbackend.refund.dto;

import com.tutorflow.tutorbackend.refund.Refund;

import java.math.BigDecimal;
import java.time.Instant;

public record RefundDto(
        Long id,
        String orderNumber,
        Long userId,
        BigDecimal amount,
        String reason,
        String description,
        String status,
        String adminNotes,
        Instant processedAt,
        String providerRefundId,
        Instant settledAt,
        Instant createdAt
) {
    public static RefundDto from(Refund r) {
        return new RefundDto(
                r.getId(),
                r.getOrder().getOrderNumber(),
                r.getUser().getId(),
                r.getAmount(),
                r.getReason().name(),
                r.getDescription(),
                r.getStatus().name(),
                r.getAdminNotes(),
                r.getProcessedAt(),
                r.getProviderRefundId(),
                r.getSettledAt(),
                r.getCreatedAt()
        );
    }
}
