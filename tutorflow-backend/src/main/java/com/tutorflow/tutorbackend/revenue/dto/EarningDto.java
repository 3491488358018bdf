package com.tutorflow.tutorbackend.revenue.dto;

import com.tutorflow.tutorbackend.revenue.InstructorEarning;

import java.math.BigDecimal;
import java.time.Instant;

public record EarningDto(
        Long id,
        String orderNumber,
        Long courseId,
        String courseTitle,
        BigDecimal amount,
        BigDecimal platformFee,
        String status,
        Instant createdAt,
        Instant availableAt,
        Instant paidAt
) {
    public static EarningDto from(InstructorEarning e) {
        return new EarningDto(
                e.getId(),
                e.getOrderItem().getOrder().getOrderNumber(),
                e.getOrderItem().getCourse().getId(),
                e.getOrderItem().getCourse().getTitle(),
                e.getAmount(),
                e.getPlatformFee(),
                e.getStatus().name(),
                e.getCreatedAt(),
                e.getAvailableAt(),
                e.getPaidAt()
        );
    }
}
