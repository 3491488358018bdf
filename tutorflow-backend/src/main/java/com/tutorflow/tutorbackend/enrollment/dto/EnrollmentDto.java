package com.tutorflow.tutorbackend.enrollment.dto;

import com.tutorflow.tutorbackend.enrollment.Enrollment;

import java.time.Instant;

public record EnrollmentDto(
        Long id,
        Long courseId,
        String courseTitle,
        String courseSlug,
        String status,
        int progressPercent,
        String orderNumber,
        Instant enrolledAt,
        Instant revokedAt
) {
    public static EnrollmentDto from(Enrollment e) {
        return new EnrollmentDto(
                e.getId(),
                e.getCourse().getId(),
                e.getCourse().getTitle(),
                e.getCourse().getSlug(),
                e.getStatus().name(),
                e.getProgressPercent(),
                e.getOrder() != null ? e.getOrder().getOrderNumber() : null,
                e.getEnrolledAt(),
                e.getRevokedAt()
        );
    }
}
