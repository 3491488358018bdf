package com.tutorflow.tutorbackend.notification.dto;

import com.tutorflow.tutorbackend.notification.Notification;

import java.time.Instant;

public record NotificationDto(
        Long id,
        String type,
        String relatedType,
        Long referenceId,
        String title,
        String message,
        boolean read,
        Instant createdAt
) {
    public static NotificationDto from(Notification n) {
        return new NotificationDto(
                n.getId(),
                n.getType().name(),
                n.getRelatedType() == null ? null : n.getRelatedType().name(),
                n.getReferenceId(),
                n.getTitle(),
                n.getMessage(),
                n.isRead(),
                n.getCreatedAt()
        );
    }
}
