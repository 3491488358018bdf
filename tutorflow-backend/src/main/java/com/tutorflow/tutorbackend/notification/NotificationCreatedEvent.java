package com.tutorflow.tutorbackend.notification;

import com.tutorflow.tutorbackend.notification.dto.NotificationDto;

/** Published inside the creating transaction, delivered once it commits. */
public record NotificationCreatedEvent(Long recipientId, NotificationDto notification) {
}
