package com.tutorflow.tutorbackend.notification;

import com.tutorflow.tutorbackend.notification.dto.NotificationDto;

/**
 * A way of getting a stored notification in front of its recipient. Implementations run on the
 * notification executor and may throw; the dispatcher logs and moves on.
 */
public interface NotificationChannel {

    String name();

    void deliver(Long recipientId, NotificationDto notification);
}
