package com.tutorflow.tutorbackend.notification;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizing of the delivery executor. The queue is bounded; deliveries beyond it are dropped.
 */
@ConfigurationProperties(prefix = "app.notifications")
public record NotificationProperties(
        int corePoolSize,
        int maxPoolSize,
        int queueCapacity
) {
    public NotificationProperties {
        if (corePoolSize <= 0) corePoolSize = 2;
        if (maxPoolSize < corePoolSize) maxPoolSize = Math.max(corePoolSize, 4);
        if (queueCapacity <= 0) queueCapacity = 500;
    }
}
