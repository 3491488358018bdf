package com.tutorflow.tutorbackend.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * Fans a committed notification out to every channel. Each channel gets its own job on the
 * bounded notification executor, so a slow or failing channel never holds up the others or the
 * request that produced the notification.
 */
@Slf4j
@Component
public class NotificationDispatcher {

    private final List<NotificationChannel> channels;
    private final TaskExecutor executor;

    public NotificationDispatcher(List<NotificationChannel> channels,
                                  @Qualifier("notificationExecutor") TaskExecutor executor) {
        this.channels = channels;
        this.executor = executor;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onCreated(NotificationCreatedEvent event) {
        for (NotificationChannel channel : channels) {
            try {
                executor.execute(() -> deliver(channel, event));
            } catch (TaskRejectedException e) {
                log.warn("Notification queue full, dropping {} delivery of notification {} for user {}",
                        channel.name(), event.notification().id(), event.recipientId());
            }
        }
    }

    private void deliver(NotificationChannel channel, NotificationCreatedEvent event) {
        try {
            channel.deliver(event.recipientId(), event.notification());
        } catch (RuntimeException e) {
            log.warn("Channel {} failed to deliver notification {} to user {}",
                    channel.name(), event.notification().id(), event.recipientId(), e);
        }
    }
}
