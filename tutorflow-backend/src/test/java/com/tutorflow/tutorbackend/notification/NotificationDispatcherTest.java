package com.tutorflow.tutorbackend.notification;

import com.tutorflow.tutorbackend.notification.dto.NotificationDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class NotificationDispatcherTest {

    private NotificationChannel sse;
    private NotificationChannel email;
    private NotificationCreatedEvent event;

    @BeforeEach
    void setUp() {
        sse = mock(NotificationChannel.class);
        email = mock(NotificationChannel.class);
        when(sse.name()).thenReturn("sse");
        when(email.name()).thenReturn("email");
        NotificationDto dto = new NotificationDto(1L, "PURCHASE", "ORDER", 5L, "Purchase complete", "paid",
                false, Instant.parse("2024-03-01T10:00:00Z"));
        event = new NotificationCreatedEvent(7L, dto);
    }

    @Test
    void everyChannelReceivesTheNotification() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(sse, email), new SyncTaskExecutor());

        dispatcher.onCreated(event);

        verify(sse).deliver(7L, event.notification());
        verify(email).deliver(7L, event.notification());
    }

    @Test
    void failingChannelDoesNotStopTheOthers() {
        doThrow(new IllegalStateException("smtp down")).when(sse).deliver(any(), any());
        NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(sse, email), new SyncTaskExecutor());

        assertDoesNotThrow(() -> dispatcher.onCreated(event));

        verify(email).deliver(7L, event.notification());
    }

    @Test
    void fullQueueDropsDeliveryWithoutFailingCaller() {
        TaskExecutor saturated = task -> {
            throw new TaskRejectedException("queue full");
        };
        NotificationDispatcher dispatcher = new NotificationDispatcher(List.of(sse, email), saturated);

        assertDoesNotThrow(() -> dispatcher.onCreated(event));

        verify(sse, never()).deliver(any(), any());
        verify(email, never()).deliver(any(), any());
    }
}
