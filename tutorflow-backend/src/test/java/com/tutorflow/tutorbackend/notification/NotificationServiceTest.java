package com.tutorflow.tutorbackend.notification;

import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static com.tutorflow.tutorbackend.util.TestFixtures.student;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class NotificationServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock private NotificationRepository repository;
    @Mock private ApplicationEventPublisher eventPublisher;

    private NotificationService service;
    private User user;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service = new NotificationService(repository, eventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
        user = student(1L);
        when(repository.save(any(Notification.class))).thenAnswer(i -> {
            Notification n = i.getArgument(0);
            n.setId(99L);
            return n;
        });
    }

    @Test
    void notifyStoresAndPublishes() {
        Notification n = service.notify(user, NotificationType.REFUND, RelatedType.REFUND, 3L, "Refund sent", "on its way");

        assertEquals(NOW, n.getCreatedAt());
        assertFalse(n.isRead());
        ArgumentCaptor<NotificationCreatedEvent> event = ArgumentCaptor.forClass(NotificationCreatedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertEquals(1L, event.getValue().recipientId());
        assertEquals(99L, event.getValue().notification().id());
        assertEquals("REFUND", event.getValue().notification().type());
    }

    @Test
    void markAsReadRejectsOtherUsersNotification() {
        Notification n = new Notification();
        n.setId(5L);
        n.setRecipient(student(2L));
        when(repository.findById(5L)).thenReturn(Optional.of(n));

        BillingException e = assertThrows(BillingException.class, () -> service.markAsRead(5L, user));

        assertEquals(BillingError.FORBIDDEN, e.getError());
        assertFalse(n.isRead());
    }

    @Test
    void markAsReadStampsTime() {
        Notification n = new Notification();
        n.setId(5L);
        n.setRecipient(user);
        when(repository.findById(5L)).thenReturn(Optional.of(n));

        service.markAsRead(5L, user);

        assertTrue(n.isRead());
        assertEquals(NOW, n.getReadAt());
    }
}
