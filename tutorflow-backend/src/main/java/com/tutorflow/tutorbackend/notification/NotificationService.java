package com.tutorflow.tutorbackend.notification;

import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.notification.dto.NotificationDto;
import com.tutorflow.tutorbackend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository repository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Stores a notification and schedules its delivery. Delivery happens after the surrounding
     * transaction commits, so a rolled back purchase never notifies anyone.
     */
    @Transactional
    public Notification notify(User recipient, NotificationType type, RelatedType relatedType,
                               Long referenceId, String title, String message) {
        Notification n = new Notification();
        n.setRecipient(recipient);
        n.setType(type);
        n.setRelatedType(relatedType);
        n.setReferenceId(referenceId);
        n.setTitle(title);
        n.setMessage(message);
        n.setCreatedAt(Instant.now(clock));
        n = repository.save(n);

        eventPublisher.publishEvent(new NotificationCreatedEvent(recipient.getId(), NotificationDto.from(n)));
        log.debug("Notification {} ({}) queued for user {}", n.getId(), type, recipient.getId());
        return n;
    }

    @Transactional(readOnly = true)
    public Page<NotificationDto> getUnread(User user, int page, int size) {
        return repository.findByRecipientAndReadFalseOrderByCreatedAtDesc(user, PageRequest.of(page, size))
                .map(NotificationDto::from);
    }

    @Transactional(readOnly = true)
    public Page<NotificationDto> getAll(User user, int page, int size) {
        return repository.findByRecipientOrderByCreatedAtDesc(user, PageRequest.of(page, size))
                .map(NotificationDto::from);
    }

    @Transactional(readOnly = true)
    public long countUnread(User user) {
        return repository.countByRecipientAndReadFalse(user);
    }

    @Transactional
    public void markAsRead(Long id, User user) {
        Notification n = repository.findById(id)
                .orElseThrow(() -> BillingException.notFound("Notification"));
        if (!n.getRecipient().getId().equals(user.getId())) {
            throw BillingException.forbidden("Notification belongs to another user");
        }
        if (!n.isRead()) {
            n.setRead(true);
            n.setReadAt(Instant.now(clock));
        }
    }

    @Transactional
    public int markAllAsRead(User user) {
        return repository.markAllRead(user, Instant.now(clock));
    }
}
