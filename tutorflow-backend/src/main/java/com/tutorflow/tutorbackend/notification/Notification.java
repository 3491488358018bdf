package com.tutorflow.tutorbackend.notification;

import com.tutorflow.tutorbackend.user.User;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Data
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    private User recipient;

    @Column(nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private NotificationType type;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private RelatedType relatedType;

    private Long referenceId; // order id, subscription id, refund id, ...

    @Column(length = 128, nullable = false)
    private String title;

    @Column(length = 1024)
    private String message;

    @Column(name = "is_read", nullable = false)
    private boolean read = false;
    private Instant readAt;

    @Column(nullable = false)
    private Instant createdAt;
}
