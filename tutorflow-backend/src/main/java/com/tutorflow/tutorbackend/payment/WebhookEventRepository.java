package com.tutorflow.tutorbackend.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

public interface WebhookEventRepository extends JpaRepository<WebhookEvent, Long> {

    Optional<WebhookEvent> findByProviderAndEventId(String provider, String eventId);

    // Atomically claims a failed or abandoned event for another attempt; 0 means it is done or someone else holds it
    @Transactional
    @Modifying
    @Query("UPDATE WebhookEvent e SET e.status = com.tutorflow.tutorbackend.payment.WebhookEventStatus.PENDING, "
            + "e.error = null, e.claimedAt = :now "
            + "WHERE e.id = :id AND (e.status = com.tutorflow.tutorbackend.payment.WebhookEventStatus.FAILED "
            + "OR (e.status = com.tutorflow.tutorbackend.payment.WebhookEventStatus.PENDING "
            + "AND COALESCE(e.claimedAt, e.createdAt) < :staleBefore))")
    int reclaim(@Param("id") Long id, @Param("now") Instant now, @Param("staleBefore") Instant staleBefore);
}
