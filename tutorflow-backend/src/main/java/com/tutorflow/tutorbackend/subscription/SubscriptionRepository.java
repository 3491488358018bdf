package com.tutorflow.tutorbackend.subscription;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    Optional<Subscription> findByLiveUserId(Long userId);

    boolean existsByLiveUserId(Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Subscription s WHERE s.liveUserId = :userId")
    Optional<Subscription> findLiveForUpdate(@Param("userId") Long userId);

    List<Subscription> findByUser_IdOrderByCreatedAtDesc(Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Subscription s WHERE s.providerSubscriptionId = :providerId")
    Optional<Subscription> findByProviderSubscriptionIdForUpdate(@Param("providerId") String providerSubscriptionId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Subscription s WHERE s.id = :id")
    Optional<Subscription> findByIdForUpdate(@Param("id") Long id);

    List<Subscription> findByCancelAtPeriodEndTrueAndStatusInAndCurrentPeriodEndLessThanEqual(
            Collection<SubscriptionStatus> statuses, Instant cutoff);
}
