package com.tutorflow.tutorbackend.revenue;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Optional;

public interface PayoutRepository extends JpaRepository<Payout, Long> {

    @Query("""
            SELECT COALESCE(SUM(p.amount), 0)
            FROM Payout p
            WHERE p.instructor.id = :instructorId AND p.status IN :statuses
            """)
    BigDecimal sumAmount(@Param("instructorId") Long instructorId,
                         @Param("statuses") Collection<PayoutStatus> statuses);

    Page<Payout> findByInstructor_IdOrderByCreatedAtDesc(Long instructorId, Pageable pageable);

    Page<Payout> findByStatusOrderByCreatedAtAsc(PayoutStatus status, Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payout p WHERE p.id = :id")
    Optional<Payout> findByIdForUpdate(@Param("id") Long id);
}
