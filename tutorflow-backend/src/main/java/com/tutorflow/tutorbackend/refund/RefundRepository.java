package com.tutorflow.tutorbackend.refund;

import com.tutorflow.tutorbackend.user.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RefundRepository extends JpaRepository<Refund, Long> {

    boolean existsByOrder_Id(Long orderId);

    List<Refund> findByUserOrderByCreatedAtDesc(User user);

    Page<Refund> findByStatusOrderByCreatedAtAsc(RefundStatus status, Pageable pageable);

    @Query("SELECT r.id FROM Refund r WHERE r.status = :status ORDER BY r.createdAt ASC")
    List<Long> findIdsByStatus(@Param("status") RefundStatus status);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Refund r WHERE r.id = :id")
    Optional<Refund> findByIdForUpdate(@Param("id") Long id);
}
