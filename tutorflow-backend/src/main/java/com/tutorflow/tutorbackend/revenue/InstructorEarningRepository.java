package com.tutorflow.tutorbackend.revenue;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface InstructorEarningRepository extends JpaRepository<InstructorEarning, Long> {

    boolean existsByOrderItem_Order_Id(Long orderId);

    List<InstructorEarning> findByOrderItem_Order_Id(Long orderId);

    @Query("""
            SELECT COALESCE(SUM(e.amount), 0)
            FROM InstructorEarning e
            WHERE e.instructor.id = :instructorId AND e.status IN :statuses
            """)
    BigDecimal sumAmount(@Param("instructorId") Long instructorId,
                         @Param("statuses") Collection<EarningStatus> statuses);

    List<InstructorEarning> findByInstructor_IdAndStatusOrderByCreatedAtAscIdAsc(Long instructorId, EarningStatus status);

    List<InstructorEarning> findByStatusAndAvailableAtLessThanEqual(EarningStatus status, Instant cutoff);

    Page<InstructorEarning> findByInstructor_IdOrderByCreatedAtDesc(Long instructorId, Pageable pageable);
}
