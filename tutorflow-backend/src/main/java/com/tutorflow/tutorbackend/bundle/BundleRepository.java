package com.tutorflow.tutorbackend.bundle;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface BundleRepository extends JpaRepository<Bundle, Long> {

    @EntityGraph(attributePaths = {"courses", "courses.course"})
    Optional<Bundle> findBySlug(String slug);

    boolean existsBySlug(String slug);

    Page<Bundle> findByActiveTrueOrderByCreatedAtDesc(Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Bundle b WHERE b.id = :id")
    Optional<Bundle> findByIdForUpdate(@Param("id") Long id);
}
