package com.tutorflow.tutorbackend.enrollment;

import com.tutorflow.tutorbackend.user.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface EnrollmentRepository extends JpaRepository<Enrollment, Long> {

    Optional<Enrollment> findByUser_IdAndCourse_Id(Long userId, Long courseId);

    boolean existsByUser_IdAndCourse_IdAndStatus(Long userId, Long courseId, EnrollmentStatus status);

    List<Enrollment> findByOrder_Id(Long orderId);

    List<Enrollment> findByUserOrderByEnrolledAtDesc(User user);
}
