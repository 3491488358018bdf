package com.tutorflow.tutorbackend.enrollment;

import com.tutorflow.tutorbackend.course.Course;
import com.tutorflow.tutorbackend.enrollment.dto.EnrollmentDto;
import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import com.tutorflow.tutorbackend.order.Order;
import com.tutorflow.tutorbackend.user.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class EnrollmentService {

    private final EnrollmentRepository enrollmentRepository;
    private final Clock clock;

    /**
     * Grants access to a course. Create-if-absent: an active enrollment is returned untouched,
     * a revoked one is reactivated and re-linked to the new order.
     */
    @Transactional
    public Enrollment enroll(User user, Course course, Order order) {
        Instant now = Instant.now(clock);
        Enrollment existing = enrollmentRepository.findByUser_IdAndCourse_Id(user.getId(), course.getId()).orElse(null);
        if (existing != null) {
            if (existing.isActive()) {
                return existing;
            }
            existing.setStatus(EnrollmentStatus.ACTIVE);
            existing.setRevokedAt(null);
            existing.setOrder(order);
            existing.setEnrolledAt(now);
            existing.setProgressPercent(0);
            log.info("Re-activated enrollment user={} course={}", user.getId(), course.getId());
            return enrollmentRepository.save(existing);
        }

        Enrollment e = new Enrollment();
        e.setUser(user);
        e.setCourse(course);
        e.setOrder(order);
        e.setStatus(EnrollmentStatus.ACTIVE);
        e.setEnrolledAt(now);
        log.info("Enrolled user={} course={} order={}", user.getId(), course.getId(),
                order != null ? order.getOrderNumber() : null);
        return enrollmentRepository.save(e);
    }

    public boolean isEnrolled(Long userId, Long courseId) {
        return enrollmentRepository.existsByUser_IdAndCourse_IdAndStatus(userId, courseId, EnrollmentStatus.ACTIVE);
    }

    public List<Enrollment> findByOrder(Order order) {
        return enrollmentRepository.findByOrder_Id(order.getId());
    }

    @Transactional
    public int revokeForOrder(Order order) {
        Instant now = Instant.now(clock);
        int revoked = 0;
        for (Enrollment e : enrollmentRepository.findByOrder_Id(order.getId())) {
            if (e.isActive()) {
                e.setStatus(EnrollmentStatus.REVOKED);
                e.setRevokedAt(now);
                revoked++;
            }
        }
        log.info("Revoked {} enrollment(s) for refunded order {}", revoked, order.getOrderNumber());
        return revoked;
    }

    @Transactional
    public EnrollmentDto updateProgress(User user, Long courseId, int progressPercent) {
        if (progressPercent < 0 || progressPercent > 100) {
            throw BillingException.invalid("Progress must be between 0 and 100");
        }
        Enrollment e = enrollmentRepository.findByUser_IdAndCourse_Id(user.getId(), courseId)
                .orElseThrow(() -> BillingException.notFound("Enrollment"));
        if (!e.isActive()) {
            throw new BillingException(BillingError.FORBIDDEN, "Enrollment has been revoked");
        }
        // progress only moves forward
        e.setProgressPercent(Math.max(e.getProgressPercent(), progressPercent));
        return EnrollmentDto.from(e);
    }

    @Transactional(readOnly = true)
    public List<EnrollmentDto> getMyEnrollments(User user) {
        return enrollmentRepository.findByUserOrderByEnrolledAtDesc(user).stream()
                .map(EnrollmentDto::from)
                .toList();
    }
}
