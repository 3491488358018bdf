package com.tutorflow.tutorbackend.enrollment;

import com.tutorflow.tutorbackend.enrollment.dto.EnrollmentDto;
import com.tutorflow.tutorbackend.enrollment.dto.ProgressUpdateRequest;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/enrollments")
@RequiredArgsConstructor
public class EnrollmentController {

    private final EnrollmentService enrollmentService;
    private final CurrentUserService currentUserService;

    @GetMapping("/mine")
    public List<EnrollmentDto> mine() {
        return enrollmentService.getMyEnrollments(currentUserService.getCurrentUserOrThrow());
    }

    @PutMapping("/{courseId}/progress")
    public EnrollmentDto updateProgress(@PathVariable Long courseId,
                                        @Valid @RequestBody ProgressUpdateRequest request) {
        return enrollmentService.updateProgress(
                currentUserService.getCurrentUserOrThrow(), courseId, request.progressPercent());
    }
}
