package com.tutorflow.tutorbackend.bundle;

import com.tutorflow.tutorbackend.bundle.dto.BundleCourseRequest;
import com.tutorflow.tutorbackend.bundle.dto.BundleCreateRequest;
import com.tutorflow.tutorbackend.bundle.dto.BundleDto;
import com.tutorflow.tutorbackend.bundle.dto.BundleUpdateRequest;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/bundles")
@RequiredArgsConstructor
public class AdminBundleController {

    private final BundleService bundleService;
    private final CurrentUserService currentUserService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public BundleDto create(@Valid @RequestBody BundleCreateRequest request) {
        return bundleService.createBundle(request, currentUserService.getCurrentUserOrThrow());
    }

    @PutMapping("/{id}")
    public BundleDto update(@PathVariable Long id, @RequestBody BundleUpdateRequest request) {
        return bundleService.updateBundle(id, request);
    }

    @PostMapping("/{id}/courses")
    public BundleDto addCourse(@PathVariable Long id, @Valid @RequestBody BundleCourseRequest request) {
        return bundleService.addCourse(id, request.courseId());
    }

    @DeleteMapping("/{id}/courses/{courseId}")
    public BundleDto removeCourse(@PathVariable Long id, @PathVariable Long courseId) {
        return bundleService.removeCourse(id, courseId);
    }
}
