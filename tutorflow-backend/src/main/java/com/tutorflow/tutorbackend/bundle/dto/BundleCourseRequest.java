package com.tutorflow.tutorbackend.bundle.dto;

import jakarta.validation.constraints.NotNull;

public record BundleCourseRequest(@NotNull Long courseId) {}
