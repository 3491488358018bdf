package com.tutorflow.tutorbackend.course;

public enum CourseStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED
}
