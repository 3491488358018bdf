package com.tutorflow.tutorbackend.enrollment;

public enum EnrollmentStatus {
    ACTIVE,
    REVOKED
}
