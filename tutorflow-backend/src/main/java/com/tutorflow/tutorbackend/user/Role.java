package com.tutorflow.tutorbackend.user;

public enum Role {
    STUDENT,
    INSTRUCTOR,
    ADMIN
}
