package com.tutorflow.tutorbackend.auth.dto;

import com.tutorflow.tutorbackend.user.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank @Email String email,
        @NotBlank @Size(min = 8, max = 128) String password,
        @Size(max = 80) String displayName,
        Role role
) {}
