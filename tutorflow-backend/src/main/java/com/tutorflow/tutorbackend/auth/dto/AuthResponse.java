package com.tutorflow.tutorbackend.auth.dto;

import com.tutorflow.tutorbackend.user.User;

public record AuthResponse(
        String accessToken,
        long expiresInMs,
        Long userId,
        String email,
        String displayName,
        String role
) {
    public static AuthResponse of(User user, String token, long expiresInMs) {
        return new AuthResponse(token, expiresInMs, user.getId(), user.getEmail(),
                user.getDisplayName(), user.getRole().name());
    }
}
