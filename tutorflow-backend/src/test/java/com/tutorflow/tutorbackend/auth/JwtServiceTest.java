package com.tutorflow.tutorbackend.auth;

import com.tutorflow.tutorbackend.user.Role;
import com.tutorflow.tutorbackend.user.User;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class JwtServiceTest {

    private static final String SECRET = "test-secret-test-secret-test-secret-0123";
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private JwtService jwtService;
    private User user;

    @BeforeEach
    void setUp() {
        jwtService = new JwtService(SECRET, 60_000, Clock.fixed(NOW, ZoneOffset.UTC));
        user = new User();
        user.setId(7L);
        user.setEmail("student@tutorflow.test");
        user.setRole(Role.STUDENT);
    }

    @Test
    void tokenCarriesSubjectAndUserId() {
        String token = jwtService.generateToken(user);

        assertEquals("student@tutorflow.test", jwtService.extractUsername(token));
        assertEquals(7L, jwtService.extractUserId(token));
        assertEquals("STUDENT", jwtService.parse(token).get("role", String.class));
        assertTrue(jwtService.isTokenValid(token, new CustomUserDetails(user)));
    }

    @Test
    void tokenForReRegisteredEmailIsRejected() {
        String token = jwtService.generateToken(user);

        User replacement = new User();
        replacement.setId(8L);
        replacement.setEmail("student@tutorflow.test");
        replacement.setRole(Role.STUDENT);

        assertFalse(jwtService.isTokenValid(token, new CustomUserDetails(replacement)));
    }

    @Test
    void expiredTokenFailsToParse() {
        String token = jwtService.generateToken(user);
        JwtService later = new JwtService(SECRET, 60_000, Clock.fixed(NOW.plusSeconds(120), ZoneOffset.UTC));

        assertThrows(ExpiredJwtException.class, () -> later.extractUsername(token));
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtService other = new JwtService("another-secret-another-secret-another-01", 60_000,
                Clock.fixed(NOW, ZoneOffset.UTC));
        String token = other.generateToken(user);

        assertThrows(JwtException.class, () -> jwtService.extractUsername(token));
    }
}
