package com.tutorflow.tutorbackend.auth;

import com.tutorflow.tutorbackend.auth.dto.AuthResponse;
import com.tutorflow.tutorbackend.auth.dto.LoginRequest;
import com.tutorflow.tutorbackend.auth.dto.RegisterRequest;
import com.tutorflow.tutorbackend.cart.CartController;
import com.tutorflow.tutorbackend.cart.CartService;
import com.tutorflow.tutorbackend.user.CurrentUserService;
import com.tutorflow.tutorbackend.user.Role;
import com.tutorflow.tutorbackend.user.User;
import com.tutorflow.tutorbackend.user.UserRepository;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final CartService cartService;
    private final CurrentUserService currentUserService;

    @PostMapping("/register")
    public ResponseEntity<?> register(@Valid @RequestBody RegisterRequest request,
                                      @RequestHeader(value = CartController.SESSION_HEADER, required = false) String cartSession) {
        String email = request.email().trim().toLowerCase();
        if (userRepository.existsByEmail(email)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("status", "error", "reason", "email_taken", "message", "Email is already taken"));
        }

        // admins are only ever seeded
        Role role = request.role() == Role.INSTRUCTOR ? Role.INSTRUCTOR : Role.STUDENT;

        User user = new User();
        user.setEmail(email);
        user.setPassword(passwordEncoder.encode(request.password()));
        user.setDisplayName(request.displayName() != null ? request.displayName() : email.substring(0, email.indexOf('@')));
        user.setRole(role);
        user = userRepository.save(user);
        log.info("Registered user {} as {}", user.getId(), role);

        cartService.mergeGuestCart(cartSession, user);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(AuthResponse.of(user, jwtService.generateToken(user), jwtService.getAccessTokenExpirationMs()));
    }

    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request,
                                   @RequestHeader(value = CartController.SESSION_HEADER, required = false) String cartSession) {
        User user = userRepository.findByEmail(request.email().trim().toLowerCase()).orElse(null);
        if (user == null || !passwordEncoder.matches(request.password(), user.getPassword())) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("status", "error", "reason", "invalid_credentials", "message", "Invalid credentials"));
        }

        cartService.mergeGuestCart(cartSession, user);
        return ResponseEntity.ok(AuthResponse.of(user, jwtService.generateToken(user), jwtService.getAccessTokenExpirationMs()));
    }

    @GetMapping("/me")
    public Map<String, Object> me() {
        User me = currentUserService.getCurrentUserOrThrow();
        return Map.of(
                "id", me.getId(),
                "email", me.getEmail(),
                "displayName", me.getDisplayName() == null ? "" : me.getDisplayName(),
                "role", me.getRole().name()
        );
    }
}
