package com.tutorflow.tutorbackend.auth;

import com.tutorflow.tutorbackend.user.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies the HS256 bearer tokens used by the API. Tokens carry the user's email as
 * subject plus {@code uid} and {@code role} claims, and are bound to the {@code tutorflow} issuer.
 */
@Service
public class JwtService {

    static final String ISSUER = "tutorflow";
    private static final String CLAIM_UID = "uid";
    private static final String CLAIM_ROLE = "role";

    private final SecretKey key;
    private final long accessTokenExpirationMs;
    private final Clock clock;
    private final JwtParser parser;

    // Secret is raw UTF-8 text and must be at least 32 bytes for HS256
    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.access-token.expiration-ms}") long accessTokenExpirationMs,
            Clock clock
    ) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTokenExpirationMs = accessTokenExpirationMs;
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(key)
                .requireIssuer(ISSUER)
                .setClock(() -> Date.from(clock.instant()))
                .setAllowedClockSkewSeconds(5)
                .build();
    }

    public String generateToken(User user) {
        Instant issuedAt = clock.instant();
        return Jwts.builder()
                .setIssuer(ISSUER)
                .setSubject(user.getEmail())
                .claim(CLAIM_UID, user.getId())
                .claim(CLAIM_ROLE, user.getRole().name())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(issuedAt.plusMillis(accessTokenExpirationMs)))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public long getAccessTokenExpirationMs() {
        return accessTokenExpirationMs;
    }

    public String extractUsername(String token) {
        return parse(token).getSubject();
    }

    public Long extractUserId(String token) {
        Number uid = parse(token).get(CLAIM_UID, Number.class);
        return uid == null ? null : uid.longValue();
    }

    /**
     * A token stays valid only for the account it was issued to: the subject must match and, when the
     * principal is one of ours, so must the user id (an email re-registered after deletion gets a new id).
     */
    public boolean isTokenValid(String token, UserDetails userDetails) {
        Claims claims = parse(token);
        if (!userDetails.getUsername().equals(claims.getSubject())) {
            return false;
        }
        if (userDetails instanceof CustomUserDetails custom) {
            Number uid = claims.get(CLAIM_UID, Number.class);
            return uid != null && uid.longValue() == custom.getUser().getId();
        }
        return true;
    }

    public Claims parse(String token) {
        return parser.parseClaimsJws(token).getBody();
    }
}
