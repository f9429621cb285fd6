package com.comicguess.dailypuzzle.security;

import com.comicguess.dailypuzzle.exception.AuthenticationRequiredException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Verifies bearer tokens issued by the auth service (HMAC-SHA, shared secret)
 */
@Component
public class JwtUtil {

    private final SecretKey secretKey;

    public JwtUtil(@Value("${jwt.secret}") String secret) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Extract user ID from JWT token. Uses the subject, falling back to a "user_id" claim.
     *
     * @throws io.jsonwebtoken.JwtException if the token is malformed, expired or badly signed
     */
    public String extractUserId(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(secretKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();

        String subject = claims.getSubject();
        if (subject != null && !subject.isBlank()) {
            return subject;
        }

        Object userIdObj = claims.get("user_id");
        if (userIdObj instanceof Number) {
            return String.valueOf(((Number) userIdObj).longValue());
        } else if (userIdObj instanceof String && !((String) userIdObj).isBlank()) {
            return (String) userIdObj;
        }

        throw new AuthenticationRequiredException("Token carries no user id");
    }
}
