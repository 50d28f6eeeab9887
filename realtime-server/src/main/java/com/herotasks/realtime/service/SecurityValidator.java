package com.herotasks.realtime.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Optional;

/**
 * Verifies connection tokens issued by the identity service.
 *
 * Tokens are HMAC-signed JWTs; the subject is the user id.
 */
@Service
@Slf4j
public class SecurityValidator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final MetricsService metricsService;

    public SecurityValidator(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            MetricsService metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.metricsService = metricsService;
    }

    /**
     * Verifies the token and, when the client claimed a user id, that it
     * matches the token subject.
     *
     * @return the authenticated user id, or empty if the token is not acceptable
     */
    public Optional<String> authenticate(String token, String claimedUserId) {
        if (token == null || token.isBlank()) {
            log.warn("Empty token provided: claimedUserId={}", claimedUserId);
            metricsService.recordAuthenticationAttempt(false);
            return Optional.empty();
        }

        if (token.startsWith(BEARER_PREFIX)) {
            token = token.substring(BEARER_PREFIX.length());
        }

        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.warn("Token without subject rejected");
                metricsService.recordAuthenticationAttempt(false);
                return Optional.empty();
            }

            if (claimedUserId != null && !claimedUserId.equals(subject)) {
                log.warn("User ID mismatch: claimed={}, token={}", claimedUserId, subject);
                metricsService.recordAuthenticationAttempt(false);
                return Optional.empty();
            }

            metricsService.recordAuthenticationAttempt(true);
            return Optional.of(subject);

        } catch (ExpiredJwtException e) {
            log.warn("Expired JWT token: claimedUserId={}", claimedUserId);
        } catch (SignatureException e) {
            log.warn("Invalid JWT signature: {}", e.getMessage());
        } catch (MalformedJwtException | UnsupportedJwtException e) {
            log.warn("Unreadable JWT token: {}", e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
        }

        metricsService.recordAuthenticationAttempt(false);
        return Optional.empty();
    }

    /**
     * Issues a token for the given user (development and tests).
     */
    public String generateToken(String userId) {
        return Jwts.builder()
                .subject(userId)
                .issuedAt(new Date())
                .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
                .signWith(secretKey)
                .compact();
    }
}
