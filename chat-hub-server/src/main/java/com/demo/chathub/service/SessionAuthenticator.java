package com.demo.chathub.service;

import com.demo.chathub.common.ChatHubException;
import com.demo.chathub.domain.AuthenticatedUser;
import com.demo.chathub.infrastructure.ChatStore;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Turns a bearer token into an {@link AuthenticatedUser}.
 *
 * Tokens are HS256 JWTs whose subject is the numeric user id. The token must carry an
 * expiration and the user must still exist.
 */
@Service
@Slf4j
public class SessionAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final ChatStore chatStore;
    private final MetricsService metricsService;

    public SessionAuthenticator(
            @Value("${security.jwt.secret:default-secret-key-change-this-in-production-minimum-256-bits}") String secret,
            @Value("${security.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            ChatStore chatStore,
            MetricsService metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.chatStore = chatStore;
        this.metricsService = metricsService;
    }

    /**
     * @throws ChatHubException AUTHENTICATION_FAILED for a missing, invalid or expired
     *         token, or an unknown user
     */
    public AuthenticatedUser authenticate(String token) {
        if (token == null || token.isBlank()) {
            log.warn("Empty token provided");
            return fail("Missing token");
        }
        if (token.startsWith(BEARER_PREFIX)) {
            token = token.substring(BEARER_PREFIX.length());
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token.trim())
                    .getPayload();
        } catch (ExpiredJwtException e) {
            log.warn("Expired JWT token: {}", e.getMessage());
            return fail("Token expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid JWT token: {}", e.getMessage());
            return fail("Invalid token");
        }

        if (claims.getExpiration() == null) {
            log.warn("JWT token without expiration: subject={}", claims.getSubject());
            return fail("Invalid token");
        }

        long userId;
        try {
            userId = Long.parseLong(claims.getSubject());
        } catch (NumberFormatException e) {
            log.warn("JWT subject is not a user id: subject={}", claims.getSubject());
            return fail("Invalid token");
        }

        AuthenticatedUser user = chatStore.findUser(userId).orElse(null);
        if (user == null) {
            log.warn("Token for unknown user: userId={}", userId);
            return fail("Unknown user");
        }

        user.setTokenExpiresAt(claims.getExpiration().toInstant());
        metricsService.recordAuthenticationAttempt(true);
        return user;
    }

    /**
     * Issue a token for a user id. Used by tests and local tooling.
     */
    public String generateToken(long userId) {
        return Jwts.builder()
                .subject(Long.toString(userId))
                .issuedAt(new Date())
                .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
                .signWith(secretKey)
                .compact();
    }

    private AuthenticatedUser fail(String reason) {
        metricsService.recordAuthenticationAttempt(false);
        throw ChatHubException.authenticationFailed("Authentication failed: " + reason);
    }
}
