package com.makeitso.ledger.auth;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.Optional;

/**
 * Bearer tokens. The token only names the session; whether the session is still
 * live is decided by the SessionLifecycleMonitor on every request.
 */
@Slf4j
@Component
public class JwtUtil {

    static final String SESSION_CLAIM = "sid";

    private final SecretKey key;
    private final long      expirationMs;
    private final Clock     clock;

    public JwtUtil(
            @Value("${app.jwt.secret}") String secret,
            @Value("${app.jwt.expiration-ms}") long expirationMs,
            Clock clock) {
        this.key          = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationMs = expirationMs;
        this.clock        = clock;
    }

    public record TokenClaims(Long userId, String sessionId) {
    }

    /** Signed JWT with the user id as subject and the session id as "sid". */
    public String generate(Long userId, String sessionId) {
        long now = clock.millis();
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim(SESSION_CLAIM, sessionId)
                .issuedAt(new Date(now))
                .expiration(new Date(now + expirationMs))
                .signWith(key)
                .compact();
    }

    /** Extract all claims from a valid token. Throws JwtException if invalid. */
    public Claims parse(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .clock(() -> new Date(clock.millis()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    /** Claims of a valid token carrying both ids, else empty. */
    public Optional<TokenClaims> verify(String token) {
        try {
            Claims claims = parse(token);
            String sessionId = claims.get(SESSION_CLAIM, String.class);
            if (claims.getSubject() == null || sessionId == null) {
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(Long.valueOf(claims.getSubject()), sessionId));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[JWT] Invalid token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
