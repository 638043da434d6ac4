package com.makeitso.ledger.audit;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable audit entry.
 *
 * userId and sessionId are nullable: a failed login may have no resolvable
 * principal, and account-level events have no session.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecurityEvent(
        String              eventId,
        SecurityEventType   type,
        Long                userId,
        String              sessionId,
        Instant             timestamp,
        boolean             success,
        RiskLevel           riskLevel,
        Map<String, Object> details,
        String              clientIp,
        String              userAgent
) {

    public SecurityEvent {
        details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    // ── Factories ────────────────────────────────────────────────────────────

    public static SecurityEvent of(SecurityEventType type, Long userId, String sessionId,
                                   boolean success, Instant at) {
        return new SecurityEvent(UUID.randomUUID().toString(), type, userId, sessionId, at,
                success, type.defaultRisk(), null, null, null);
    }

    public static SecurityEvent success(SecurityEventType type, Long userId, String sessionId, Instant at) {
        return of(type, userId, sessionId, true, at);
    }

    public static SecurityEvent failure(SecurityEventType type, Long userId, String sessionId, Instant at) {
        return of(type, userId, sessionId, false, at);
    }

    // ── Withers ──────────────────────────────────────────────────────────────

    public SecurityEvent withRisk(RiskLevel risk) {
        return new SecurityEvent(eventId, type, userId, sessionId, timestamp, success, risk,
                details, clientIp, userAgent);
    }

    public SecurityEvent withDetail(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put(key, value);
        return new SecurityEvent(eventId, type, userId, sessionId, timestamp, success, riskLevel,
                copy, clientIp, userAgent);
    }

    public SecurityEvent withClient(String ip, String agent) {
        return new SecurityEvent(eventId, type, userId, sessionId, timestamp, success, riskLevel,
                details, ip, agent);
    }

    public boolean isCritical() {
        return riskLevel == RiskLevel.CRITICAL;
    }
}
