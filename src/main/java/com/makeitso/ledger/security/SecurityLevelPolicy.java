package com.makeitso.ledger.security;

import java.time.Duration;

/**
 * Tuning values attached to one {@link SecurityLevel}. Supplied from configuration.
 */
public record SecurityLevelPolicy(
        int     sessionTimeoutMinutes,
        boolean requiresMfa,
        boolean allowConcurrentSessions,
        int     maxFailedAttempts,
        int     lockoutDurationMinutes
) {

    public SecurityLevelPolicy {
        if (sessionTimeoutMinutes <= 0) {
            throw new IllegalArgumentException("sessionTimeoutMinutes must be positive");
        }
        if (maxFailedAttempts <= 0) {
            throw new IllegalArgumentException("maxFailedAttempts must be positive");
        }
        if (lockoutDurationMinutes < 0) {
            throw new IllegalArgumentException("lockoutDurationMinutes must not be negative");
        }
    }

    public Duration sessionTimeout() {
        return Duration.ofMinutes(sessionTimeoutMinutes);
    }

    public Duration lockoutDuration() {
        return Duration.ofMinutes(lockoutDurationMinutes);
    }
}
