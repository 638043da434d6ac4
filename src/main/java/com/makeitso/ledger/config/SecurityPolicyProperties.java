package com.makeitso.ledger.config;

import com.makeitso.ledger.security.SecurityLevel;
import com.makeitso.ledger.security.SecurityLevelPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Externalised session-security policy.
 *
 * Reads from application.yml under the "app.security" prefix:
 *
 * app:
 *   security:
 *     password-rotation-days: 90
 *     warning-minutes: 5
 *     check-interval-ms: 30000
 *     levels:
 *       critical:
 *         session-timeout-minutes: 10
 *         requires-mfa: true
 *         allow-concurrent-sessions: false
 *         max-failed-attempts: 2
 *         lockout-duration-minutes: 120
 *
 * A level missing from "levels" falls back to {@link #DEFAULT_LEVELS}.
 */
@ConfigurationProperties(prefix = "app.security")
public record SecurityPolicyProperties(
        @DefaultValue("90")    int  passwordRotationDays,
        @DefaultValue("5")     int  warningMinutes,
        @DefaultValue("30000") long checkIntervalMs,
        @DefaultValue("15000") long activityFlushIntervalMs,
        Map<SecurityLevel, SecurityLevelPolicy> levels
) {

    public static final Map<SecurityLevel, SecurityLevelPolicy> DEFAULT_LEVELS;

    static {
        Map<SecurityLevel, SecurityLevelPolicy> defaults = new EnumMap<>(SecurityLevel.class);
        defaults.put(SecurityLevel.LOW,      new SecurityLevelPolicy(60, false, true,  5, 15));
        defaults.put(SecurityLevel.MEDIUM,   new SecurityLevelPolicy(30, false, true,  3, 30));
        defaults.put(SecurityLevel.HIGH,     new SecurityLevelPolicy(15, true,  false, 3, 60));
        defaults.put(SecurityLevel.CRITICAL, new SecurityLevelPolicy(10, true,  false, 2, 120));
        DEFAULT_LEVELS = Collections.unmodifiableMap(defaults);
    }

    public SecurityPolicyProperties {
        if (passwordRotationDays <= 0) {
            throw new IllegalArgumentException("app.security.password-rotation-days must be positive");
        }
        if (warningMinutes < 0) {
            throw new IllegalArgumentException("app.security.warning-minutes must not be negative");
        }
        Map<SecurityLevel, SecurityLevelPolicy> merged = new EnumMap<>(DEFAULT_LEVELS);
        if (levels != null) {
            merged.putAll(levels);
        }
        levels = Collections.unmodifiableMap(merged);
    }

    /** Reference policy with no overrides. */
    public static SecurityPolicyProperties defaults() {
        return new SecurityPolicyProperties(90, 5, 30_000, 15_000, null);
    }

    public SecurityLevelPolicy policyFor(SecurityLevel level) {
        return levels.get(level);
    }

    public Duration passwordRotation() {
        return Duration.ofDays(passwordRotationDays);
    }

    public Duration warningWindow() {
        return Duration.ofMinutes(warningMinutes);
    }
}
