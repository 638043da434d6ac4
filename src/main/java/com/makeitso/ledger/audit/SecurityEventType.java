package com.makeitso.ledger.audit;

/**
 * Classifies every authentication- or session-relevant occurrence written to the
 * security event log. Each type carries the risk level used when the emitter
 * does not pick one explicitly.
 */
public enum SecurityEventType {

    /** Credentials accepted and a session opened. */
    LOGIN_SUCCESS(RiskLevel.LOW),

    /** Credentials rejected, or the account may not sign in. */
    LOGIN_FAILURE(RiskLevel.HIGH),

    /** Session ended by sign-out or policy; details carry the reason code. */
    LOGOUT(RiskLevel.LOW),

    /** Session idle for the full timeout of its security level. */
    SESSION_TIMEOUT(RiskLevel.MEDIUM),

    /** A prior live session was ended because the level forbids concurrency. */
    CONCURRENT_SESSION(RiskLevel.MEDIUM),

    PASSWORD_CHANGE(RiskLevel.MEDIUM),
    MFA_ENABLED(RiskLevel.MEDIUM),
    MFA_DISABLED(RiskLevel.MEDIUM),
    MFA_VERIFIED(RiskLevel.LOW),
    MFA_FAILED(RiskLevel.HIGH),
    ACCOUNT_LOCKED(RiskLevel.HIGH),
    ACCOUNT_UNLOCKED(RiskLevel.LOW),

    /** Administrative status change that neither enters nor leaves LOCKED. */
    ACCOUNT_STATUS_CHANGED(RiskLevel.MEDIUM),

    PERMISSION_GRANTED(RiskLevel.MEDIUM),
    PERMISSION_REVOKED(RiskLevel.MEDIUM),

    /** Anything that should page a human. */
    SUSPICIOUS_ACTIVITY(RiskLevel.CRITICAL);

    private final RiskLevel defaultRisk;

    SecurityEventType(RiskLevel defaultRisk) {
        this.defaultRisk = defaultRisk;
    }

    public RiskLevel defaultRisk() {
        return defaultRisk;
    }
}
