package com.makeitso.ledger.session;

/**
 * Lifecycle of a session record.
 *
 * ACTIVE ⇄ WARNING → EXPIRED, and (any) → TERMINATED. EXPIRED and TERMINATED are final.
 */
public enum SessionState {

    ACTIVE,

    /** Within the warning window before forced expiry. Activity returns to ACTIVE. */
    WARNING,

    /** Idle for the full timeout. Re-authentication required. */
    EXPIRED,

    /** Ended by sign-out or by a policy decision. */
    TERMINATED;

    public boolean isLive() {
        return this == ACTIVE || this == WARNING;
    }

    public boolean isFinal() {
        return !isLive();
    }
}
