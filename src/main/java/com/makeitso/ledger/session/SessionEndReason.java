package com.makeitso.ledger.session;

/** Reason code recorded when a session leaves the live states. */
public enum SessionEndReason {
    SIGN_OUT,
    INACTIVITY_TIMEOUT,
    ACCOUNT_STATUS,
    PASSWORD_EXPIRED,
    CONCURRENT_SESSION,
    MFA_ATTEMPTS_EXCEEDED,
    INTEGRITY_VIOLATION
}
