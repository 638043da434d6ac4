package com.makeitso.ledger.security;

/**
 * Coarse trust tier of a session, derived from MFA state and role.
 * Never stored authoritatively; see {@link SecurityLevelClassifier}.
 */
public enum SecurityLevel {

    /** Password only, MFA not enabled. */
    LOW,

    /** MFA enabled but not yet verified in this session. */
    MEDIUM,

    /** MFA verified, non-administrator. */
    HIGH,

    /** MFA verified, administrator. */
    CRITICAL
}
