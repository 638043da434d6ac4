package com.makeitso.ledger.security;

/**
 * Derives the trust tier of a session. Exactly one tier applies to every
 * (mfaEnabled, mfaVerified, role) combination.
 */
public final class SecurityLevelClassifier {

    private SecurityLevelClassifier() {
    }

    public static SecurityLevel classify(Principal principal, boolean sessionMfaVerified) {
        if (!principal.mfaEnabled()) {
            return SecurityLevel.LOW;
        }
        if (!sessionMfaVerified) {
            return SecurityLevel.MEDIUM;
        }
        return principal.isAdministrator() ? SecurityLevel.CRITICAL : SecurityLevel.HIGH;
    }
}
