package com.makeitso.ledger.auth;

import com.makeitso.ledger.security.Principal;

/**
 * Checks a sign-in identifier and password.
 *
 * Returns the matching principal, or null when the identifier is unknown or the
 * password does not match. The two cases must be indistinguishable to the caller.
 */
public interface CredentialVerifier {

    Principal verifyCredentials(String email, String password);
}
