package com.makeitso.ledger.auth;

import com.makeitso.ledger.security.Principal;

/**
 * Checks a second-factor code for a principal. Supplied by the deployment (TOTP,
 * SMS gateway, ...). The default bean rejects every code.
 */
public interface MfaCodeVerifier {

    boolean verify(Principal principal, String code);
}
