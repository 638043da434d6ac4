package com.makeitso.ledger.auth.dto;

import com.makeitso.ledger.security.Role;
import com.makeitso.ledger.security.SecurityLevel;

/**
 * Returned by register and login. Register issues no token: the new user signs in
 * like everyone else, so sessionId, token and wsSubscribePath are null there.
 */
public record AuthResponse(
        Long          userId,
        String        email,
        String        displayName,
        Role          role,
        SecurityLevel securityLevel,
        boolean       mfaRequired,
        String        sessionId,
        String        token,
        String        wsSubscribePath    // /topic/session/{sessionId}
) {
}
