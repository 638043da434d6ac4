package com.makeitso.ledger.session;

import com.makeitso.ledger.security.Principal;
import com.makeitso.ledger.security.SecurityLevel;
import com.makeitso.ledger.security.SecurityLevelPolicy;

import java.time.Duration;
import java.time.Instant;

/** Point-in-time read of a tracked session. */
public record SessionSnapshot(
        String              sessionId,
        Principal           principal,
        SessionState        state,
        SecurityLevel       securityLevel,
        SecurityLevelPolicy policy,
        Instant             loginTime,
        Instant             lastActivity,
        boolean             mfaVerified,
        Duration            timeUntilTimeout,
        Instant             takenAt
) {
}
