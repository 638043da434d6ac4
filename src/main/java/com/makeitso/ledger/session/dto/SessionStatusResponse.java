package com.makeitso.ledger.session.dto;

import com.makeitso.ledger.security.SecurityLevel;
import com.makeitso.ledger.session.SecurityAdvisory;
import com.makeitso.ledger.session.SessionSnapshot;
import com.makeitso.ledger.session.SessionState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Response body for the /api/session endpoints.
 *
 * Includes the WebSocket subscription path so the client can listen for the
 * warning and forced-logout notices instead of polling.
 */
public record SessionStatusResponse(
        String               sessionId,
        SessionState         state,
        SecurityLevel        securityLevel,
        long                 timeUntilTimeoutMs,
        String               timeUntilTimeout,    // m:ss
        boolean              warning,
        boolean              mfaVerified,
        boolean              requiresMfa,
        Instant              loginTime,
        Instant              lastActivity,
        List<AdvisoryView>   advisories,
        String               wsSubscribePath
) {

    public record AdvisoryView(String type, String message, String severity) {

        static AdvisoryView of(SecurityAdvisory advisory) {
            return new AdvisoryView(advisory.name(), advisory.message(), advisory.severity().name());
        }
    }

    public static SessionStatusResponse from(SessionSnapshot snapshot, List<SecurityAdvisory> advisories) {
        return new SessionStatusResponse(
                snapshot.sessionId(),
                snapshot.state(),
                snapshot.securityLevel(),
                snapshot.timeUntilTimeout().toMillis(),
                formatRemaining(snapshot.timeUntilTimeout()),
                snapshot.state() == SessionState.WARNING,
                snapshot.mfaVerified(),
                snapshot.principal().mfaEnabled() && !snapshot.mfaVerified(),
                snapshot.loginTime(),
                snapshot.lastActivity(),
                advisories.stream().map(AdvisoryView::of).toList(),
                "/topic/session/" + snapshot.sessionId()
        );
    }

    /** Countdown text, minutes and zero-padded seconds: 4:05. */
    public static String formatRemaining(Duration remaining) {
        long seconds = Math.max(0, remaining.getSeconds());
        return String.format("%d:%02d", seconds / 60, seconds % 60);
    }
}
