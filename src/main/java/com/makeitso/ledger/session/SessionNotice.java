package com.makeitso.ledger.session;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Frame pushed to /topic/session/{sessionId} when the session changes state,
 * so a client countdown can react without polling.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionNotice(
        String           sessionId,
        SessionState     state,
        SessionEndReason reason,
        long             timeRemainingMs,
        Instant          timestamp
) {

    public static SessionNotice warning(String sessionId, long timeRemainingMs, Instant at) {
        return new SessionNotice(sessionId, SessionState.WARNING, null, timeRemainingMs, at);
    }

    public static SessionNotice resumed(String sessionId, long timeRemainingMs, Instant at) {
        return new SessionNotice(sessionId, SessionState.ACTIVE, null, timeRemainingMs, at);
    }

    public static SessionNotice ended(String sessionId, SessionState state, SessionEndReason reason, Instant at) {
        return new SessionNotice(sessionId, state, reason, 0L, at);
    }
}
