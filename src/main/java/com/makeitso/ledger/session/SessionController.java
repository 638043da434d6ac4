package com.makeitso.ledger.session;

import com.makeitso.ledger.auth.AuthenticatedSession;
import com.makeitso.ledger.config.SecurityPolicyProperties;
import com.makeitso.ledger.session.dto.ActivityRequest;
import com.makeitso.ledger.session.dto.SessionStatusResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Session status for the caller's own session.
 *
 * Endpoints:
 *   GET  /api/session           state, level, countdown, advisories (does not count as activity)
 *   POST /api/session/activity  activity signal, optionally with the client's event time
 *   POST /api/session/extend    "stay signed in"
 *
 * Clients should also subscribe to /topic/session/{sessionId} for warning and
 * logout notices.
 */
@RestController
@RequestMapping("/api/session")
@RequiredArgsConstructor
public class SessionController {

    private final SessionLifecycleMonitor  sessionMonitor;
    private final SecurityPolicyProperties policy;

    @GetMapping
    public ResponseEntity<SessionStatusResponse> status(@AuthenticationPrincipal AuthenticatedSession caller) {
        return ResponseEntity.ok(describe(caller.sessionId()));
    }

    @PostMapping("/activity")
    public ResponseEntity<SessionStatusResponse> activity(@AuthenticationPrincipal AuthenticatedSession caller,
                                                          @RequestBody(required = false) ActivityRequest request) {
        sessionMonitor.recordActivity(caller.sessionId(), request == null ? null : request.occurredAt());
        return ResponseEntity.ok(describe(caller.sessionId()));
    }

    @PostMapping("/extend")
    public ResponseEntity<SessionStatusResponse> extend(@AuthenticationPrincipal AuthenticatedSession caller) {
        sessionMonitor.extendSession(caller.sessionId());
        return ResponseEntity.ok(describe(caller.sessionId()));
    }

    private SessionStatusResponse describe(String sessionId) {
        SessionSnapshot snapshot = sessionMonitor.snapshot(sessionId);
        return SessionStatusResponse.from(snapshot,
                SecurityAdvisory.evaluate(snapshot, policy.passwordRotation()));
    }
}
