package com.makeitso.ledger.session;

import com.makeitso.ledger.audit.RiskLevel;
import com.makeitso.ledger.audit.SecurityEvent;
import com.makeitso.ledger.audit.SecurityEventLog;
import com.makeitso.ledger.audit.SecurityEventType;
import com.makeitso.ledger.config.SecurityPolicyProperties;
import com.makeitso.ledger.domain.User;
import com.makeitso.ledger.domain.UserSession;
import com.makeitso.ledger.repository.UserRepository;
import com.makeitso.ledger.repository.UserSessionRepository;
import com.makeitso.ledger.security.Principal;
import com.makeitso.ledger.security.SecurityLevel;
import com.makeitso.ledger.security.SecurityLevelClassifier;
import com.makeitso.ledger.websocket.SessionEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the session state machine.
 *
 * Live sessions are tracked in memory and mirrored to {@code user_sessions}. A session
 * not in memory (after a restart, or opened on another node) is reloaded on first use.
 *
 * State is derived from idle time against the timeout of the session's current
 * security level:
 *
 *   idle ≥ timeout                    → EXPIRED (hard stop, no grace)
 *   idle ≥ timeout − warning window   → WARNING
 *   otherwise                         → ACTIVE
 *
 * A principal that is no longer Active, or whose password has expired, is terminated
 * on the next evaluation. Every final transition is persisted, logged as a security
 * event and pushed to the session topic exactly once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionLifecycleMonitor {

    private final UserSessionRepository    sessionRepository;
    private final UserRepository           userRepository;
    private final SecurityEventLog         eventLog;
    private final SessionEventPublisher    eventPublisher;
    private final SecurityPolicyProperties policy;
    private final Clock                    clock;

    private final ConcurrentMap<String, TrackedSession> sessions = new ConcurrentHashMap<>();

    // ── Open ─────────────────────────────────────────────────────────────────

    /**
     * Creates a session for an authenticated principal.
     *
     * The user row is locked for the rest of the transaction, so two logins for the same
     * principal cannot both see "no other live session". If the new session's level or
     * the level of any surviving session forbids concurrency, the older sessions are
     * terminated before the new row is written.
     */
    @Transactional
    public TrackedSession open(Principal principal, String clientIp, String userAgent) {
        Instant now = clock.instant();
        userRepository.lockById(principal.id())
                .orElseThrow(() -> new IllegalStateException("No user row for principal " + principal.id()));

        String sessionId = UUID.randomUUID().toString();
        SecurityLevel level = SecurityLevelClassifier.classify(principal, false);

        enforceConcurrency(principal.id(), sessionId, level, now);

        sessionRepository.save(UserSession.builder()
                .sessionId(sessionId)
                .userId(principal.id())
                .loginTime(now)
                .lastActivityTime(now)
                .clientIp(clientIp)
                .userAgent(userAgent)
                .build());

        TrackedSession tracked = new TrackedSession(sessionId, principal, now, now, false, 0, clientIp, userAgent);
        registerAfterCommit(tracked);
        log.info("[Session] Opened {} for user={} level={}", sessionId, principal.id(), level);
        return tracked;
    }

    // ── Evaluation ───────────────────────────────────────────────────────────

    /**
     * Evaluates the session at the current instant and applies any transition due.
     *
     * @throws SessionExpiredException   the session is unknown
     * @throws SessionIntegrityException stored or computed times are inconsistent
     */
    public SessionState check(String sessionId) {
        TrackedSession session = resolve(sessionId).orElseThrow(SessionExpiredException::new);
        return advance(session, clock.instant());
    }

    /** Like {@link #check} but only returns sessions that are still live. */
    public TrackedSession requireLive(String sessionId) {
        TrackedSession session = resolve(sessionId).orElseThrow(SessionExpiredException::new);
        if (!advance(session, clock.instant()).isLive()) {
            throw new SessionExpiredException();
        }
        return session;
    }

    /**
     * Time left before forced expiry, {@code max(0, timeout − idle)}. A pure read:
     * no transition is applied. Zero for a session that has already ended.
     */
    public Duration getTimeUntilTimeout(String sessionId) {
        TrackedSession session = resolve(sessionId).orElseThrow(SessionExpiredException::new);
        return remaining(session, clock.instant());
    }

    public SecurityLevel securityLevelOf(String sessionId) {
        return resolve(sessionId).orElseThrow(SessionExpiredException::new).securityLevel();
    }

    /** Evaluates, then describes the session. */
    public SessionSnapshot snapshot(String sessionId) {
        TrackedSession session = resolve(sessionId).orElseThrow(SessionExpiredException::new);
        Instant now = clock.instant();
        advance(session, now);
        synchronized (session) {
            SecurityLevel level = session.securityLevel();
            return new SessionSnapshot(
                    session.sessionId(),
                    session.principal(),
                    session.state(),
                    level,
                    policy.policyFor(level),
                    session.loginTime(),
                    session.lastActivity(),
                    session.mfaVerified(),
                    remaining(session, now),
                    now);
        }
    }

    // ── Activity ─────────────────────────────────────────────────────────────

    /**
     * Records user activity. {@code occurredAt} may be null or earlier than now (a
     * buffered client event); a timestamp in the future is clamped to now. The stored
     * activity time never moves backwards.
     *
     * @return time left before expiry after applying the activity
     * @throws SessionExpiredException if the session already passed its timeout
     */
    public Duration recordActivity(String sessionId, Instant occurredAt) {
        Instant now = clock.instant();
        TrackedSession session = resolve(sessionId).orElseThrow(SessionExpiredException::new);
        if (!advance(session, now).isLive()) {
            throw new SessionExpiredException();
        }
        Instant at = occurredAt == null || occurredAt.isAfter(now) ? now : occurredAt;
        if (!session.touch(at)) {
            throw new SessionExpiredException();
        }
        advance(session, now);
        return remaining(session, now);
    }

    /** Explicit "stay signed in"; counts as activity now. */
    public Duration extendSession(String sessionId) {
        return recordActivity(sessionId, null);
    }

    // ── Termination ──────────────────────────────────────────────────────────

    /**
     * Explicit sign-out. Wins over a pending expiry as long as it gets here first.
     *
     * @return false if the session was unknown or had already ended
     */
    public boolean signOut(String sessionId) {
        return resolve(sessionId)
                .map(session -> terminate(session, SessionEndReason.SIGN_OUT))
                .orElse(false);
    }

    boolean terminate(TrackedSession session, SessionEndReason reason) {
        if (!session.end(SessionState.TERMINATED, reason, clock.instant())) {
            return false;
        }
        onEnded(session);
        return true;
    }

    // ── MFA ──────────────────────────────────────────────────────────────────

    /**
     * Marks the session MFA-verified. The raised level is re-checked against the
     * concurrency policy: if it forbids concurrency, the principal's other live
     * sessions are terminated.
     */
    @Transactional
    public SecurityLevel markMfaVerified(String sessionId) {
        TrackedSession session = requireLive(sessionId);
        Long userId = session.principal().id();
        userRepository.lockById(userId)
                .orElseThrow(() -> new IllegalStateException("No user row for principal " + userId));

        session.verifyMfa();
        sessionRepository.updateMfaState(sessionId, true, 0);
        SecurityLevel level = session.securityLevel();

        enforceConcurrency(userId, sessionId, level, clock.instant());
        log.info("[Session] MFA verified on {} for user={}, level now {}", sessionId, userId, level);
        return level;
    }

    /**
     * Counts a failed MFA code. Once the level's {@code maxFailedAttempts} is reached
     * the session is terminated.
     *
     * @return true if the session was terminated by this failure
     */
    public boolean recordMfaFailure(String sessionId) {
        TrackedSession session = requireLive(sessionId);
        int failures = session.recordMfaFailure();
        sessionRepository.updateMfaState(sessionId, session.mfaVerified(), failures);
        int limit = policy.policyFor(session.securityLevel()).maxFailedAttempts();
        if (failures < limit) {
            return false;
        }
        log.warn("[Session] {} MFA failures on {}, terminating", failures, sessionId);
        return terminate(session, SessionEndReason.MFA_ATTEMPTS_EXCEEDED);
    }

    // ── Principal changes ────────────────────────────────────────────────────

    /**
     * Pushes a changed principal (role, status, MFA flag) into its tracked sessions and
     * re-evaluates them, so a suspended account loses its sessions immediately.
     */
    public void principalChanged(Principal updated) {
        Instant now = clock.instant();
        for (TrackedSession session : sessions.values()) {
            if (session.principal().id().equals(updated.id())) {
                session.updatePrincipal(updated);
                advanceQuietly(session, now);
            }
        }
    }

    // ── Periodic work (driven by SessionSweeper) ─────────────────────────────

    /**
     * Evaluates every tracked session and forgets the ones that ended a sweep ago.
     * An ended session whose end was not yet written is kept and the write retried,
     * so its stored row can never be reloaded as live.
     */
    public int sweep() {
        Instant now = clock.instant();
        Instant forgetBefore = now.minusMillis(policy.checkIntervalMs());
        int ended = 0;
        for (TrackedSession session : sessions.values()) {
            if (session.state().isFinal()) {
                if (!session.endPersisted()) {
                    persistEnd(session);
                } else if (!session.endedAt().isAfter(forgetBefore)) {
                    sessions.remove(session.sessionId(), session);
                }
                continue;
            }
            if (advanceQuietly(session, now).isFinal()) {
                ended++;
            }
        }
        return ended;
    }

    /** Writes buffered activity timestamps. Stored values only move forward. */
    public int flushActivity() {
        int written = 0;
        for (TrackedSession session : sessions.values()) {
            Instant pending = session.unflushedActivity();
            if (pending == null) {
                continue;
            }
            try {
                sessionRepository.advanceLastActivity(session.sessionId(), pending);
                session.flushed(pending);
                written++;
            } catch (DataAccessException e) {
                log.warn("[Session] Activity flush failed for {}, will retry: {}",
                        session.sessionId(), e.getMessage());
            }
        }
        return written;
    }

    public int trackedCount() {
        return sessions.size();
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private SessionState advance(TrackedSession session, Instant now) {
        boolean ended = false;
        boolean clockWentBack = false;
        SessionNotice notice = null;
        synchronized (session) {
            if (session.state().isFinal()) {
                return session.state();
            }
            Principal principal = session.principal();
            if (!principal.isActive()) {
                ended = session.end(SessionState.TERMINATED, SessionEndReason.ACCOUNT_STATUS, now);
            } else if (principal.isPasswordExpired(now, policy.passwordRotation())) {
                ended = session.end(SessionState.TERMINATED, SessionEndReason.PASSWORD_EXPIRED, now);
            } else {
                Duration idle = Duration.between(session.lastActivity(), now);
                if (idle.isNegative()) {
                    clockWentBack = true;
                    ended = session.end(SessionState.TERMINATED, SessionEndReason.INTEGRITY_VIOLATION, now);
                } else {
                    Duration timeout = timeoutOf(session);
                    if (idle.compareTo(timeout) >= 0) {
                        ended = session.end(SessionState.EXPIRED, SessionEndReason.INACTIVITY_TIMEOUT, now);
                    } else {
                        boolean warning = idle.compareTo(timeout.minus(policy.warningWindow())) >= 0;
                        if (session.setLiveState(warning ? SessionState.WARNING : SessionState.ACTIVE)) {
                            long remainingMs = timeout.minus(idle).toMillis();
                            notice = warning
                                    ? SessionNotice.warning(session.sessionId(), remainingMs, now)
                                    : SessionNotice.resumed(session.sessionId(), remainingMs, now);
                        }
                    }
                }
            }
        }
        if (ended) {
            onEnded(session);
        }
        if (notice != null) {
            log.debug("[Session] {} → {}", session.sessionId(), notice.state());
            eventPublisher.publish(notice);
        }
        if (clockWentBack) {
            throw new SessionIntegrityException("Session " + session.sessionId()
                    + " has activity time after the current time");
        }
        return session.state();
    }

    /** For background paths: an integrity failure is already logged and the session ended. */
    private SessionState advanceQuietly(TrackedSession session, Instant now) {
        try {
            return advance(session, now);
        } catch (SessionIntegrityException e) {
            log.warn("[Session] {}", e.getMessage());
            return session.state();
        }
    }

    private Duration remaining(TrackedSession session, Instant now) {
        synchronized (session) {
            if (session.state().isFinal()) {
                return Duration.ZERO;
            }
            Duration left = timeoutOf(session).minus(Duration.between(session.lastActivity(), now));
            return left.isNegative() ? Duration.ZERO : left;
        }
    }

    private Duration timeoutOf(TrackedSession session) {
        return policy.policyFor(session.securityLevel()).sessionTimeout();
    }

    private void enforceConcurrency(Long userId, String keptSessionId, SecurityLevel level, Instant now) {
        List<TrackedSession> others = liveSessionsOf(userId, keptSessionId, now);
        if (others.isEmpty()) {
            return;
        }
        boolean allowed = policy.policyFor(level).allowConcurrentSessions()
                && others.stream().allMatch(s -> policy.policyFor(s.securityLevel()).allowConcurrentSessions());
        if (allowed) {
            return;
        }
        for (TrackedSession prior : others) {
            if (prior.end(SessionState.TERMINATED, SessionEndReason.CONCURRENT_SESSION, now)) {
                eventLog.logSecurityEvent(SecurityEvent
                        .success(SecurityEventType.CONCURRENT_SESSION, userId, prior.sessionId(), now)
                        .withDetail("supersededBy", keptSessionId)
                        .withDetail("level", level.name())
                        .withClient(prior.clientIp(), prior.userAgent()));
                onEnded(prior);
            }
        }
    }

    private List<TrackedSession> liveSessionsOf(Long userId, String excludeSessionId, Instant now) {
        List<TrackedSession> live = new ArrayList<>();
        for (UserSession row : sessionRepository.findByUserIdAndStatus(userId, SessionState.ACTIVE)) {
            if (row.getSessionId().equals(excludeSessionId)) {
                continue;
            }
            Optional<TrackedSession> tracked;
            try {
                tracked = resolve(row);
            } catch (SessionIntegrityException e) {
                continue;
            }
            tracked.filter(s -> advanceQuietly(s, now).isLive()).ifPresent(live::add);
        }
        return live;
    }

    private Optional<TrackedSession> resolve(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        TrackedSession tracked = sessions.get(sessionId);
        if (tracked != null) {
            return Optional.of(tracked);
        }
        return sessionRepository.findBySessionId(sessionId).flatMap(this::resolve);
    }

    /** Reloads a persisted live session into memory. */
    private Optional<TrackedSession> resolve(UserSession row) {
        TrackedSession tracked = sessions.get(row.getSessionId());
        if (tracked != null) {
            return Optional.of(tracked);
        }
        if (row.getStatus() != SessionState.ACTIVE) {
            return Optional.empty();
        }
        Optional<User> owner = userRepository.findById(row.getUserId());
        if (owner.isEmpty()) {
            return Optional.empty();
        }
        TrackedSession loaded;
        try {
            loaded = new TrackedSession(row.getSessionId(), owner.get().toPrincipal(), row.getLoginTime(),
                    row.getLastActivityTime(), row.isMfaVerified(), row.getMfaFailures(),
                    row.getClientIp(), row.getUserAgent());
        } catch (SessionIntegrityException e) {
            rejectCorruptRow(row, e);
            throw e;
        }
        TrackedSession raced = sessions.putIfAbsent(loaded.sessionId(), loaded);
        return Optional.of(raced != null ? raced : loaded);
    }

    private void rejectCorruptRow(UserSession row, SessionIntegrityException cause) {
        Instant now = clock.instant();
        log.error("[Session] Corrupt session row {}: {}", row.getSessionId(), cause.getMessage());
        eventLog.logSecurityEvent(SecurityEvent
                .failure(SecurityEventType.SUSPICIOUS_ACTIVITY, row.getUserId(), row.getSessionId(), now)
                .withDetail("reason", SessionEndReason.INTEGRITY_VIOLATION.name())
                .withClient(row.getClientIp(), row.getUserAgent()));
        persistEnd(row.getSessionId(), SessionState.TERMINATED, SessionEndReason.INTEGRITY_VIOLATION, now);
    }

    private void onEnded(TrackedSession session) {
        SessionState     state  = session.state();
        SessionEndReason reason = session.endReason();
        Instant          at     = session.endedAt();
        Long             userId = session.principal().id();

        persistEnd(session);

        if (reason == SessionEndReason.INTEGRITY_VIOLATION) {
            eventLog.logSecurityEvent(SecurityEvent
                    .failure(SecurityEventType.SUSPICIOUS_ACTIVITY, userId, session.sessionId(), at)
                    .withDetail("reason", reason.name())
                    .withDetail("lastActivity", String.valueOf(session.lastActivity()))
                    .withClient(session.clientIp(), session.userAgent()));
        }

        SecurityEvent event = state == SessionState.EXPIRED
                ? SecurityEvent.success(SecurityEventType.SESSION_TIMEOUT, userId, session.sessionId(), at)
                : SecurityEvent.of(SecurityEventType.LOGOUT, userId, session.sessionId(),
                        reason == SessionEndReason.SIGN_OUT, at);
        if (reason == SessionEndReason.MFA_ATTEMPTS_EXCEEDED) {
            event = event.withRisk(RiskLevel.HIGH);
        }
        eventLog.logSecurityEvent(event
                .withDetail("reason", reason.name())
                .withClient(session.clientIp(), session.userAgent()));

        eventPublisher.publish(SessionNotice.ended(session.sessionId(), state, reason, at));
        log.info("[Session] {} ended: {} ({}) user={}", session.sessionId(), state, reason, userId);
    }

    /** Writes the final state; on failure the session stays tracked for the next sweep. */
    private void persistEnd(TrackedSession session) {
        if (persistEnd(session.sessionId(), session.state(), session.endReason(), session.endedAt())) {
            session.markEndPersisted();
        }
    }

    private boolean persistEnd(String sessionId, SessionState state, SessionEndReason reason, Instant at) {
        try {
            sessionRepository.markEnded(sessionId, state, reason, at);
            return true;
        } catch (DataAccessException e) {
            log.error("[Session] Could not persist end of {} ({}), will retry: {}",
                    sessionId, reason, e.getMessage());
            return false;
        }
    }

    /** Makes the session visible in memory only once its row is committed. */
    private void registerAfterCommit(TrackedSession tracked) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    sessions.putIfAbsent(tracked.sessionId(), tracked);
                }
            });
        } else {
            sessions.putIfAbsent(tracked.sessionId(), tracked);
        }
    }
}
