package com.makeitso.ledger.session;

import com.makeitso.ledger.security.Principal;
import com.makeitso.ledger.security.SecurityLevel;
import com.makeitso.ledger.security.SecurityLevelClassifier;

import java.time.Instant;
import java.util.Objects;

/**
 * In-memory, mutable copy of one live session.
 *
 * All transitions on one session are serialised on the instance monitor.
 * Once a final state is reached it never changes, whichever caller got there first.
 */
public final class TrackedSession {

    private final String  sessionId;
    private final Instant loginTime;
    private final String  clientIp;
    private final String  userAgent;

    private Principal        principal;
    private Instant          lastActivity;
    private Instant          persistedActivity;
    private boolean          mfaVerified;
    private int              mfaFailures;
    private SessionState     state = SessionState.ACTIVE;
    private SessionEndReason endReason;
    private Instant          endedAt;
    private boolean          endPersisted;

    TrackedSession(String sessionId, Principal principal, Instant loginTime, Instant lastActivity,
                   boolean mfaVerified, int mfaFailures, String clientIp, String userAgent) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.principal = Objects.requireNonNull(principal, "principal");
        this.loginTime = Objects.requireNonNull(loginTime, "loginTime");
        Objects.requireNonNull(lastActivity, "lastActivity");
        if (lastActivity.isBefore(loginTime)) {
            throw new SessionIntegrityException("Session " + sessionId
                    + " has last activity " + lastActivity + " before login " + loginTime);
        }
        this.lastActivity      = lastActivity;
        this.persistedActivity = lastActivity;
        this.mfaVerified       = mfaVerified;
        this.mfaFailures       = mfaFailures;
        this.clientIp          = clientIp;
        this.userAgent         = userAgent;
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant loginTime() {
        return loginTime;
    }

    public String clientIp() {
        return clientIp;
    }

    public String userAgent() {
        return userAgent;
    }

    public synchronized Principal principal() {
        return principal;
    }

    public synchronized Instant lastActivity() {
        return lastActivity;
    }

    public synchronized boolean mfaVerified() {
        return mfaVerified;
    }

    public synchronized int mfaFailures() {
        return mfaFailures;
    }

    public synchronized SessionState state() {
        return state;
    }

    public synchronized SessionEndReason endReason() {
        return endReason;
    }

    public synchronized Instant endedAt() {
        return endedAt;
    }

    public synchronized SecurityLevel securityLevel() {
        return SecurityLevelClassifier.classify(principal, mfaVerified);
    }

    // ── Transitions (package-private, driven by SessionLifecycleMonitor) ─────

    /**
     * Records activity at {@code at}. The newest timestamp wins; an older one is ignored.
     *
     * @return false if the session is already final
     */
    synchronized boolean touch(Instant at) {
        if (state.isFinal()) {
            return false;
        }
        if (at.isAfter(lastActivity)) {
            lastActivity = at;
        }
        return true;
    }

    /** Moves between ACTIVE and WARNING. No-op once final. */
    synchronized boolean setLiveState(SessionState next) {
        if (state.isFinal() || state == next) {
            return false;
        }
        state = next;
        return true;
    }

    /**
     * First final transition wins.
     *
     * @return true if this call performed the transition
     */
    synchronized boolean end(SessionState finalState, SessionEndReason reason, Instant at) {
        if (finalState.isLive()) {
            throw new IllegalArgumentException(finalState + " is not a final state");
        }
        if (state.isFinal()) {
            return false;
        }
        state     = finalState;
        endReason = reason;
        endedAt   = at;
        return true;
    }

    /** True once the final state has been written to storage. */
    synchronized boolean endPersisted() {
        return endPersisted;
    }

    synchronized void markEndPersisted() {
        endPersisted = true;
    }

    synchronized void updatePrincipal(Principal updated) {
        if (!principal.id().equals(updated.id())) {
            throw new IllegalArgumentException("Principal " + updated.id() + " does not own session " + sessionId);
        }
        principal = updated;
    }

    synchronized void verifyMfa() {
        mfaVerified = true;
        mfaFailures = 0;
    }

    synchronized int recordMfaFailure() {
        return ++mfaFailures;
    }

    /** Activity newer than what was last written to storage, or null. */
    synchronized Instant unflushedActivity() {
        return lastActivity.isAfter(persistedActivity) ? lastActivity : null;
    }

    synchronized void flushed(Instant ts) {
        if (ts.isAfter(persistedActivity)) {
            persistedActivity = ts;
        }
    }
}
