package com.makeitso.ledger.auth;

import com.makeitso.ledger.audit.SecurityEvent;
import com.makeitso.ledger.audit.SecurityEventLog;
import com.makeitso.ledger.audit.SecurityEventType;
import com.makeitso.ledger.config.SecurityPolicyProperties;
import com.makeitso.ledger.domain.User;
import com.makeitso.ledger.security.AccountStatus;
import com.makeitso.ledger.security.SecurityLevel;
import com.makeitso.ledger.security.SecurityLevelClassifier;
import com.makeitso.ledger.security.SecurityLevelPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Failed-login counting and time-boxed account locks.
 *
 * The threshold and lock length come from the policy of the level a fresh session
 * for the user would start at. Works on managed entities: callers hold the
 * transaction. Accounts locked by an administrator (no lockedUntil) are never
 * released here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountLockoutService {

    private final SecurityPolicyProperties policy;
    private final SecurityEventLog         eventLog;

    /** @return true if the account was locked by this failure */
    public boolean recordFailure(User user, Instant now) {
        int attempts = user.getFailedLoginAttempts() + 1;
        user.setFailedLoginAttempts(attempts);

        SecurityLevelPolicy levelPolicy = policyFor(user);
        if (attempts < levelPolicy.maxFailedAttempts() || user.getAccountStatus() != AccountStatus.ACTIVE) {
            return false;
        }

        Instant until = now.plus(levelPolicy.lockoutDuration());
        user.setAccountStatus(AccountStatus.LOCKED);
        user.setLockedUntil(until);
        log.warn("[Auth] Locking user={} after {} failed attempts until {}", user.getId(), attempts, until);
        eventLog.logSecurityEvent(SecurityEvent
                .success(SecurityEventType.ACCOUNT_LOCKED, user.getId(), null, now)
                .withDetail("failedAttempts", attempts)
                .withDetail("lockedUntil", until.toString()));
        return true;
    }

    public void recordSuccess(User user) {
        user.setFailedLoginAttempts(0);
    }

    /** Lifts a lockout whose time is up. @return true if the account was unlocked */
    public boolean releaseIfExpired(User user, Instant now) {
        if (user.getAccountStatus() != AccountStatus.LOCKED
                || user.getLockedUntil() == null
                || now.isBefore(user.getLockedUntil())) {
            return false;
        }
        user.setAccountStatus(AccountStatus.ACTIVE);
        user.setLockedUntil(null);
        user.setFailedLoginAttempts(0);
        log.info("[Auth] Lockout expired for user={}", user.getId());
        eventLog.logSecurityEvent(SecurityEvent
                .success(SecurityEventType.ACCOUNT_UNLOCKED, user.getId(), null, now)
                .withDetail("reason", "LOCKOUT_EXPIRED"));
        return true;
    }

    private SecurityLevelPolicy policyFor(User user) {
        SecurityLevel level = SecurityLevelClassifier.classify(user.toPrincipal(), false);
        return policy.policyFor(level);
    }
}
