package com.makeitso.ledger.auth;

import com.makeitso.ledger.audit.SecurityEvent;
import com.makeitso.ledger.audit.SecurityEventLog;
import com.makeitso.ledger.audit.SecurityEventType;
import com.makeitso.ledger.auth.dto.AuthResponse;
import com.makeitso.ledger.auth.dto.ChangePasswordRequest;
import com.makeitso.ledger.auth.dto.LoginRequest;
import com.makeitso.ledger.auth.dto.MfaResponse;
import com.makeitso.ledger.auth.dto.RegisterRequest;
import com.makeitso.ledger.config.SecurityPolicyProperties;
import com.makeitso.ledger.domain.User;
import com.makeitso.ledger.repository.UserRepository;
import com.makeitso.ledger.security.AccountStatus;
import com.makeitso.ledger.security.PermissionRegistry;
import com.makeitso.ledger.security.Principal;
import com.makeitso.ledger.security.Role;
import com.makeitso.ledger.security.SecurityLevel;
import com.makeitso.ledger.session.SessionLifecycleMonitor;
import com.makeitso.ledger.session.TrackedSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Sign-in entry points: register, login, logout, MFA verification and password change.
 *
 * Every outcome is written to the security event log. Failure responses are generic;
 * the reason only appears in the event details.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository           userRepository;
    private final PasswordEncoder          passwordEncoder;
    private final CredentialVerifier       credentialVerifier;
    private final MfaCodeVerifier          mfaCodeVerifier;
    private final AccountLockoutService    lockoutService;
    private final SessionLifecycleMonitor  sessionMonitor;
    private final SecurityEventLog         eventLog;
    private final SecurityPolicyProperties policy;
    private final JwtUtil                  jwtUtil;
    private final Clock                    clock;

    // ── Register ─────────────────────────────────────────────────────────────

    @Transactional
    public AuthResponse register(RegisterRequest req) {
        String email = normalize(req.email());
        if (userRepository.existsByEmail(email)) {
            throw new EmailAlreadyRegisteredException();
        }

        User user = new User();
        user.setEmail(email);
        user.setDisplayName(req.displayName() == null || req.displayName().isBlank()
                ? email
                : req.displayName().trim());
        user.setPasswordHash(passwordEncoder.encode(req.password()));
        user.setRole(Role.STANDARD_USER);
        user.getPermissions().addAll(PermissionRegistry.permissionsFor(Role.STANDARD_USER));
        user.setAccountStatus(AccountStatus.ACTIVE);
        user.setPasswordChangedAt(clock.instant());

        User saved = userRepository.save(user);
        log.info("[Auth] New user registered: id={}", saved.getId());

        return new AuthResponse(saved.getId(), saved.getEmail(), saved.getDisplayName(), saved.getRole(),
                null, false, null, null, null);
    }

    // ── Login ────────────────────────────────────────────────────────────────

    /**
     * Verifies credentials and opens a session.
     *
     * Failed-attempt counters and lock state are committed even though the call fails.
     */
    @Transactional(noRollbackFor = {AuthenticationFailedException.class, PasswordExpiredException.class})
    public AuthResponse login(LoginRequest req, ClientInfo client) {
        Instant now = clock.instant();
        String email = normalize(req.email());
        Optional<User> known = userRepository.findByEmail(email);
        known.ifPresent(u -> lockoutService.releaseIfExpired(u, now));

        Principal principal = credentialVerifier.verifyCredentials(email, req.password());
        if (principal == null) {
            Long userId = known.map(User::getId).orElse(null);
            logFailure(SecurityEventType.LOGIN_FAILURE, userId, "INVALID_CREDENTIALS", client, now);
            known.ifPresent(u -> lockoutService.recordFailure(u, now));
            throw new AuthenticationFailedException();
        }

        User user = userRepository.findById(principal.id()).orElseThrow(AuthenticationFailedException::new);

        if (!principal.isActive()) {
            logFailure(SecurityEventType.LOGIN_FAILURE, principal.id(),
                    "ACCOUNT_" + principal.accountStatus().name(), client, now);
            throw new AuthenticationFailedException();
        }
        if (principal.isPasswordExpired(now, policy.passwordRotation())) {
            logFailure(SecurityEventType.LOGIN_FAILURE, principal.id(), "PASSWORD_EXPIRED", client, now);
            throw new PasswordExpiredException();
        }
        if (UserAgentInspector.isSuspicious(client.userAgent())) {
            log.warn("[Auth] Suspicious user agent for user={} from {}", principal.id(), client.ip());
            eventLog.logSecurityEvent(SecurityEvent
                    .failure(SecurityEventType.SUSPICIOUS_ACTIVITY, principal.id(), null, now)
                    .withDetail("reason", "SUSPICIOUS_USER_AGENT")
                    .withClient(client.ip(), client.userAgent()));
        }

        TrackedSession session = sessionMonitor.open(principal, client.ip(), client.userAgent());
        lockoutService.recordSuccess(user);
        user.setLastLoginTime(now);

        SecurityLevel level = session.securityLevel();
        eventLog.logSecurityEvent(SecurityEvent
                .success(SecurityEventType.LOGIN_SUCCESS, principal.id(), session.sessionId(), now)
                .withDetail("securityLevel", level.name())
                .withClient(client.ip(), client.userAgent()));

        String token = jwtUtil.generate(principal.id(), session.sessionId());
        return new AuthResponse(user.getId(), user.getEmail(), user.getDisplayName(), user.getRole(),
                level, principal.mfaEnabled(), session.sessionId(), token,
                "/topic/session/" + session.sessionId());
    }

    // ── Logout ───────────────────────────────────────────────────────────────

    public void logout(AuthenticatedSession caller) {
        if (!sessionMonitor.signOut(caller.sessionId())) {
            log.debug("[Auth] Logout for already-ended session {}", caller.sessionId());
        }
    }

    // ── MFA ──────────────────────────────────────────────────────────────────

    /**
     * Checks a second-factor code for the caller's session. A wrong code counts toward
     * the level's maxFailedAttempts; reaching it ends the session.
     */
    public MfaResponse verifyMfa(AuthenticatedSession caller, String code) {
        Instant now = clock.instant();
        TrackedSession session = sessionMonitor.requireLive(caller.sessionId());
        Principal principal = session.principal();
        if (!principal.mfaEnabled()) {
            throw new IllegalStateException("MFA is not enabled for this account");
        }
        if (session.mfaVerified()) {
            return new MfaResponse(true, session.securityLevel());
        }

        if (mfaCodeVerifier.verify(principal, code)) {
            SecurityLevel level = sessionMonitor.markMfaVerified(session.sessionId());
            eventLog.logSecurityEvent(SecurityEvent
                    .success(SecurityEventType.MFA_VERIFIED, principal.id(), session.sessionId(), now)
                    .withDetail("securityLevel", level.name())
                    .withClient(session.clientIp(), session.userAgent()));
            return new MfaResponse(true, level);
        }

        eventLog.logSecurityEvent(SecurityEvent
                .failure(SecurityEventType.MFA_FAILED, principal.id(), session.sessionId(), now)
                .withDetail("failures", session.mfaFailures() + 1)
                .withClient(session.clientIp(), session.userAgent()));
        sessionMonitor.recordMfaFailure(session.sessionId());
        throw new AuthenticationFailedException(AuthenticationFailedException.INVALID_CODE);
    }

    // ── Password ─────────────────────────────────────────────────────────────

    /**
     * Replaces the password after checking the current one. Open to expired passwords;
     * a wrong current password counts toward lockout like a failed login.
     */
    @Transactional(noRollbackFor = AuthenticationFailedException.class)
    public void changePassword(ChangePasswordRequest req, ClientInfo client) {
        Instant now = clock.instant();
        String email = normalize(req.email());
        Optional<User> known = userRepository.findByEmail(email);
        known.ifPresent(u -> lockoutService.releaseIfExpired(u, now));

        Principal principal = credentialVerifier.verifyCredentials(email, req.currentPassword());
        if (principal == null || !principal.isActive()) {
            Long userId = known.map(User::getId).orElse(null);
            logFailure(SecurityEventType.PASSWORD_CHANGE, userId,
                    principal == null ? "INVALID_CREDENTIALS" : "ACCOUNT_" + principal.accountStatus().name(),
                    client, now);
            if (principal == null) {
                known.ifPresent(u -> lockoutService.recordFailure(u, now));
            }
            throw new AuthenticationFailedException();
        }
        if (req.newPassword().equals(req.currentPassword())) {
            throw new IllegalArgumentException("New password must differ from the current one");
        }

        User user = userRepository.findById(principal.id()).orElseThrow(AuthenticationFailedException::new);
        user.setPasswordHash(passwordEncoder.encode(req.newPassword()));
        user.setPasswordChangedAt(now);
        lockoutService.recordSuccess(user);

        eventLog.logSecurityEvent(SecurityEvent
                .success(SecurityEventType.PASSWORD_CHANGE, user.getId(), null, now)
                .withClient(client.ip(), client.userAgent()));
        sessionMonitor.principalChanged(user.toPrincipal());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void logFailure(SecurityEventType type, Long userId, String reason, ClientInfo client, Instant now) {
        eventLog.logSecurityEvent(SecurityEvent
                .failure(type, userId, null, now)
                .withDetail("reason", reason)
                .withClient(client.ip(), client.userAgent()));
    }

    static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
