package com.makeitso.ledger.auth;

import com.makeitso.ledger.audit.RiskLevel;
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
import com.makeitso.ledger.security.Principal;
import com.makeitso.ledger.security.Role;
import com.makeitso.ledger.security.SecurityLevel;
import com.makeitso.ledger.session.SessionLifecycleMonitor;
import com.makeitso.ledger.session.TrackedSession;
import com.makeitso.ledger.support.MutableClock;
import com.makeitso.ledger.support.Principals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.makeitso.ledger.support.Principals.principal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService")
class AuthServiceTest {

    private static final Instant NOW = Principals.T0.plus(Duration.ofDays(1));
    private static final ClientInfo BROWSER = new ClientInfo("203.0.113.7",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_5) AppleWebKit/605.1.15 Safari/605.1.15");

    @Mock private UserRepository          userRepository;
    @Mock private PasswordEncoder         passwordEncoder;
    @Mock private CredentialVerifier      credentialVerifier;
    @Mock private MfaCodeVerifier         mfaCodeVerifier;
    @Mock private AccountLockoutService   lockoutService;
    @Mock private SessionLifecycleMonitor sessionMonitor;
    @Mock private SecurityEventLog        eventLog;

    private MutableClock clock;
    private JwtUtil jwtUtil;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        jwtUtil = new JwtUtil("test-secret-key-that-is-at-least-32-bytes-long", 3_600_000, clock);
        authService = new AuthService(userRepository, passwordEncoder, credentialVerifier, mfaCodeVerifier,
                lockoutService, sessionMonitor, eventLog, SecurityPolicyProperties.defaults(), jwtUtil, clock);
    }

    private List<SecurityEvent> loggedEvents() {
        ArgumentCaptor<SecurityEvent> captor = ArgumentCaptor.forClass(SecurityEvent.class);
        verify(eventLog, atLeast(0)).logSecurityEvent(captor.capture());
        return captor.getAllValues();
    }

    private List<SecurityEvent> loggedEvents(SecurityEventType type) {
        return loggedEvents().stream().filter(e -> e.type() == type).toList();
    }

    private TrackedSession trackedSession(String sessionId, SecurityLevel level) {
        TrackedSession session = mock(TrackedSession.class);
        when(session.sessionId()).thenReturn(sessionId);
        when(session.securityLevel()).thenReturn(level);
        return session;
    }

    // ── Login ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("login")
    class Login {

        @Test
        @DisplayName("Wrong password logs exactly one high-risk LoginFailure and opens no session")
        void wrongPassword() {
            // given
            User user = Principals.user(1, Role.STANDARD_USER, false);
            when(userRepository.findByEmail("user1@example.com")).thenReturn(Optional.of(user));
            when(credentialVerifier.verifyCredentials("user1@example.com", "wrong")).thenReturn(null);

            // when / then
            assertThatThrownBy(() -> authService.login(new LoginRequest(" User1@Example.com ", "wrong"), BROWSER))
                    .isInstanceOf(AuthenticationFailedException.class)
                    .hasMessage(AuthenticationFailedException.INVALID_CREDENTIALS);

            List<SecurityEvent> failures = loggedEvents(SecurityEventType.LOGIN_FAILURE);
            assertThat(failures).hasSize(1);
            SecurityEvent failure = failures.get(0);
            assertThat(failure.success()).isFalse();
            assertThat(failure.riskLevel()).isEqualTo(RiskLevel.HIGH);
            assertThat(failure.userId()).isEqualTo(1L);
            assertThat(failure.clientIp()).isEqualTo(BROWSER.ip());
            assertThat(loggedEvents()).hasSize(1);
            verify(lockoutService).recordFailure(user, NOW);
            verify(sessionMonitor, never()).open(any(), any(), any());
        }

        @Test
        @DisplayName("Unknown email fails the same way with no user id")
        void unknownEmail() {
            when(userRepository.findByEmail("ghost@example.com")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> authService.login(new LoginRequest("ghost@example.com", "whatever"), BROWSER))
                    .isInstanceOf(AuthenticationFailedException.class)
                    .hasMessage(AuthenticationFailedException.INVALID_CREDENTIALS);

            assertThat(loggedEvents(SecurityEventType.LOGIN_FAILURE)).singleElement()
                    .satisfies(e -> assertThat(e.userId()).isNull());
            verify(lockoutService, never()).recordFailure(any(), any());
        }

        @Test
        @DisplayName("Valid credentials open a session and return a token naming it")
        void success() {
            // given
            User user = Principals.user(2, Role.ANALYST, false);
            Principal principal = user.toPrincipal();
            when(userRepository.findByEmail("user2@example.com")).thenReturn(Optional.of(user));
            when(credentialVerifier.verifyCredentials("user2@example.com", "s3cret-pass")).thenReturn(principal);
            when(userRepository.findById(2L)).thenReturn(Optional.of(user));
            TrackedSession session = trackedSession("sess-2", SecurityLevel.LOW);
            when(sessionMonitor.open(principal, BROWSER.ip(), BROWSER.userAgent())).thenReturn(session);

            // when
            AuthResponse response = authService.login(new LoginRequest("user2@example.com", "s3cret-pass"), BROWSER);

            // then
            assertThat(response.sessionId()).isEqualTo("sess-2");
            assertThat(response.securityLevel()).isEqualTo(SecurityLevel.LOW);
            assertThat(response.wsSubscribePath()).isEqualTo("/topic/session/sess-2");
            assertThat(jwtUtil.verify(response.token())).contains(new JwtUtil.TokenClaims(2L, "sess-2"));
            assertThat(user.getLastLoginTime()).isEqualTo(NOW);
            verify(lockoutService).recordSuccess(user);

            assertThat(loggedEvents(SecurityEventType.LOGIN_SUCCESS)).singleElement()
                    .satisfies(e -> {
                        assertThat(e.sessionId()).isEqualTo("sess-2");
                        assertThat(e.details()).containsEntry("securityLevel", "LOW");
                    });
            assertThat(loggedEvents(SecurityEventType.SUSPICIOUS_ACTIVITY)).isEmpty();
        }

        @Test
        @DisplayName("Locked account is refused with the generic message")
        void lockedAccount() {
            User user = Principals.user(3, Role.STANDARD_USER, false);
            user.setAccountStatus(AccountStatus.LOCKED);
            when(userRepository.findByEmail("user3@example.com")).thenReturn(Optional.of(user));
            when(credentialVerifier.verifyCredentials("user3@example.com", "right")).thenReturn(user.toPrincipal());
            when(userRepository.findById(3L)).thenReturn(Optional.of(user));

            assertThatThrownBy(() -> authService.login(new LoginRequest("user3@example.com", "right"), BROWSER))
                    .isInstanceOf(AuthenticationFailedException.class)
                    .hasMessage(AuthenticationFailedException.INVALID_CREDENTIALS);

            assertThat(loggedEvents(SecurityEventType.LOGIN_FAILURE)).singleElement()
                    .satisfies(e -> assertThat(e.details()).containsEntry("reason", "ACCOUNT_LOCKED"));
            verify(sessionMonitor, never()).open(any(), any(), any());
        }

        @Test
        @DisplayName("Expired password is refused before any session exists")
        void expiredPassword() {
            clock.set(Principals.T0.plus(Duration.ofDays(91)));
            User user = Principals.user(4, Role.STANDARD_USER, false);
            when(userRepository.findByEmail("user4@example.com")).thenReturn(Optional.of(user));
            when(credentialVerifier.verifyCredentials("user4@example.com", "old-pass")).thenReturn(user.toPrincipal());
            when(userRepository.findById(4L)).thenReturn(Optional.of(user));

            assertThatThrownBy(() -> authService.login(new LoginRequest("user4@example.com", "old-pass"), BROWSER))
                    .isInstanceOf(PasswordExpiredException.class);

            assertThat(loggedEvents(SecurityEventType.LOGIN_FAILURE)).singleElement()
                    .satisfies(e -> assertThat(e.details()).containsEntry("reason", "PASSWORD_EXPIRED"));
            verify(sessionMonitor, never()).open(any(), any(), any());
        }

        @Test
        @DisplayName("Automated user agent is flagged but still signed in")
        void suspiciousAgent() {
            ClientInfo bot = new ClientInfo("198.51.100.9", "python-requests automated");
            User user = Principals.user(5, Role.STANDARD_USER, false);
            Principal principal = user.toPrincipal();
            when(userRepository.findByEmail("user5@example.com")).thenReturn(Optional.of(user));
            when(credentialVerifier.verifyCredentials("user5@example.com", "pw-12345")).thenReturn(principal);
            when(userRepository.findById(5L)).thenReturn(Optional.of(user));
            TrackedSession session = trackedSession("sess-5", SecurityLevel.LOW);
            when(sessionMonitor.open(principal, bot.ip(), bot.userAgent())).thenReturn(session);

            AuthResponse response = authService.login(new LoginRequest("user5@example.com", "pw-12345"), bot);

            assertThat(response.token()).isNotBlank();
            assertThat(loggedEvents(SecurityEventType.SUSPICIOUS_ACTIVITY)).singleElement()
                    .satisfies(e -> {
                        assertThat(e.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
                        assertThat(e.details()).containsEntry("reason", "SUSPICIOUS_USER_AGENT");
                    });
        }
    }

    // ── MFA ──────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("verifyMfa")
    class VerifyMfa {

        private final Principal principal = principal(7, Role.MANAGER, true);
        private final AuthenticatedSession caller = new AuthenticatedSession("sess-7", principal);

        private TrackedSession liveSession() {
            TrackedSession session = mock(TrackedSession.class);
            when(session.principal()).thenReturn(principal);
            when(session.sessionId()).thenReturn("sess-7");
            when(sessionMonitor.requireLive("sess-7")).thenReturn(session);
            return session;
        }

        @Test
        @DisplayName("Correct code raises the session level and logs MfaVerified")
        void correctCode() {
            liveSession();
            when(mfaCodeVerifier.verify(principal, "123456")).thenReturn(true);
            when(sessionMonitor.markMfaVerified("sess-7")).thenReturn(SecurityLevel.HIGH);

            MfaResponse response = authService.verifyMfa(caller, "123456");

            assertThat(response.mfaVerified()).isTrue();
            assertThat(response.securityLevel()).isEqualTo(SecurityLevel.HIGH);
            assertThat(loggedEvents(SecurityEventType.MFA_VERIFIED)).hasSize(1);
        }

        @Test
        @DisplayName("Wrong code counts a failure and is rejected")
        void wrongCode() {
            liveSession();
            when(mfaCodeVerifier.verify(any(), anyString())).thenReturn(false);

            assertThatThrownBy(() -> authService.verifyMfa(caller, "000000"))
                    .isInstanceOf(AuthenticationFailedException.class)
                    .hasMessage(AuthenticationFailedException.INVALID_CODE);

            verify(sessionMonitor).recordMfaFailure("sess-7");
            verify(sessionMonitor, never()).markMfaVerified(any());
            assertThat(loggedEvents(SecurityEventType.MFA_FAILED)).singleElement()
                    .satisfies(e -> assertThat(e.details()).containsEntry("failures", 1));
        }

        @Test
        @DisplayName("Account without MFA cannot verify")
        void mfaDisabled() {
            Principal plain = principal(8, Role.STANDARD_USER, false);
            TrackedSession session = mock(TrackedSession.class);
            when(session.principal()).thenReturn(plain);
            when(sessionMonitor.requireLive("sess-8")).thenReturn(session);

            assertThatThrownBy(() -> authService.verifyMfa(new AuthenticatedSession("sess-8", plain), "123456"))
                    .isInstanceOf(IllegalStateException.class);
            verify(mfaCodeVerifier, never()).verify(any(), any());
        }
    }

    // ── Register / password / logout ─────────────────────────────────────────

    @Nested
    @DisplayName("account maintenance")
    class Maintenance {

        @Test
        @DisplayName("Register stores a Standard User with a normalised email and issues no token")
        void register() {
            when(userRepository.existsByEmail("new@example.com")).thenReturn(false);
            when(passwordEncoder.encode("long-enough")).thenReturn("$2a$10$encoded");
            when(userRepository.save(any(User.class))).thenAnswer(inv -> {
                User saved = inv.getArgument(0);
                saved.setId(99L);
                return saved;
            });

            AuthResponse response = authService.register(new RegisterRequest(" New@Example.com", "long-enough", null));

            assertThat(response.userId()).isEqualTo(99L);
            assertThat(response.email()).isEqualTo("new@example.com");
            assertThat(response.displayName()).isEqualTo("new@example.com");
            assertThat(response.role()).isEqualTo(Role.STANDARD_USER);
            assertThat(response.token()).isNull();
            assertThat(response.sessionId()).isNull();
        }

        @Test
        @DisplayName("Register rejects a taken email")
        void registerDuplicate() {
            when(userRepository.existsByEmail("taken@example.com")).thenReturn(true);

            assertThatThrownBy(() -> authService.register(new RegisterRequest("taken@example.com", "long-enough", "T")))
                    .isInstanceOf(EmailAlreadyRegisteredException.class);
            verify(userRepository, never()).save(any());
        }

        @Test
        @DisplayName("Password change resets the rotation clock and refreshes live sessions")
        void changePassword() {
            clock.set(Principals.T0.plus(Duration.ofDays(95)));
            User user = Principals.user(9, Role.STANDARD_USER, false);
            when(userRepository.findByEmail("user9@example.com")).thenReturn(Optional.of(user));
            when(credentialVerifier.verifyCredentials("user9@example.com", "old-pass")).thenReturn(user.toPrincipal());
            when(userRepository.findById(9L)).thenReturn(Optional.of(user));
            when(passwordEncoder.encode("new-pass-123")).thenReturn("$2a$10$new");

            authService.changePassword(new ChangePasswordRequest("user9@example.com", "old-pass", "new-pass-123"), BROWSER);

            assertThat(user.getPasswordHash()).isEqualTo("$2a$10$new");
            assertThat(user.getPasswordChangedAt()).isEqualTo(clock.instant());
            verify(sessionMonitor).principalChanged(any(Principal.class));
            assertThat(loggedEvents(SecurityEventType.PASSWORD_CHANGE)).singleElement()
                    .satisfies(e -> assertThat(e.success()).isTrue());
        }

        @Test
        @DisplayName("Password change with the wrong current password counts toward lockout")
        void changePasswordWrongCurrent() {
            User user = Principals.user(10, Role.STANDARD_USER, false);
            when(userRepository.findByEmail("user10@example.com")).thenReturn(Optional.of(user));
            when(credentialVerifier.verifyCredentials("user10@example.com", "nope")).thenReturn(null);

            assertThatThrownBy(() -> authService.changePassword(
                    new ChangePasswordRequest("user10@example.com", "nope", "new-pass-123"), BROWSER))
                    .isInstanceOf(AuthenticationFailedException.class);

            verify(lockoutService).recordFailure(user, NOW);
            verify(passwordEncoder, never()).encode(any());
        }

        @Test
        @DisplayName("Logout signs the caller's session out")
        void logout() {
            when(sessionMonitor.signOut("sess-11")).thenReturn(true);

            authService.logout(new AuthenticatedSession("sess-11", principal(11, Role.ANALYST, false)));

            verify(sessionMonitor).signOut("sess-11");
        }
    }
}
