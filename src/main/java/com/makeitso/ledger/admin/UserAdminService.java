package com.makeitso.ledger.admin;

import com.makeitso.ledger.admin.dto.SecurityEventView;
import com.makeitso.ledger.admin.dto.UserView;
import com.makeitso.ledger.audit.RiskLevel;
import com.makeitso.ledger.audit.SecurityEvent;
import com.makeitso.ledger.audit.SecurityEventLog;
import com.makeitso.ledger.audit.SecurityEventType;
import com.makeitso.ledger.auth.AccessGuard;
import com.makeitso.ledger.auth.AuthenticatedSession;
import com.makeitso.ledger.domain.User;
import com.makeitso.ledger.repository.UserRepository;
import com.makeitso.ledger.security.AccountStatus;
import com.makeitso.ledger.security.Permission;
import com.makeitso.ledger.security.PermissionRegistry;
import com.makeitso.ledger.security.Role;
import com.makeitso.ledger.session.SessionLifecycleMonitor;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Administrative changes to a user's role, account status and MFA flag.
 *
 * Rules on top of the endpoint permission:
 *   - only an Administrator may change an Administrator's status or MFA flag,
 *     or move anyone into or out of the Administrator role
 *   - nobody changes their own status
 *
 * Every change is logged and pushed into the user's live sessions, which are
 * re-evaluated on the spot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserAdminService {

    static final int MAX_PAGE_SIZE = 200;

    private final UserRepository          userRepository;
    private final AccessGuard             accessGuard;
    private final SecurityEventLog        eventLog;
    private final SessionLifecycleMonitor sessionMonitor;
    private final Clock                   clock;

    // ── Role ─────────────────────────────────────────────────────────────────

    @Transactional
    public UserView changeRole(AuthenticatedSession caller, Long userId, Role newRole) {
        accessGuard.requirePermission(caller, Permission.MANAGE_ROLES);
        User user = load(userId);
        Role oldRole = user.getRole();
        if (oldRole == newRole) {
            return UserView.from(user);
        }
        if ((oldRole == Role.ADMINISTRATOR || newRole == Role.ADMINISTRATOR) && !caller.principal().isAdministrator()) {
            throw new AccessDeniedException("Administrator role change by non-administrator");
        }

        Set<Permission> before = PermissionRegistry.permissionsFor(oldRole);
        Set<Permission> after  = PermissionRegistry.permissionsFor(newRole);
        Set<Permission> granted = difference(after, before);
        Set<Permission> revoked = difference(before, after);

        user.setRole(newRole);
        user.getPermissions().clear();
        user.getPermissions().addAll(after);

        Instant now = clock.instant();
        if (!granted.isEmpty()) {
            SecurityEvent event = adminEvent(SecurityEventType.PERMISSION_GRANTED, caller, user, now)
                    .withDetail("fromRole", oldRole.name())
                    .withDetail("toRole", newRole.name())
                    .withDetail("permissions", names(granted));
            eventLog.logSecurityEvent(newRole == Role.ADMINISTRATOR ? event.withRisk(RiskLevel.CRITICAL) : event);
        }
        if (!revoked.isEmpty()) {
            eventLog.logSecurityEvent(adminEvent(SecurityEventType.PERMISSION_REVOKED, caller, user, now)
                    .withDetail("fromRole", oldRole.name())
                    .withDetail("toRole", newRole.name())
                    .withDetail("permissions", names(revoked)));
        }

        log.info("[Admin] user={} changed role of user={} {} → {}", caller.userId(), userId, oldRole, newRole);
        sessionMonitor.principalChanged(user.toPrincipal());
        return UserView.from(user);
    }

    // ── Status ───────────────────────────────────────────────────────────────

    @Transactional
    public UserView changeStatus(AuthenticatedSession caller, Long userId, AccountStatus newStatus) {
        accessGuard.requirePermission(caller, Permission.EDIT_USERS);
        if (caller.userId().equals(userId)) {
            throw new IllegalArgumentException("Cannot change the status of your own account");
        }
        User user = load(userId);
        requireAdminForAdminTarget(caller, user);

        AccountStatus oldStatus = user.getAccountStatus();
        if (oldStatus == newStatus) {
            return UserView.from(user);
        }
        user.setAccountStatus(newStatus);
        user.setLockedUntil(null);
        if (newStatus == AccountStatus.ACTIVE) {
            user.setFailedLoginAttempts(0);
        }

        eventLog.logSecurityEvent(adminEvent(statusEventType(oldStatus, newStatus), caller, user, clock.instant())
                .withDetail("fromStatus", oldStatus.name())
                .withDetail("toStatus", newStatus.name()));

        log.info("[Admin] user={} changed status of user={} {} → {}", caller.userId(), userId, oldStatus, newStatus);
        sessionMonitor.principalChanged(user.toPrincipal());
        return UserView.from(user);
    }

    private static SecurityEventType statusEventType(AccountStatus from, AccountStatus to) {
        if (to == AccountStatus.LOCKED) {
            return SecurityEventType.ACCOUNT_LOCKED;
        }
        if (from == AccountStatus.LOCKED) {
            return SecurityEventType.ACCOUNT_UNLOCKED;
        }
        return SecurityEventType.ACCOUNT_STATUS_CHANGED;
    }

    // ── MFA ──────────────────────────────────────────────────────────────────

    @Transactional
    public UserView setMfaEnabled(AuthenticatedSession caller, Long userId, boolean enabled) {
        accessGuard.requirePermission(caller, Permission.EDIT_USERS);
        User user = load(userId);
        requireAdminForAdminTarget(caller, user);
        if (user.isMfaEnabled() == enabled) {
            return UserView.from(user);
        }
        user.setMfaEnabled(enabled);

        eventLog.logSecurityEvent(adminEvent(
                enabled ? SecurityEventType.MFA_ENABLED : SecurityEventType.MFA_DISABLED,
                caller, user, clock.instant()));

        log.info("[Admin] user={} set MFA {} for user={}", caller.userId(), enabled ? "on" : "off", userId);
        sessionMonitor.principalChanged(user.toPrincipal());
        return UserView.from(user);
    }

    // ── Audit log ────────────────────────────────────────────────────────────

    public Page<SecurityEventView> recentEvents(AuthenticatedSession caller, int page, int size) {
        accessGuard.requirePermission(caller, Permission.VIEW_AUDIT_LOGS);
        int boundedSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return eventLog.recent(Math.max(0, page), boundedSize).map(SecurityEventView::from);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private User load(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new EntityNotFoundException("User not found: " + userId));
    }

    private void requireAdminForAdminTarget(AuthenticatedSession caller, User target) {
        if (target.getRole() == Role.ADMINISTRATOR && !caller.principal().isAdministrator()) {
            throw new AccessDeniedException("Administrator target requires administrator caller");
        }
    }

    private SecurityEvent adminEvent(SecurityEventType type, AuthenticatedSession caller, User target, Instant now) {
        return SecurityEvent.success(type, target.getId(), null, now)
                .withDetail("actorId", caller.userId())
                .withDetail("actorSessionId", caller.sessionId());
    }

    private static Set<Permission> difference(Set<Permission> a, Set<Permission> b) {
        Set<Permission> result = a.isEmpty() ? EnumSet.noneOf(Permission.class) : EnumSet.copyOf(a);
        result.removeAll(b);
        return result;
    }

    private static String names(Set<Permission> permissions) {
        return permissions.stream().map(Enum::name).sorted().collect(Collectors.joining(","));
    }
}
