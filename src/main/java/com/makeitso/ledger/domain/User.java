package com.makeitso.ledger.domain;

import com.makeitso.ledger.security.AccountStatus;
import com.makeitso.ledger.security.Permission;
import com.makeitso.ledger.security.Principal;
import com.makeitso.ledger.security.Role;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * Ledger user: sign-in identity, role and account state.
 *
 * {@code permissions} is a denormalised copy of the role's registry set, kept in
 * sync on role changes for reporting. Access decisions never read it.
 */
@Getter
@Setter
@Entity
@Table(name = "users")
public class User extends BaseEntity {

    /** Lower-cased and trimmed before it gets here. */
    @Column(nullable = false, length = 254, unique = true)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "display_name", length = 128)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Role role = Role.STANDARD_USER;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_permissions", joinColumns = @JoinColumn(name = "user_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "permission", length = 48, nullable = false)
    private Set<Permission> permissions = new HashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "account_status", nullable = false, length = 32)
    private AccountStatus accountStatus = AccountStatus.ACTIVE;

    @Column(name = "mfa_enabled", nullable = false)
    private boolean mfaEnabled;

    @Column(name = "password_changed_at")
    private Instant passwordChangedAt;

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    /** Set while accountStatus is LOCKED by the lockout policy. */
    @Column(name = "locked_until")
    private Instant lockedUntil;

    @Column(name = "last_login_time")
    private Instant lastLoginTime;

    public Principal toPrincipal() {
        return new Principal(
                getId(),
                email,
                role,
                permissions.isEmpty() ? EnumSet.noneOf(Permission.class) : EnumSet.copyOf(permissions),
                accountStatus,
                mfaEnabled,
                passwordChangedAt);
    }
}
