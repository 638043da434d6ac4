package com.makeitso.ledger.security;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable authorization view of a user.
 *
 * {@code storedPermissions} is whatever the user row carries; decisions are
 * made against {@link #effectivePermissions()}, which always comes from the
 * registry for the principal's role.
 */
public record Principal(
        Long            id,
        String          email,
        Role            role,
        Set<Permission> storedPermissions,
        AccountStatus   accountStatus,
        boolean         mfaEnabled,
        Instant         passwordChangedAt
) {

    public Principal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(accountStatus, "accountStatus");
        storedPermissions = storedPermissions == null || storedPermissions.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(storedPermissions));
    }

    public Set<Permission> effectivePermissions() {
        return PermissionRegistry.permissionsFor(role);
    }

    public boolean isAdministrator() {
        return role == Role.ADMINISTRATOR;
    }

    public boolean isActive() {
        return accountStatus.permitsSession();
    }

    /**
     * True once {@code rotation} has elapsed since the last password change.
     * A principal with no recorded change is treated as expired.
     */
    public boolean isPasswordExpired(Instant now, Duration rotation) {
        if (passwordChangedAt == null) {
            return true;
        }
        return !now.isBefore(passwordChangedAt.plus(rotation));
    }

    public Principal withAccountStatus(AccountStatus status) {
        return new Principal(id, email, role, storedPermissions, status, mfaEnabled, passwordChangedAt);
    }
}
