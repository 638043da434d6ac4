package com.makeitso.ledger.security;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pure access decisions over a {@link Principal}.
 *
 * Nothing here logs or mutates. A null principal is denied everything.
 * Callers that need an audit trail of decisions wrap these calls themselves.
 */
public final class AuthorizationEvaluator {

    private AuthorizationEvaluator() {
    }

    public static boolean hasPermission(Principal principal, Permission permission) {
        if (principal == null || permission == null) {
            return false;
        }
        return principal.effectivePermissions().contains(permission);
    }

    /** Logical OR. An empty requirement is never satisfied. */
    public static boolean hasAnyPermission(Principal principal, Collection<Permission> permissions) {
        if (principal == null || permissions == null) {
            return false;
        }
        Set<Permission> held = principal.effectivePermissions();
        return permissions.stream().anyMatch(held::contains);
    }

    /** Logical AND. An empty requirement is trivially satisfied. */
    public static boolean hasAllPermissions(Principal principal, Collection<Permission> permissions) {
        if (principal == null || permissions == null) {
            return false;
        }
        return principal.effectivePermissions().containsAll(permissions);
    }

    /** Exact match, or any role when the principal is an administrator. */
    public static boolean hasRole(Principal principal, Role role) {
        if (principal == null || role == null) {
            return false;
        }
        return principal.role() == role || principal.isAdministrator();
    }

    public static boolean hasMinimumRole(Principal principal, Role minimum) {
        if (principal == null || minimum == null) {
            return false;
        }
        return principal.role().isAtLeast(minimum);
    }

    /**
     * Inactive accounts are denied outright; otherwise the minimum role (when given)
     * and every listed permission must hold.
     */
    public static boolean canAccessResource(Principal principal,
                                            Collection<Permission> requiredPermissions,
                                            Role requiredRole) {
        if (principal == null || !principal.isActive()) {
            return false;
        }
        if (requiredRole != null && !hasMinimumRole(principal, requiredRole)) {
            return false;
        }
        return hasAllPermissions(principal, requiredPermissions);
    }

    public static boolean canAccessResource(Principal principal, Collection<Permission> requiredPermissions) {
        return canAccessResource(principal, requiredPermissions, null);
    }

    /** Keeps the items whose required permissions the principal holds in full. */
    public static <T> List<T> filterByPermissions(Collection<T> items,
                                                  Principal principal,
                                                  Function<T, Collection<Permission>> requiredPermissions) {
        return items.stream()
                .filter(item -> hasAllPermissions(principal, requiredPermissions.apply(item)))
                .collect(Collectors.toList());
    }
}
