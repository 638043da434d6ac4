package com.makeitso.ledger.security;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.makeitso.ledger.security.Permission.*;

/**
 * Static role → permission mapping.
 *
 * Each role's set is declared on its own; there is no inheritance chain.
 * ADMINISTRATOR always maps to the full enumeration, so permissions added
 * later are picked up without touching this table.
 */
public final class PermissionRegistry {

    private static final Map<Role, Set<Permission>> ROLE_PERMISSIONS = new EnumMap<>(Role.class);

    static {
        ROLE_PERMISSIONS.put(Role.ADMINISTRATOR, EnumSet.allOf(Permission.class));

        ROLE_PERMISSIONS.put(Role.MANAGER, EnumSet.of(
                VIEW_ACCOUNTS, CREATE_ACCOUNTS, EDIT_ACCOUNTS,
                VIEW_TRANSACTIONS, CREATE_TRANSACTIONS, EDIT_TRANSACTIONS, APPROVE_TRANSACTIONS,
                VIEW_REPORTS, CREATE_REPORTS, EXPORT_REPORTS,
                VIEW_USERS, CREATE_USERS, EDIT_USERS,
                VIEW_COMPLIANCE));

        ROLE_PERMISSIONS.put(Role.ANALYST, EnumSet.of(
                VIEW_ACCOUNTS,
                VIEW_TRANSACTIONS,
                VIEW_REPORTS, CREATE_REPORTS, EXPORT_REPORTS,
                VIEW_COMPLIANCE));

        ROLE_PERMISSIONS.put(Role.STANDARD_USER, EnumSet.of(
                VIEW_ACCOUNTS, CREATE_ACCOUNTS,
                VIEW_TRANSACTIONS, CREATE_TRANSACTIONS,
                VIEW_REPORTS));

        ROLE_PERMISSIONS.put(Role.READ_ONLY, EnumSet.of(
                VIEW_ACCOUNTS,
                VIEW_TRANSACTIONS,
                VIEW_REPORTS));

        for (Role role : Role.values()) {
            if (!ROLE_PERMISSIONS.containsKey(role)) {
                throw new ExceptionInInitializerError("No permission set declared for role " + role);
            }
        }
    }

    private PermissionRegistry() {
    }

    /**
     * Permissions granted to {@code role}. The returned set is unmodifiable.
     *
     * @throws NullPointerException if role is null
     */
    public static Set<Permission> permissionsFor(Role role) {
        if (role == null) {
            throw new NullPointerException("role");
        }
        return Collections.unmodifiableSet(ROLE_PERMISSIONS.get(role));
    }
}
