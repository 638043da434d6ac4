package com.makeitso.ledger.security;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.makeitso.ledger.security.Permission.*;

/**
 * Named permission bundles for callers that guard a whole feature area
 * (e.g. "everything needed to administer users") instead of listing tags.
 *
 * Roles are not built from these; see {@link PermissionRegistry}.
 */
public enum PermissionGroup {

    ACCOUNT_READ(VIEW_ACCOUNTS),
    ACCOUNT_WRITE(VIEW_ACCOUNTS, CREATE_ACCOUNTS, EDIT_ACCOUNTS),
    ACCOUNT_ADMIN(VIEW_ACCOUNTS, CREATE_ACCOUNTS, EDIT_ACCOUNTS, DELETE_ACCOUNTS),

    TRANSACTION_READ(VIEW_TRANSACTIONS),
    TRANSACTION_WRITE(VIEW_TRANSACTIONS, CREATE_TRANSACTIONS, EDIT_TRANSACTIONS),
    TRANSACTION_ADMIN(VIEW_TRANSACTIONS, CREATE_TRANSACTIONS, EDIT_TRANSACTIONS,
            DELETE_TRANSACTIONS, APPROVE_TRANSACTIONS),

    REPORT_READ(VIEW_REPORTS),
    REPORT_WRITE(VIEW_REPORTS, CREATE_REPORTS),
    REPORT_ADMIN(VIEW_REPORTS, CREATE_REPORTS, EXPORT_REPORTS),

    USER_READ(VIEW_USERS),
    USER_WRITE(VIEW_USERS, CREATE_USERS, EDIT_USERS),
    USER_ADMIN(VIEW_USERS, CREATE_USERS, EDIT_USERS, DELETE_USERS, MANAGE_ROLES),

    SYSTEM_READ(VIEW_AUDIT_LOGS),
    SYSTEM_ADMIN(VIEW_AUDIT_LOGS, MANAGE_SETTINGS, BACKUP_DATA),

    COMPLIANCE_READ(VIEW_COMPLIANCE),
    COMPLIANCE_ADMIN(VIEW_COMPLIANCE, MANAGE_COMPLIANCE, EXPORT_COMPLIANCE);

    private final Set<Permission> permissions;

    PermissionGroup(Permission first, Permission... rest) {
        this.permissions = Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    public Set<Permission> permissions() {
        return permissions;
    }
}
