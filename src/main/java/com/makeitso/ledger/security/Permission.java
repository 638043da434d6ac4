package com.makeitso.ledger.security;

/**
 * Fine-grained operation tags. Independent of role; roles map onto sets of these
 * through {@link PermissionRegistry}.
 */
public enum Permission {

    // accounts
    VIEW_ACCOUNTS,
    CREATE_ACCOUNTS,
    EDIT_ACCOUNTS,
    DELETE_ACCOUNTS,

    // transactions
    VIEW_TRANSACTIONS,
    CREATE_TRANSACTIONS,
    EDIT_TRANSACTIONS,
    DELETE_TRANSACTIONS,
    APPROVE_TRANSACTIONS,

    // reports
    VIEW_REPORTS,
    CREATE_REPORTS,
    EXPORT_REPORTS,

    // user management
    VIEW_USERS,
    CREATE_USERS,
    EDIT_USERS,
    DELETE_USERS,
    MANAGE_ROLES,

    // system
    VIEW_AUDIT_LOGS,
    MANAGE_SETTINGS,
    BACKUP_DATA,

    // compliance
    VIEW_COMPLIANCE,
    MANAGE_COMPLIANCE,
    EXPORT_COMPLIANCE
}
