package com.makeitso.ledger.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionRegistry")
class PermissionRegistryTest {

    @Test
    @DisplayName("Administrator holds every permission")
    void administratorHoldsEverything() {
        assertThat(PermissionRegistry.permissionsFor(Role.ADMINISTRATOR))
                .containsExactlyInAnyOrderElementsOf(EnumSet.allOf(Permission.class));
    }

    @ParameterizedTest
    @EnumSource(Role.class)
    @DisplayName("Every role maps to a non-empty, unmodifiable set")
    void everyRoleIsMapped(Role role) {
        var permissions = PermissionRegistry.permissionsFor(role);

        assertThat(permissions).isNotEmpty();
        assertThatThrownBy(() -> permissions.add(Permission.MANAGE_SETTINGS))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Read-only is limited to the view permissions")
    void readOnlyOnlyViews() {
        assertThat(PermissionRegistry.permissionsFor(Role.READ_ONLY))
                .containsExactlyInAnyOrder(Permission.VIEW_ACCOUNTS, Permission.VIEW_TRANSACTIONS, Permission.VIEW_REPORTS);
    }

    @Test
    @DisplayName("Standard user may view and create accounts but never delete or manage roles")
    void standardUserScope() {
        assertThat(PermissionRegistry.permissionsFor(Role.STANDARD_USER))
                .contains(Permission.VIEW_ACCOUNTS, Permission.CREATE_ACCOUNTS, Permission.CREATE_TRANSACTIONS)
                .doesNotContain(Permission.DELETE_ACCOUNTS, Permission.MANAGE_ROLES, Permission.VIEW_AUDIT_LOGS);
    }

    @Test
    @DisplayName("Only Administrator can manage roles or read the audit log")
    void privilegedPermissionsAreAdminOnly() {
        for (Role role : Role.values()) {
            if (role == Role.ADMINISTRATOR) {
                continue;
            }
            assertThat(PermissionRegistry.permissionsFor(role))
                    .as(role.name())
                    .doesNotContain(Permission.MANAGE_ROLES, Permission.VIEW_AUDIT_LOGS, Permission.BACKUP_DATA);
        }
    }

    @Test
    @DisplayName("Every role includes the read-only view permissions")
    void everyRoleCanView() {
        for (Role role : Role.values()) {
            assertThat(PermissionRegistry.permissionsFor(role))
                    .as(role.name())
                    .containsAll(PermissionRegistry.permissionsFor(Role.READ_ONLY));
        }
    }

    @Test
    @DisplayName("Null role is rejected")
    void nullRole() {
        assertThatThrownBy(() -> PermissionRegistry.permissionsFor(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Permission groups resolve to the named permissions")
    void permissionGroups() {
        assertThat(PermissionGroup.ACCOUNT_READ.permissions()).contains(Permission.VIEW_ACCOUNTS);
        assertThat(PermissionGroup.COMPLIANCE_ADMIN.permissions()).contains(Permission.MANAGE_COMPLIANCE);
    }
}
