package com.makeitso.ledger.admin.dto;

import com.makeitso.ledger.domain.User;
import com.makeitso.ledger.security.AccountStatus;
import com.makeitso.ledger.security.Permission;
import com.makeitso.ledger.security.PermissionRegistry;
import com.makeitso.ledger.security.Role;

import java.util.Set;

/** Admin view of a user. Permissions are the effective set for the role. */
public record UserView(
        Long            id,
        String          email,
        String          displayName,
        Role            role,
        Set<Permission> permissions,
        AccountStatus   accountStatus,
        boolean         mfaEnabled
) {

    public static UserView from(User user) {
        return new UserView(
                user.getId(),
                user.getEmail(),
                user.getDisplayName(),
                user.getRole(),
                PermissionRegistry.permissionsFor(user.getRole()),
                user.getAccountStatus(),
                user.isMfaEnabled()
        );
    }
}
