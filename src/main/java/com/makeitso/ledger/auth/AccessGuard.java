package com.makeitso.ledger.auth;

import com.makeitso.ledger.security.AuthorizationEvaluator;
import com.makeitso.ledger.security.Permission;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Component;

/**
 * Endpoint-level checks on top of {@link AuthorizationEvaluator}. A denial is a
 * plain AccessDeniedException; the response never names what was missing.
 */
@Slf4j
@Component
public class AccessGuard {

    static final String DENIED = "Access denied";

    public void requirePermission(AuthenticatedSession caller, Permission permission) {
        if (caller == null || !AuthorizationEvaluator.hasPermission(caller.principal(), permission)) {
            deny(caller, permission.name());
        }
    }

    private void deny(AuthenticatedSession caller, String requirement) {
        log.info("[Auth] Denied user={} requirement={}", caller == null ? null : caller.userId(), requirement);
        throw new AccessDeniedException(DENIED);
    }
}
