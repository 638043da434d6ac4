package com.makeitso.ledger.auth;

import com.makeitso.ledger.auth.dto.AccessCheckResponse;
import com.makeitso.ledger.security.AuthorizationEvaluator;
import com.makeitso.ledger.security.Permission;
import com.makeitso.ledger.security.Role;
import com.makeitso.ledger.session.SessionLifecycleMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lets the front end ask whether the caller may reach a resource, e.g.
 *   GET /api/access/check?permissions=EDIT_TRANSACTIONS,APPROVE_TRANSACTIONS&minimumRole=MANAGER
 */
@RestController
@RequestMapping("/api/access")
@RequiredArgsConstructor
public class AccessController {

    private final SessionLifecycleMonitor sessionMonitor;

    @GetMapping("/check")
    public ResponseEntity<AccessCheckResponse> check(
            @AuthenticationPrincipal AuthenticatedSession caller,
            @RequestParam(required = false) Set<Permission> permissions,
            @RequestParam(required = false) Role minimumRole) {

        Set<Permission> required = permissions == null || permissions.isEmpty()
                ? EnumSet.noneOf(Permission.class)
                : EnumSet.copyOf(permissions);
        boolean allowed = AuthorizationEvaluator.canAccessResource(caller.principal(), required, minimumRole);
        return ResponseEntity.ok(new AccessCheckResponse(
                allowed,
                caller.principal().role(),
                sessionMonitor.securityLevelOf(caller.sessionId())));
    }
}
