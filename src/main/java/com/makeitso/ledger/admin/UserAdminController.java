package com.makeitso.ledger.admin;

import com.makeitso.ledger.admin.dto.MfaToggleRequest;
import com.makeitso.ledger.admin.dto.RoleChangeRequest;
import com.makeitso.ledger.admin.dto.SecurityEventView;
import com.makeitso.ledger.admin.dto.StatusChangeRequest;
import com.makeitso.ledger.admin.dto.UserView;
import com.makeitso.ledger.auth.AuthenticatedSession;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Endpoints:
 *   PUT /api/admin/users/{id}/role      MANAGE_ROLES
 *   PUT /api/admin/users/{id}/status    EDIT_USERS
 *   PUT /api/admin/users/{id}/mfa       EDIT_USERS
 *   GET /api/admin/security-events      VIEW_AUDIT_LOGS, newest first
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class UserAdminController {

    private final UserAdminService adminService;

    @PutMapping("/users/{id}/role")
    public ResponseEntity<UserView> changeRole(@AuthenticationPrincipal AuthenticatedSession caller,
                                               @PathVariable Long id,
                                               @Valid @RequestBody RoleChangeRequest request) {
        return ResponseEntity.ok(adminService.changeRole(caller, id, request.role()));
    }

    @PutMapping("/users/{id}/status")
    public ResponseEntity<UserView> changeStatus(@AuthenticationPrincipal AuthenticatedSession caller,
                                                 @PathVariable Long id,
                                                 @Valid @RequestBody StatusChangeRequest request) {
        return ResponseEntity.ok(adminService.changeStatus(caller, id, request.status()));
    }

    @PutMapping("/users/{id}/mfa")
    public ResponseEntity<UserView> setMfa(@AuthenticationPrincipal AuthenticatedSession caller,
                                           @PathVariable Long id,
                                           @Valid @RequestBody MfaToggleRequest request) {
        return ResponseEntity.ok(adminService.setMfaEnabled(caller, id, request.enabled()));
    }

    @GetMapping("/security-events")
    public ResponseEntity<Page<SecurityEventView>> securityEvents(
            @AuthenticationPrincipal AuthenticatedSession caller,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        return ResponseEntity.ok(adminService.recentEvents(caller, page, size));
    }
}
