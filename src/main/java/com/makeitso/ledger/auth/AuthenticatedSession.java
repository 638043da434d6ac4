package com.makeitso.ledger.auth;

import com.makeitso.ledger.security.Permission;
import com.makeitso.ledger.security.Principal;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.ArrayList;
import java.util.List;

/**
 * Authentication principal placed in the SecurityContext by {@link JwtAuthFilter}:
 * the session the request belongs to and the principal as of this request.
 */
public record AuthenticatedSession(String sessionId, Principal principal) {

    public Long userId() {
        return principal.id();
    }

    /** ROLE_x plus one authority per effective permission. */
    public List<GrantedAuthority> authorities() {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_" + principal.role().name()));
        for (Permission permission : principal.effectivePermissions()) {
            authorities.add(new SimpleGrantedAuthority(permission.name()));
        }
        return authorities;
    }
}
