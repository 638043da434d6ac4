package com.makeitso.ledger.auth.dto;

import com.makeitso.ledger.security.Role;
import com.makeitso.ledger.security.SecurityLevel;

public record AccessCheckResponse(boolean allowed, Role role, SecurityLevel securityLevel) {
}
