package com.makeitso.ledger.admin.dto;

import com.makeitso.ledger.security.Role;
import jakarta.validation.constraints.NotNull;

public record RoleChangeRequest(@NotNull Role role) {
}
