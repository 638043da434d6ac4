package com.makeitso.ledger.admin.dto;

import jakarta.validation.constraints.NotNull;

public record MfaToggleRequest(@NotNull Boolean enabled) {
}
