package com.makeitso.ledger.admin.dto;

import com.makeitso.ledger.security.AccountStatus;
import jakarta.validation.constraints.NotNull;

public record StatusChangeRequest(@NotNull AccountStatus status) {
}
