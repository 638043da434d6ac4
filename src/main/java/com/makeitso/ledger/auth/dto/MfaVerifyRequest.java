package com.makeitso.ledger.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record MfaVerifyRequest(
        @NotBlank
        @Size(max = 16)
        String code
) {
}
