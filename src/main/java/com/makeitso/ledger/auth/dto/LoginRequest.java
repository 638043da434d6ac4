package com.makeitso.ledger.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Login using email + password.
 */
public record LoginRequest(
        @NotBlank
        @Size(max = 254)
        String email,

        @NotBlank
        @Size(max = 72)
        String password
) {
}
