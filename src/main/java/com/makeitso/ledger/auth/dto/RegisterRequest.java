package com.makeitso.ledger.auth.dto;

import com.makeitso.ledger.auth.StrongPassword;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank
        @Email
        @Size(max = 254)
        String email,

        @NotBlank
        @Size(max = 72)
        @StrongPassword
        String password,

        @Size(max = 128)
        String displayName
) {
}
