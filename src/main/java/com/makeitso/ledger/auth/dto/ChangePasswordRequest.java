package com.makeitso.ledger.auth.dto;

import com.makeitso.ledger.auth.StrongPassword;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Password rotation. Authenticated by the current password rather than a session,
 * so an expired password can still be replaced.
 */
public record ChangePasswordRequest(
        @NotBlank
        @Size(max = 254)
        String email,

        @NotBlank
        @Size(max = 72)
        String currentPassword,

        @NotBlank
        @Size(max = 72)
        @StrongPassword
        String newPassword
) {
}
