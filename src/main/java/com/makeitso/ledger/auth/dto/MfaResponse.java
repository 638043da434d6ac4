package com.makeitso.ledger.auth.dto;

import com.makeitso.ledger.security.SecurityLevel;

public record MfaResponse(boolean mfaVerified, SecurityLevel securityLevel) {
}
