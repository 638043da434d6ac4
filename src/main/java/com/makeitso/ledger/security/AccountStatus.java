package com.makeitso.ledger.security;

public enum AccountStatus {

    ACTIVE,
    INACTIVE,
    SUSPENDED,
    PENDING_VERIFICATION,
    LOCKED,
    EXPIRED;

    /** Only ACTIVE principals may hold a valid session. */
    public boolean permitsSession() {
        return this == ACTIVE;
    }
}
