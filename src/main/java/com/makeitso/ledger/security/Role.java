package com.makeitso.ledger.security;

/**
 * The closed set of roles a principal can hold, exactly one per principal.
 *
 * Declaration order is the privilege order used by minimum-role checks:
 *   READ_ONLY < STANDARD_USER < ANALYST < MANAGER < ADMINISTRATOR
 */
public enum Role {

    READ_ONLY,
    STANDARD_USER,
    ANALYST,
    MANAGER,
    ADMINISTRATOR;

    /** Position in the privilege order, 0 for READ_ONLY. */
    public int rank() {
        return ordinal();
    }

    public boolean isAtLeast(Role other) {
        return rank() >= other.rank();
    }
}
