package com.makeitso.ledger.session;

/**
 * A stored or computed session value breaks an invariant (activity before login,
 * time running backwards). Indicates corrupted storage or clock skew; the current
 * request is denied.
 */
public class SessionIntegrityException extends RuntimeException {

    public SessionIntegrityException(String message) {
        super(message);
    }
}
