package com.makeitso.ledger.session;

/**
 * The session is unknown, expired or terminated. The message is deliberately
 * the same in every case.
 */
public class SessionExpiredException extends RuntimeException {

    public static final String MESSAGE = "Session expired";

    public SessionExpiredException() {
        super(MESSAGE);
    }
}
