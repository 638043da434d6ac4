package com.makeitso.ledger.auth;

/** Sign-in or verification failed. The message never says which part was wrong. */
public class AuthenticationFailedException extends RuntimeException {

    public static final String INVALID_CREDENTIALS = "Invalid credentials";
    public static final String INVALID_CODE        = "Invalid verification code";

    public AuthenticationFailedException() {
        this(INVALID_CREDENTIALS);
    }

    public AuthenticationFailedException(String message) {
        super(message);
    }
}
