package com.makeitso.ledger.auth;

/** Credentials were right but the password is past its rotation date. */
public class PasswordExpiredException extends RuntimeException {

    public PasswordExpiredException() {
        super("Password expired, change it to continue");
    }
}
