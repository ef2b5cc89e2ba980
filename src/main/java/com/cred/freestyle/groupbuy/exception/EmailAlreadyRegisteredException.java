package com.cred.freestyle.groupbuy.exception;

/**
 * Exception thrown on registration with an email that already has an account.
 *
 * @author Group Buy Team
 */
public class EmailAlreadyRegisteredException extends RuntimeException {

    private final String email;

    public EmailAlreadyRegisteredException(String email) {
        super("Email already registered");
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
