package com.cred.freestyle.groupbuy.exception;

/**
 * Exception thrown when credentials are missing, malformed, expired or wrong.
 *
 * @author Group Buy Team
 */
public class UnauthenticatedException extends RuntimeException {

    public UnauthenticatedException(String message) {
        super(message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(message, cause);
    }
}
