package com.cred.freestyle.groupbuy.exception;

/**
 * Exception thrown when an operation kept losing row-lock races and ran out of retry attempts.
 *
 * @author Group Buy Team
 */
public class StoreContentionException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public StoreContentionException(String operation, int attempts, Throwable cause) {
        super(String.format("Operation %s could not complete after %d attempts, please retry", operation, attempts),
                cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
