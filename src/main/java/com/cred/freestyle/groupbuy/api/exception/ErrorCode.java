package com.cred.freestyle.groupbuy.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error kinds reported in ErrorResponse.details.code, each bound to its HTTP status.
 * Clients branch on these, never on the message text.
 *
 * @author Group Buy Team
 */
public enum ErrorCode {
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    PAYMENT_REQUIRED(HttpStatus.PAYMENT_REQUIRED),
    ALREADY_MEMBER(HttpStatus.CONFLICT),
    ALREADY_PAID(HttpStatus.CONFLICT),
    GROUP_FULL(HttpStatus.CONFLICT),
    INVALID_STATE(HttpStatus.CONFLICT),
    EMAIL_ALREADY_REGISTERED(HttpStatus.CONFLICT),
    STORE_CONTENTION(HttpStatus.CONFLICT),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
