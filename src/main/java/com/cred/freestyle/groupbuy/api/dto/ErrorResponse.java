package com.cred.freestyle.groupbuy.api.dto;

import com.cred.freestyle.groupbuy.api.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body shared by the exception handler and the security entry points.
 * The HTTP status follows from the {@link ErrorCode}, which is also written as details.code.
 *
 * @author Group Buy Team
 */
public class ErrorResponse {

    static final String CODE_DETAIL = "code";

    private final Instant timestamp;
    private final ErrorCode code;
    private final String error;
    private final String message;
    private final String path;
    private final Map<String, Object> details = new LinkedHashMap<>();

    private ErrorResponse(ErrorCode code, String error, String message, String path) {
        this.timestamp = Instant.now();
        this.code = code;
        this.error = error;
        this.message = message;
        this.path = path;
        this.details.put(CODE_DETAIL, code.name());
    }

    /**
     * @param code Error kind, decides the HTTP status
     * @param error Short title, e.g. "Group Full"
     * @param message Human-readable message
     * @param path Request URI
     */
    public static ErrorResponse of(ErrorCode code, String error, String message, String path) {
        return new ErrorResponse(code, error, message, path);
    }

    /**
     * Attach context for the client, such as the conflicting group status.
     *
     * @throws IllegalArgumentException if the key would overwrite the error code
     */
    public ErrorResponse withDetail(String key, Object value) {
        if (CODE_DETAIL.equals(key)) {
            throw new IllegalArgumentException("details.code is derived from the error code");
        }
        this.details.put(key, value);
        return this;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonIgnore
    public ErrorCode getCode() {
        return code;
    }

    public int getStatus() {
        return code.getHttpStatus().value();
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public String getPath() {
        return path;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}
