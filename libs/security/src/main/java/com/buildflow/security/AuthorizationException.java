package com.buildflow.security;

import java.util.Map;

/** Thrown when an authenticated caller is not allowed to perform a request. */
public class AuthorizationException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public AuthorizationException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    public AuthorizationException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.copyOf(details);
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /** Extra context for the client, such as required roles. Empty when there is none. */
    public Map<String, Object> details() {
        return details;
    }
}
