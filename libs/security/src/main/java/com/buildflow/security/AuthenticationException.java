package com.buildflow.security;

/**
 * Thrown when a request carries no usable session token.
 *
 * <p>The message never says which part of the token failed; the cause is logged server-side only.
 */
public class AuthenticationException extends RuntimeException {

    private final ErrorCode errorCode;

    public AuthenticationException(ErrorCode errorCode) {
        super(errorCode.defaultMessage());
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    public static AuthenticationException missingToken() {
        return new AuthenticationException(ErrorCode.AUTH_MISSING_TOKEN);
    }

    public static AuthenticationException invalidToken() {
        return new AuthenticationException(ErrorCode.AUTH_INVALID_TOKEN);
    }
}
