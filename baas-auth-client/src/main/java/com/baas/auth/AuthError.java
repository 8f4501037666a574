package com.baas.auth;

import java.util.Objects;

/**
 * A single, specific minting or verification failure.
 *
 * @param code     failure kind
 * @param message  human readable description
 * @param expected expected value for mismatch failures, otherwise null
 * @param actual   value found in the token for mismatch failures, otherwise null
 */
public record AuthError(AuthErrorCode code, String message, String expected, String actual) {

    public AuthError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    public static AuthError of(AuthErrorCode code, String message) {
        return new AuthError(code, message, null, null);
    }

    public static AuthError mismatch(AuthErrorCode code, String message, String expected, String actual) {
        return new AuthError(code, message, expected, actual);
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
