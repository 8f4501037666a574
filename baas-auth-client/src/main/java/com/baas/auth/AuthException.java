package com.baas.auth;

import lombok.Getter;

/**
 * Carries an {@link AuthError} out of the minting and verification stages.
 */
@Getter
public class AuthException extends RuntimeException {

    private final AuthError error;

    public AuthException(AuthError error) {
        super(error.message());
        this.error = error;
    }

    public AuthException(AuthError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public AuthException(AuthErrorCode code, String message) {
        this(AuthError.of(code, message));
    }

    public AuthException(AuthErrorCode code, String message, Throwable cause) {
        this(AuthError.of(code, message), cause);
    }

    public AuthErrorCode getCode() {
        return error.code();
    }
}
