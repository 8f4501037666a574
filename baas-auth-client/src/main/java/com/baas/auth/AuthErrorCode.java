package com.baas.auth;

/**
 * Failure kinds reported by token minting and verification.
 */
public enum AuthErrorCode {
    CONFIGURATION,
    INPUT,
    MALFORMED_TOKEN,
    UNSUPPORTED_ALGORITHM,
    MISSING_KEY_ID,
    WRONG_TOKEN_TYPE,
    INVALID_SIGNATURE,
    AUDIENCE_MISMATCH,
    ISSUER_MISMATCH,
    ISSUED_IN_FUTURE,
    EXPIRED,
    EMPTY_SUBJECT,
    SUBJECT_TOO_LONG,
    KEY_SOURCE_UNAVAILABLE;

    /**
     * Only infrastructure failures are worth retrying; everything else needs a different token,
     * different input or a configuration change.
     */
    public boolean isRetryable() {
        return this == KEY_SOURCE_UNAVAILABLE;
    }
}
