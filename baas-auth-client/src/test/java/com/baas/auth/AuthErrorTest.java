package com.baas.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuthError")
class AuthErrorTest {

    @Test
    @DisplayName("only KEY_SOURCE_UNAVAILABLE is retryable")
    void onlyKeySourceUnavailableIsRetryable() {
        for (AuthErrorCode code : AuthErrorCode.values()) {
            assertEquals(code == AuthErrorCode.KEY_SOURCE_UNAVAILABLE, code.isRetryable(), code.name());
        }
    }

    @Test
    @DisplayName("mismatch errors carry expected and actual values")
    void mismatchCarriesBothValues() {
        final var error = AuthError.mismatch(AuthErrorCode.AUDIENCE_MISMATCH, "bad aud", "proj", "other");

        assertEquals("proj", error.expected());
        assertEquals("other", error.actual());
        assertFalse(error.isRetryable());
    }

    @Test
    @DisplayName("plain errors have no expected or actual value")
    void plainErrorHasNoValues() {
        final var error = AuthError.of(AuthErrorCode.KEY_SOURCE_UNAVAILABLE, "down");

        assertNull(error.expected());
        assertNull(error.actual());
        assertTrue(error.isRetryable());
    }

    @Test
    @DisplayName("exception exposes its error and code")
    void exceptionExposesError() {
        final var error = AuthError.of(AuthErrorCode.EXPIRED, "expired");
        final var exception = new AuthException(error);

        assertSame(error, exception.getError());
        assertEquals(AuthErrorCode.EXPIRED, exception.getCode());
        assertEquals("expired", exception.getMessage());
    }

    @Test
    @DisplayName("code and message are required")
    void codeAndMessageRequired() {
        assertThrows(NullPointerException.class, () -> AuthError.of(null, "x"));
        assertThrows(NullPointerException.class, () -> AuthError.of(AuthErrorCode.INPUT, null));
    }
}
