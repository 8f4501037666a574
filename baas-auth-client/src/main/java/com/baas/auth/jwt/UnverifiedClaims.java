package com.baas.auth.jwt;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.baas.auth.AuthErrorCode;
import com.baas.auth.AuthException;

/**
 * Payload of a decoded JWT whose signature and claims have not been checked yet.
 * Registered fields that are absent from the payload are null; every other field is kept in {@code claims}.
 */
public record UnverifiedClaims(
    String issuer,
    String audience,
    Long issuedAt,
    Long expiresAt,
    String subject,
    Map<String, Object> claims
) {

    static final Set<String> MODELED = Set.of("iss", "aud", "iat", "exp", "sub");

    public UnverifiedClaims {
        claims = claims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    static UnverifiedClaims fromPayload(Map<String, Object> payload) {
        Map<String, Object> rest = new LinkedHashMap<>(payload);
        rest.keySet().removeAll(MODELED);
        return new UnverifiedClaims(
            text(payload, "iss"),
            text(payload, "aud"),
            seconds(payload, "iat"),
            seconds(payload, "exp"),
            text(payload, "sub"),
            rest
        );
    }

    private static String text(Map<String, Object> payload, String name) {
        Object value = payload.get(name);
        if (value == null) return null;
        if (!(value instanceof String s)) {
            throw new AuthException(AuthErrorCode.MALFORMED_TOKEN, "JWT claim '" + name + "' must be a string");
        }
        return s;
    }

    private static Long seconds(Map<String, Object> payload, String name) {
        Object value = payload.get(name);
        if (value == null) return null;
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        throw new AuthException(AuthErrorCode.MALFORMED_TOKEN,
            "JWT claim '" + name + "' must be an integer number of seconds");
    }
}
