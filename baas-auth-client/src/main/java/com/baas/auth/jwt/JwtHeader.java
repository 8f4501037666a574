package com.baas.auth.jwt;

import java.util.Map;

import com.baas.auth.AuthErrorCode;
import com.baas.auth.AuthException;

/**
 * JOSE header of a compact JWT.
 *
 * @param algorithm value of {@code alg}
 * @param keyId     value of {@code kid}, null when absent
 * @param type      value of {@code typ}, null when absent
 */
public record JwtHeader(String algorithm, String keyId, String type) {

    public boolean hasKeyId() {
        return keyId != null && !keyId.isEmpty();
    }

    static JwtHeader fromMap(Map<String, Object> map) {
        return new JwtHeader(
            text(map, "alg"),
            text(map, "kid"),
            text(map, "typ")
        );
    }

    private static String text(Map<String, Object> map, String name) {
        Object value = map.get(name);
        if (value == null) return null;
        if (!(value instanceof String s)) {
            throw new AuthException(AuthErrorCode.MALFORMED_TOKEN,
                "JWT header field '" + name + "' must be a string");
        }
        return s;
    }
}
