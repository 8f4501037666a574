package com.baas.auth.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A verified ID token.
 *
 * <p>Instances are only created by {@link ClaimValidator} once every rule has passed. {@code uid} is the
 * verified subject; {@code claims} holds every payload field besides iss, aud, iat, exp and sub, with nested
 * objects and arrays copied into unmodifiable collections.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Token {

    private final String issuer;
    private final String audience;
    private final long issuedAt;
    private final long expiresAt;
    private final String subject;
    private final String uid;
    private final Map<String, Object> claims;

    Token(String issuer, String audience, long issuedAt, long expiresAt, String subject, Map<String, Object> claims) {
        this.issuer = issuer;
        this.audience = audience;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.subject = subject;
        this.uid = subject;
        this.claims = immutableMap(claims);
    }

    private static Map<String, Object> immutableMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((name, value) -> copy.put(String.valueOf(name), immutableValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return immutableMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(immutableValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
