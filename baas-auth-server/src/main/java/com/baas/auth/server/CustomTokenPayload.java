package com.baas.auth.server;

import java.util.Map;

/**
 * Claims of a custom token. Developer claims are written nested under {@code claims}.
 */
public record CustomTokenPayload(
    String issuer,
    String subject,
    String audience,
    String uid,
    long issuedAt,
    long expiresAt,
    Map<String, ?> developerClaims
) {
}
