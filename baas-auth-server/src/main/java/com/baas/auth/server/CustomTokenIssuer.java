package com.baas.auth.server;

import java.time.Instant;
import java.util.Map;

/**
 * Issues custom tokens that a client SDK exchanges for an ID token.
 */
public interface CustomTokenIssuer {
    record Issued(String token, Instant expiresAt) {}

    Issued issueCustomToken(String uid, Map<String, ?> developerClaims);
}
