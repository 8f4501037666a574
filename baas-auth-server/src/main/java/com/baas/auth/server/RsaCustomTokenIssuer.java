package com.baas.auth.server;

import java.security.PrivateKey;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

import com.baas.auth.AuthErrorCode;
import com.baas.auth.AuthException;
import com.baas.auth.IdentityPlatform;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.SerializationException;
import io.jsonwebtoken.security.SecurityException;
import lombok.AllArgsConstructor;

/**
 * RS256 custom tokens signed with the service account key using JJWT. The header carries no {@code kid}.
 */
@AllArgsConstructor
public final class RsaCustomTokenIssuer implements CustomTokenIssuer {
    private final PrivateKey signingKey;
    private final String signerEmail;
    private final String audience;
    private final long ttlSeconds;
    private final Clock clock;

    @Override
    public Issued issueCustomToken(String uid, Map<String, ?> developerClaims) {
        int length = uid == null ? 0 : uid.codePointCount(0, uid.length());
        if (length == 0 || length > IdentityPlatform.MAX_UID_LENGTH) {
            throw new AuthException(AuthErrorCode.INPUT,
                "uid must be non-empty, and not longer than " + IdentityPlatform.MAX_UID_LENGTH + " characters");
        }
        rejectReservedClaims(developerClaims);

        Instant now = clock.instant();
        long iat = now.getEpochSecond();
        CustomTokenPayload payload = new CustomTokenPayload(
            signerEmail,
            signerEmail,
            audience,
            uid,
            iat,
            iat + ttlSeconds,
            developerClaims
        );

        return new Issued(sign(payload), Instant.ofEpochSecond(payload.expiresAt()));
    }

    private String sign(CustomTokenPayload payload) {
        JwtBuilder builder = Jwts.builder()
            .header().type("JWT").and()
            .issuer(payload.issuer())
            .subject(payload.subject())
            .audience().single(payload.audience())
            .claim("uid", payload.uid())
            .issuedAt(Date.from(Instant.ofEpochSecond(payload.issuedAt())))
            .expiration(Date.from(Instant.ofEpochSecond(payload.expiresAt())));
        if (payload.developerClaims() != null && !payload.developerClaims().isEmpty()) {
            builder.claim("claims", payload.developerClaims());
        }

        try {
            return builder.signWith(signingKey, Jwts.SIG.RS256).compact();
        } catch (SerializationException e) {
            throw new AuthException(AuthErrorCode.INPUT,
                "developer claims cannot be serialized as JSON: " + e.getMessage(), e);
        } catch (SecurityException e) {
            throw new AuthException(AuthErrorCode.CONFIGURATION,
                "signing key cannot produce RS256 signatures: " + e.getMessage(), e);
        }
    }

    private static void rejectReservedClaims(Map<String, ?> developerClaims) {
        if (developerClaims == null || developerClaims.isEmpty()) return;

        List<String> disallowed = new ArrayList<>();
        for (String name : IdentityPlatform.RESERVED_CLAIMS) {
            if (developerClaims.containsKey(name)) {
                disallowed.add(name);
            }
        }
        if (disallowed.size() == 1) {
            throw new AuthException(AuthErrorCode.INPUT,
                "developer claim \"" + disallowed.get(0) + "\" is reserved and cannot be specified");
        }
        if (disallowed.size() > 1) {
            throw new AuthException(AuthErrorCode.INPUT,
                "developer claims \"" + String.join(", ", disallowed) + "\" are reserved and cannot be specified");
        }
    }
}
