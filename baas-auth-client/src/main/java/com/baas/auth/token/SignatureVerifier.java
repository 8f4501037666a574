package com.baas.auth.token;

import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.util.Base64;

import com.baas.auth.AuthError;
import com.baas.auth.AuthErrorCode;
import com.baas.auth.AuthException;
import com.baas.auth.IdentityPlatform;
import com.baas.auth.jwt.DecodedJwt;
import com.baas.auth.jwt.JwtHeader;
import com.baas.auth.keys.VerificationKeyStore;
import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.security.SecurityException;
import io.jsonwebtoken.security.SignatureException;
import lombok.AllArgsConstructor;

/**
 * Checks the RS256 signature of a decoded JWT against the key its {@code kid} names.
 * Only the signature is judged here; time claims are left to {@link ClaimValidator}.
 */
@AllArgsConstructor
public final class SignatureVerifier {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final VerificationKeyStore keyStore;

    public void check(DecodedJwt jwt) {
        check(jwt.header(), jwt.signedBytes(), jwt.signature());
    }

    public void check(JwtHeader header, byte[] signedBytes, byte[] signature) {
        if (!IdentityPlatform.ALGORITHM_RS256.equals(header.algorithm())) {
            throw new AuthException(AuthError.mismatch(AuthErrorCode.UNSUPPORTED_ALGORITHM,
                "JWT algorithm must be RS256, got \"" + header.algorithm() + "\"",
                IdentityPlatform.ALGORITHM_RS256, header.algorithm()));
        }
        if (!header.hasKeyId()) {
            throw new AuthException(AuthErrorCode.MISSING_KEY_ID, "ID token has no 'kid' header");
        }

        PublicKey key = keyStore.getKey(header.keyId())
            .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_SIGNATURE,
                "No verification key found for kid \"" + header.keyId() + "\""));

        String compact = new String(signedBytes, StandardCharsets.UTF_8) + "." + ENCODER.encodeToString(signature);
        try {
            Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(compact);
        } catch (ClaimJwtException e) {
            // raised after the signature check passed; iat and exp are judged by ClaimValidator
            return;
        } catch (SignatureException e) {
            throw new AuthException(AuthErrorCode.INVALID_SIGNATURE, "ID token has invalid signature", e);
        } catch (SecurityException e) {
            throw new AuthException(AuthErrorCode.INVALID_SIGNATURE,
                "Verification key for kid \"" + header.keyId() + "\" cannot verify RS256 signatures", e);
        } catch (MalformedJwtException e) {
            throw new AuthException(AuthErrorCode.MALFORMED_TOKEN, "ID token is malformed: " + e.getMessage(), e);
        } catch (JwtException e) {
            throw new AuthException(AuthErrorCode.INVALID_SIGNATURE,
                "ID token signature could not be verified: " + e.getMessage(), e);
        }
    }
}
