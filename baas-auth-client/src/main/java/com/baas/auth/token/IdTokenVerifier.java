package com.baas.auth.token;

import com.baas.auth.AuthErrorCode;
import com.baas.auth.AuthException;
import com.baas.auth.jwt.DecodedJwt;
import com.baas.auth.jwt.TokenCodec;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decodes, signature-checks and claim-validates ID tokens, in that order.
 */
@Slf4j
@AllArgsConstructor
public final class IdTokenVerifier {

    private final TokenCodec codec;
    private final SignatureVerifier signatureVerifier;
    private final ClaimValidator claimValidator;

    public Token verify(String idToken) {
        if (idToken == null || idToken.isEmpty()) {
            throw new AuthException(AuthErrorCode.INPUT, "ID token must be a non-empty string");
        }

        try {
            DecodedJwt jwt = codec.decode(idToken);
            claimValidator.checkHeader(jwt);
            signatureVerifier.check(jwt);
            return claimValidator.validate(jwt);
        } catch (AuthException e) {
            log.debug("Rejected ID token: {} {}", e.getCode(), e.getMessage());
            throw e;
        }
    }
}
