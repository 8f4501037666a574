package com.baas.auth.token;

import java.util.List;
import java.util.Optional;

import com.baas.auth.AuthError;
import com.baas.auth.AuthErrorCode;
import com.baas.auth.IdentityPlatform;
import com.baas.auth.jwt.DecodedJwt;

/**
 * Trust rules for ID tokens, declared in the order they are evaluated. The first failing rule decides
 * the error reported to the caller.
 */
public enum IdTokenRule {

    KEY_ID_PRESENT(true) {
        @Override
        public Optional<AuthError> check(DecodedJwt jwt, ValidationContext ctx) {
            if (jwt.header().hasKeyId()) return Optional.empty();
            if (ctx.customTokenAudience().equals(jwt.claims().audience())) {
                return fail(AuthErrorCode.WRONG_TOKEN_TYPE,
                    "verifyIdToken() expects an ID token, but was given a custom token");
            }
            return fail(AuthErrorCode.MISSING_KEY_ID, "ID token has no 'kid' header");
        }
    },

    ALGORITHM(true) {
        @Override
        public Optional<AuthError> check(DecodedJwt jwt, ValidationContext ctx) {
            String alg = jwt.header().algorithm();
            if (IdentityPlatform.ALGORITHM_RS256.equals(alg)) return Optional.empty();
            return Optional.of(AuthError.mismatch(AuthErrorCode.UNSUPPORTED_ALGORITHM,
                String.format("ID token has incorrect algorithm. Expected \"%s\" but got \"%s\". %s",
                    IdentityPlatform.ALGORITHM_RS256, alg, VERIFY_TOKEN_HINT),
                IdentityPlatform.ALGORITHM_RS256, alg));
        }
    },

    AUDIENCE(false) {
        @Override
        public Optional<AuthError> check(DecodedJwt jwt, ValidationContext ctx) {
            String aud = jwt.claims().audience();
            if (ctx.projectId().equals(aud)) return Optional.empty();
            return Optional.of(AuthError.mismatch(AuthErrorCode.AUDIENCE_MISMATCH,
                String.format("ID token has invalid 'aud' (audience) claim. Expected \"%s\" but got \"%s\". %s %s",
                    ctx.projectId(), aud, PROJECT_ID_HINT, VERIFY_TOKEN_HINT),
                ctx.projectId(), aud));
        }
    },

    ISSUER(false) {
        @Override
        public Optional<AuthError> check(DecodedJwt jwt, ValidationContext ctx) {
            String iss = jwt.claims().issuer();
            if (ctx.expectedIssuer().equals(iss)) return Optional.empty();
            return Optional.of(AuthError.mismatch(AuthErrorCode.ISSUER_MISMATCH,
                String.format("ID token has invalid 'iss' (issuer) claim. Expected \"%s\" but got \"%s\". %s %s",
                    ctx.expectedIssuer(), iss, PROJECT_ID_HINT, VERIFY_TOKEN_HINT),
                ctx.expectedIssuer(), iss));
        }
    },

    ISSUED_AT(false) {
        @Override
        public Optional<AuthError> check(DecodedJwt jwt, ValidationContext ctx) {
            Long iat = jwt.claims().issuedAt();
            if (iat == null || iat <= ctx.now() + ctx.skewSeconds()) return Optional.empty();
            return fail(AuthErrorCode.ISSUED_IN_FUTURE, "ID token issued at future timestamp: " + iat);
        }
    },

    EXPIRY(false) {
        @Override
        public Optional<AuthError> check(DecodedJwt jwt, ValidationContext ctx) {
            Long exp = jwt.claims().expiresAt();
            if (exp == null) {
                return fail(AuthErrorCode.EXPIRED, "ID token has no 'exp' (expiration) claim");
            }
            if (exp >= ctx.now() - ctx.skewSeconds()) return Optional.empty();
            return fail(AuthErrorCode.EXPIRED, "ID token has expired. Expired at: " + exp);
        }
    },

    SUBJECT_PRESENT(false) {
        @Override
        public Optional<AuthError> check(DecodedJwt jwt, ValidationContext ctx) {
            String sub = jwt.claims().subject();
            if (sub != null && !sub.isEmpty()) return Optional.empty();
            return fail(AuthErrorCode.EMPTY_SUBJECT, "ID token has empty 'sub' (subject) claim. " + VERIFY_TOKEN_HINT);
        }
    },

    SUBJECT_LENGTH(false) {
        @Override
        public Optional<AuthError> check(DecodedJwt jwt, ValidationContext ctx) {
            String sub = jwt.claims().subject();
            if (sub == null || sub.codePointCount(0, sub.length()) <= IdentityPlatform.MAX_UID_LENGTH) {
                return Optional.empty();
            }
            return fail(AuthErrorCode.SUBJECT_TOO_LONG,
                "ID token has a 'sub' (subject) claim longer than " + IdentityPlatform.MAX_UID_LENGTH
                    + " characters. " + VERIFY_TOKEN_HINT);
        }
    };

    static final String PROJECT_ID_HINT =
        "Make sure the ID token comes from the same project as the credential used to authenticate this client.";
    static final String VERIFY_TOKEN_HINT =
        "Retrieve a fresh ID token from the client SDK before calling the backend.";

    private final boolean headerRule;

    IdTokenRule(boolean headerRule) {
        this.headerRule = headerRule;
    }

    /**
     * @return the failure this rule reports for the token, or empty when the token satisfies it
     */
    public abstract Optional<AuthError> check(DecodedJwt jwt, ValidationContext ctx);

    /** Rules that only look at the JOSE header and may run before the signature is checked. */
    public boolean isHeaderRule() {
        return headerRule;
    }

    public static List<IdTokenRule> inOrder() {
        return List.of(values());
    }

    private static Optional<AuthError> fail(AuthErrorCode code, String message) {
        return Optional.of(AuthError.of(code, message));
    }
}
