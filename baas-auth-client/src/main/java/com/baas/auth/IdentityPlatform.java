package com.baas.auth;

import java.net.URI;
import java.util.List;

/**
 * Fixed identifiers of the identity provider and limits shared by minting and verification.
 */
public final class IdentityPlatform {
    private IdentityPlatform() {}

    /** Audience of every custom token. Never a project id. */
    public static final String CUSTOM_TOKEN_AUDIENCE =
        "https://identitytoolkit.googleapis.com/google.identity.identitytoolkit.v1.IdentityToolkit";

    public static final URI CERTIFICATES_URL =
        URI.create("https://www.googleapis.com/robot/v1/metadata/x509/securetoken@system.gserviceaccount.com");

    /** ID tokens are issued by this prefix followed by the project id. */
    public static final String ISSUER_PREFIX = "https://securetoken.google.com/";

    public static final String ALGORITHM_RS256 = "RS256";

    public static final long CUSTOM_TOKEN_TTL_SECONDS = 3600;

    public static final int MAX_UID_LENGTH = 128;

    public static final List<String> RESERVED_CLAIMS = List.of(
        "acr", "amr", "at_hash", "aud", "auth_time", "azp", "cnf", "c_hash",
        "exp", "firebase", "iat", "iss", "jti", "nbf", "nonce", "sub"
    );
}
