package com.baas.auth.server.credentials;

import java.util.Objects;

/**
 * Identity and key used to sign custom tokens.
 *
 * @param signerEmail   service account email, becomes iss and sub of every custom token
 * @param signingKeyPem RSA private key, PEM or base64 DER, PKCS#8 or PKCS#1
 */
public record SignerCredentials(String signerEmail, String signingKeyPem) {

    public SignerCredentials {
        Objects.requireNonNull(signerEmail, "signerEmail");
        Objects.requireNonNull(signingKeyPem, "signingKeyPem");
    }

    @Override
    public String toString() {
        return "SignerCredentials[signerEmail=" + signerEmail + "]";
    }
}
