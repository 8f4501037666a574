package com.baas.auth.server.credentials;

import java.util.Optional;

/**
 * Supplies signer credentials. Without them custom tokens cannot be minted, but ID tokens can still be
 * verified when a project id is configured.
 */
public interface CredentialSource {

    Optional<SignerCredentials> signer();

    /** Project the credentials belong to, used when no project id is configured explicitly. */
    default Optional<String> projectId() {
        return Optional.empty();
    }

    static CredentialSource none() {
        return Optional::empty;
    }

    static CredentialSource of(String signerEmail, String signingKeyPem) {
        SignerCredentials credentials = new SignerCredentials(signerEmail, signingKeyPem);
        return () -> Optional.of(credentials);
    }
}
