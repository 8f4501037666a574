package com.baas.auth.server;

import java.net.http.HttpClient;
import java.security.interfaces.RSAPrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import com.baas.auth.AuthError;
import com.baas.auth.AuthErrorCode;
import com.baas.auth.AuthException;
import com.baas.auth.jwt.TokenCodec;
import com.baas.auth.keys.CachingKeyStore;
import com.baas.auth.keys.HttpKeyFetchTransport;
import com.baas.auth.keys.KeyCacheRefresher;
import com.baas.auth.keys.KeyFetchTransport;
import com.baas.auth.server.credentials.CredentialSource;
import com.baas.auth.server.credentials.SignerCredentials;
import com.baas.auth.server.key.PemKeyLoader;
import com.baas.auth.token.ClaimValidator;
import com.baas.auth.token.IdTokenVerifier;
import com.baas.auth.token.SignatureVerifier;
import com.baas.auth.token.Token;
import lombok.extern.slf4j.Slf4j;

/**
 * Mints custom tokens and verifies ID tokens for one project.
 *
 * <p>Minting needs signer credentials, verification needs a project id; a client built without one of
 * them still serves the other operation and rejects the missing one with {@code CONFIGURATION}.
 * Neither operation throws for token or input problems, the outcome is always a result value.
 */
@Slf4j
public class AuthClient implements AutoCloseable {

    public sealed interface MintResult {
        record Minted(String token, Instant expiresAt) implements MintResult {}
        record Rejected(AuthError error) implements MintResult {}
    }

    public sealed interface VerifyResult {
        record Verified(Token token) implements VerifyResult {}
        record Rejected(AuthError error) implements VerifyResult {}
    }

    private final CustomTokenIssuer tokenIssuer;
    private final IdTokenVerifier idTokenVerifier;
    private final KeyCacheRefresher refresher;

    AuthClient(CustomTokenIssuer tokenIssuer, IdTokenVerifier idTokenVerifier, KeyCacheRefresher refresher) {
        this.tokenIssuer = tokenIssuer;
        this.idTokenVerifier = idTokenVerifier;
        this.refresher = refresher;
    }

    public static AuthClient create(AuthClientConfig config, CredentialSource credentials) {
        HttpClient http = HttpClient.newBuilder()
            .connectTimeout(config.getKeyFetchTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        return create(config, credentials, new HttpKeyFetchTransport(http, config.getKeyFetchTimeout()),
            Clock.systemUTC());
    }

    /**
     * @throws AuthException with {@code CONFIGURATION} when the signer credentials carry an unusable key
     */
    public static AuthClient create(AuthClientConfig config, CredentialSource credentials,
                                    KeyFetchTransport transport, Clock clock) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(credentials, "credentials");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(clock, "clock");

        TokenCodec codec = new TokenCodec();

        CustomTokenIssuer issuer = credentials.signer()
            .map(signer -> newIssuer(config, signer, clock))
            .orElse(null);
        if (issuer == null) {
            log.info("No signer credentials available, custom token minting is disabled");
        }

        String projectId = config.getProjectId();
        if (projectId == null || projectId.isBlank()) {
            projectId = credentials.projectId().orElse(null);
        }

        IdTokenVerifier verifier = null;
        KeyCacheRefresher refresher = null;
        if (projectId == null || projectId.isBlank()) {
            log.info("No project id configured, ID token verification is disabled");
        } else {
            CachingKeyStore keyStore = new CachingKeyStore(
                transport, config.getCertificatesUrl(), clock, config.getKeyCacheDefaultTtl());
            ClaimValidator claimValidator = new ClaimValidator(
                projectId,
                config.getIssuerPrefix(),
                config.getCustomTokenAudience(),
                config.getAllowedClockSkew(),
                clock
            );
            verifier = new IdTokenVerifier(codec, new SignatureVerifier(keyStore), claimValidator);

            Duration interval = config.getKeyRefreshInterval();
            if (interval != null && !interval.isZero() && !interval.isNegative()) {
                refresher = new KeyCacheRefresher(keyStore, interval);
            }
        }

        return new AuthClient(issuer, verifier, refresher);
    }

    private static CustomTokenIssuer newIssuer(AuthClientConfig config, SignerCredentials signer, Clock clock) {
        RSAPrivateKey key;
        try {
            key = PemKeyLoader.loadPrivateKey(signer.signingKeyPem());
        } catch (IllegalArgumentException e) {
            throw new AuthException(AuthErrorCode.CONFIGURATION,
                "Failed to load the signing key of " + signer.signerEmail() + ": " + e.getMessage(), e);
        }
        return new RsaCustomTokenIssuer(
            key,
            signer.signerEmail(),
            config.getCustomTokenAudience(),
            config.getCustomTokenTtl().getSeconds(),
            clock
        );
    }

    public MintResult mint(String uid) {
        return mint(uid, null);
    }

    public MintResult mint(String uid, Map<String, ?> developerClaims) {
        if (tokenIssuer == null) {
            return new MintResult.Rejected(AuthError.of(AuthErrorCode.CONFIGURATION,
                "service account email and private key not available, custom tokens cannot be minted"));
        }
        try {
            CustomTokenIssuer.Issued issued = tokenIssuer.issueCustomToken(uid, developerClaims);
            return new MintResult.Minted(issued.token(), issued.expiresAt());
        } catch (AuthException e) {
            return new MintResult.Rejected(e.getError());
        }
    }

    public VerifyResult verify(String idToken) {
        if (idTokenVerifier == null) {
            return new VerifyResult.Rejected(AuthError.of(AuthErrorCode.CONFIGURATION, "project id not available"));
        }
        try {
            return new VerifyResult.Verified(idTokenVerifier.verify(idToken));
        } catch (AuthException e) {
            return new VerifyResult.Rejected(e.getError());
        }
    }

    @Override
    public void close() {
        if (refresher != null) {
            refresher.close();
        }
    }
}
