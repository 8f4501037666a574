package com.baas.auth.server;

import java.net.URI;
import java.time.Duration;

import com.baas.auth.IdentityPlatform;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class AuthClientConfig {

    private String projectId;
    private URI certificatesUrl = IdentityPlatform.CERTIFICATES_URL;
    private String issuerPrefix = IdentityPlatform.ISSUER_PREFIX;
    private String customTokenAudience = IdentityPlatform.CUSTOM_TOKEN_AUDIENCE;
    private Duration customTokenTtl = Duration.ofSeconds(IdentityPlatform.CUSTOM_TOKEN_TTL_SECONDS);
    private Duration keyCacheDefaultTtl = Duration.ofMinutes(10);
    private Duration keyFetchTimeout = Duration.ofSeconds(10);
    private Duration allowedClockSkew = Duration.ZERO;
    private Duration keyRefreshInterval = Duration.ZERO;

}
