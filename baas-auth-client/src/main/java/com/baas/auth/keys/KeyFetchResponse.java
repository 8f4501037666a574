package com.baas.auth.keys;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Certificates published by the identity provider.
 *
 * @param certificates PEM encoded X.509 certificates keyed by key id
 * @param maxAge       cache lifetime announced by the transport, null when it gave no hint
 */
public record KeyFetchResponse(Map<String, String> certificates, Duration maxAge) {

    public KeyFetchResponse {
        certificates = Map.copyOf(Objects.requireNonNull(certificates, "certificates"));
        if (maxAge != null && maxAge.isNegative()) {
            maxAge = Duration.ZERO;
        }
    }
}
