package com.baas.auth.keys;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.util.LinkedHashMap;
import java.util.Map;

public final class X509Certificates {
    private X509Certificates() {}

    public static PublicKey publicKey(String pem) {
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            return factory
                .generateCertificate(new ByteArrayInputStream(pem.getBytes(StandardCharsets.US_ASCII)))
                .getPublicKey();
        } catch (CertificateException e) {
            throw new IllegalArgumentException("Failed to parse X.509 certificate", e);
        }
    }

    public static Map<String, PublicKey> publicKeys(Map<String, String> certificatesByKeyId) {
        Map<String, PublicKey> keys = new LinkedHashMap<>();
        certificatesByKeyId.forEach((keyId, pem) -> {
            try {
                keys.put(keyId, publicKey(pem));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid certificate for key id '" + keyId + "'", e);
            }
        });
        return keys;
    }
}
