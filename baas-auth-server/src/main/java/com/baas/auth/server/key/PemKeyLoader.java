package com.baas.auth.server.key;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;

/**
 * Loads RSA signing keys given as PEM ({@code PRIVATE KEY} or {@code RSA PRIVATE KEY}) or DER,
 * in PKCS#8 or PKCS#1 form.
 */
public final class PemKeyLoader {
    private PemKeyLoader() {}

    /** Smallest modulus accepted for RS256 signing keys. */
    public static final int MIN_KEY_BITS = 2048;

    private static final String PKCS8_TYPE = "PRIVATE KEY";
    private static final String PKCS1_TYPE = "RSA PRIVATE KEY";

    // AlgorithmIdentifier { rsaEncryption, NULL }
    private static final byte[] RSA_ALGORITHM_ID = {
        0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86, (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    public static RSAPrivateKey loadPrivateKey(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new IllegalArgumentException("No private key data found");
        }
        if (pem.contains("-----BEGIN " + PKCS1_TYPE + "-----")) {
            return requireSigningStrength(fromPkcs8(wrapPkcs1(base64(stripPemHeaders(pem, PKCS1_TYPE)))));
        }
        if (pem.contains("-----BEGIN " + PKCS8_TYPE + "-----")) {
            return requireSigningStrength(fromPkcs8(base64(stripPemHeaders(pem, PKCS8_TYPE))));
        }
        if (pem.contains("-----BEGIN")) {
            throw new IllegalArgumentException("Private key should be a PEM or plain PKCS1 or PKCS8 key");
        }
        return loadPrivateKey(base64(pem.replaceAll("\\s+", "")));
    }

    public static RSAPrivateKey loadPrivateKey(byte[] der) {
        RSAPrivateKey key;
        try {
            key = fromPkcs8(der);
        } catch (IllegalArgumentException notPkcs8) {
            try {
                key = fromPkcs8(wrapPkcs1(der));
            } catch (IllegalArgumentException notPkcs1) {
                notPkcs1.addSuppressed(notPkcs8);
                throw new IllegalArgumentException("Private key should be a PEM or plain PKCS1 or PKCS8 key", notPkcs1);
            }
        }
        return requireSigningStrength(key);
    }

    private static RSAPrivateKey requireSigningStrength(RSAPrivateKey key) {
        int bits = key.getModulus().bitLength();
        if (bits < MIN_KEY_BITS) {
            throw new IllegalArgumentException(
                "RSA private key has " + bits + " bits, RS256 requires at least " + MIN_KEY_BITS);
        }
        return key;
    }

    private static RSAPrivateKey fromPkcs8(byte[] der) {
        PrivateKey key;
        try {
            key = KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA not available", e);
        } catch (InvalidKeySpecException e) {
            throw new IllegalArgumentException("Failed to parse RSA private key", e);
        }
        if (!(key instanceof RSAPrivateKey rsa)) {
            throw new IllegalArgumentException("Private key is not an RSA key");
        }
        return rsa;
    }

    /**
     * PrivateKeyInfo ::= SEQUENCE { INTEGER 0, AlgorithmIdentifier, OCTET STRING pkcs1 }
     */
    private static byte[] wrapPkcs1(byte[] pkcs1) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.writeBytes(new byte[] {0x02, 0x01, 0x00});
        body.writeBytes(RSA_ALGORITHM_ID);
        body.write(0x04);
        body.writeBytes(derLength(pkcs1.length));
        body.writeBytes(pkcs1);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x30);
        out.writeBytes(derLength(body.size()));
        out.writeBytes(body.toByteArray());
        return out.toByteArray();
    }

    private static byte[] derLength(int length) {
        if (length < 0x80) {
            return new byte[] {(byte) length};
        }
        if (length <= 0xff) {
            return new byte[] {(byte) 0x81, (byte) length};
        }
        if (length <= 0xffff) {
            return new byte[] {(byte) 0x82, (byte) (length >> 8), (byte) length};
        }
        return new byte[] {(byte) 0x83, (byte) (length >> 16), (byte) (length >> 8), (byte) length};
    }

    private static byte[] base64(String content) {
        try {
            return Base64.getMimeDecoder().decode(content.getBytes(StandardCharsets.US_ASCII));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Private key is not valid base64", e);
        }
    }

    private static String stripPemHeaders(String pem, String type) {
        int begin = pem.indexOf("-----BEGIN " + type + "-----");
        int end = pem.indexOf("-----END " + type + "-----");
        if (end < begin) {
            throw new IllegalArgumentException("Malformed PEM block: " + type);
        }
        return pem.substring(begin, end)
            .replace("-----BEGIN " + type + "-----", "")
            .replaceAll("\\s+", "");
    }
}
