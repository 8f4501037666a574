package com.baas.auth.jwt;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import com.baas.auth.AuthErrorCode;
import com.baas.auth.AuthException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Splits compact JWTs ({@code base64url(header).base64url(payload).base64url(signature)}) into typed parts
 * before anything is trusted, so that the header can be classified and unknown claims kept. Signature
 * checks are left to {@code SignatureVerifier}, claim checks to {@code ClaimValidator}.
 */
public final class TokenCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT = new TypeReference<>() {};
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper mapper;

    public TokenCodec() {
        this.mapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public DecodedJwt decode(String token) {
        if (token == null || token.isEmpty()) {
            throw new AuthException(AuthErrorCode.MALFORMED_TOKEN, "JWT must be a non-empty string");
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new AuthException(AuthErrorCode.MALFORMED_TOKEN,
                "JWT must consist of 3 segments separated by '.', found " + parts.length);
        }

        JwtHeader header = JwtHeader.fromMap(readObject(parts[0], "header"));
        UnverifiedClaims claims = UnverifiedClaims.fromPayload(readObject(parts[1], "payload"));
        byte[] signature = base64(parts[2], "signature");
        byte[] signedBytes = (parts[0] + "." + parts[1]).getBytes(StandardCharsets.UTF_8);
        return new DecodedJwt(header, claims, signedBytes, signature);
    }

    private Map<String, Object> readObject(String segment, String name) {
        byte[] json = base64(segment, name);
        Map<String, Object> value;
        try {
            value = mapper.readValue(json, JSON_OBJECT);
        } catch (IOException e) {
            throw new AuthException(AuthErrorCode.MALFORMED_TOKEN, "JWT " + name + " is not a JSON object", e);
        }
        if (value == null) {
            throw new AuthException(AuthErrorCode.MALFORMED_TOKEN, "JWT " + name + " is not a JSON object");
        }
        return value;
    }

    private static byte[] base64(String segment, String name) {
        try {
            return DECODER.decode(segment);
        } catch (IllegalArgumentException e) {
            throw new AuthException(AuthErrorCode.MALFORMED_TOKEN, "JWT " + name + " is not valid base64url", e);
        }
    }
}
