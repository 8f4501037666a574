package com.baas.auth.jwt;

/**
 * Result of splitting and decoding a compact JWT. Nothing in here is trusted yet.
 *
 * @param header      decoded JOSE header
 * @param claims      decoded payload
 * @param signedBytes UTF-8 bytes of {@code segment1 + "." + segment2} exactly as received
 * @param signature   decoded third segment
 */
public record DecodedJwt(JwtHeader header, UnverifiedClaims claims, byte[] signedBytes, byte[] signature) {
}
