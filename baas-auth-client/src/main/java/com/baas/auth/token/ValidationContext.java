package com.baas.auth.token;

/**
 * Expectations an ID token is checked against, captured once per verification.
 *
 * @param projectId           expected audience
 * @param expectedIssuer      issuer prefix followed by the project id
 * @param customTokenAudience audience that marks a self-signed custom token
 * @param now                 current time in epoch seconds
 * @param skewSeconds         tolerance applied to iat and exp
 */
public record ValidationContext(
    String projectId,
    String expectedIssuer,
    String customTokenAudience,
    long now,
    long skewSeconds
) {
}
