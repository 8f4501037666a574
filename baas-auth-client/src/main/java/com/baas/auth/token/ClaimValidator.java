package com.baas.auth.token;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.baas.auth.AuthError;
import com.baas.auth.AuthException;
import com.baas.auth.jwt.DecodedJwt;
import com.baas.auth.jwt.UnverifiedClaims;

/**
 * Turns a decoded, signature-checked JWT into a {@link Token} by applying {@link IdTokenRule}s in order.
 */
public final class ClaimValidator {

    private final List<IdTokenRule> rules;
    private final String projectId;
    private final String expectedIssuer;
    private final String customTokenAudience;
    private final Duration allowedClockSkew;
    private final Clock clock;

    public ClaimValidator(String projectId, String issuerPrefix, String customTokenAudience,
                          Duration allowedClockSkew, Clock clock) {
        this(IdTokenRule.inOrder(), projectId, issuerPrefix, customTokenAudience, allowedClockSkew, clock);
    }

    ClaimValidator(List<IdTokenRule> rules, String projectId, String issuerPrefix, String customTokenAudience,
                   Duration allowedClockSkew, Clock clock) {
        this.rules = List.copyOf(rules);
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.expectedIssuer = Objects.requireNonNull(issuerPrefix, "issuerPrefix") + projectId;
        this.customTokenAudience = Objects.requireNonNull(customTokenAudience, "customTokenAudience");
        this.allowedClockSkew = Objects.requireNonNull(allowedClockSkew, "allowedClockSkew");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs only the header rules, so that a token without a key id is classified before any key lookup.
     */
    public void checkHeader(DecodedJwt jwt) {
        ValidationContext ctx = context();
        for (IdTokenRule rule : rules) {
            if (rule.isHeaderRule()) {
                throwIfFailed(rule.check(jwt, ctx));
            }
        }
    }

    public Token validate(DecodedJwt jwt) {
        ValidationContext ctx = context();
        for (IdTokenRule rule : rules) {
            throwIfFailed(rule.check(jwt, ctx));
        }

        UnverifiedClaims c = jwt.claims();
        return new Token(
            c.issuer(),
            c.audience(),
            c.issuedAt() == null ? 0 : c.issuedAt(),
            c.expiresAt() == null ? 0 : c.expiresAt(),
            c.subject(),
            c.claims()
        );
    }

    private ValidationContext context() {
        return new ValidationContext(
            projectId,
            expectedIssuer,
            customTokenAudience,
            clock.instant().getEpochSecond(),
            allowedClockSkew.getSeconds()
        );
    }

    private static void throwIfFailed(Optional<AuthError> failure) {
        if (failure.isPresent()) {
            throw new AuthException(failure.get());
        }
    }
}
