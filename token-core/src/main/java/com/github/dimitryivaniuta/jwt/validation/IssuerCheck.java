package com.github.dimitryivaniuta.jwt.validation;

import com.github.dimitryivaniuta.jwt.claims.Claims;
import com.github.dimitryivaniuta.jwt.error.TokenFailure;
import java.util.Map;
import java.util.Objects;

/** 'iss' must equal the configured issuer exactly. */
public final class IssuerCheck implements ClaimCheck {

    private final String expectedIssuer;

    public IssuerCheck(final String expectedIssuer) {
        this.expectedIssuer = Objects.requireNonNull(expectedIssuer, "expectedIssuer");
    }

    @Override
    public ClaimCheckResult check(final Map<String, Object> claims) {
        Object iss = claims.get(Claims.ISSUER);
        return expectedIssuer.equals(iss) ? ClaimCheckResult.success()
                : ClaimCheckResult.failure(new TokenFailure.InvalidClaim(Claims.ISSUER, iss, expectedIssuer));
    }
}
