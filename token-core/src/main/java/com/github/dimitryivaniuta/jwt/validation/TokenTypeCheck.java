package com.github.dimitryivaniuta.jwt.validation;

import com.github.dimitryivaniuta.jwt.claims.Claims;
import com.github.dimitryivaniuta.jwt.error.TokenFailure;
import java.util.Map;
import java.util.Objects;

/** 'typ' must equal the expected token type, "access" for this library. */
public final class TokenTypeCheck implements ClaimCheck {

    private final String expectedType;

    public TokenTypeCheck(final String expectedType) {
        this.expectedType = Objects.requireNonNull(expectedType, "expectedType");
    }

    @Override
    public ClaimCheckResult check(final Map<String, Object> claims) {
        Object typ = claims.get(Claims.TYPE);
        return expectedType.equals(typ) ? ClaimCheckResult.success()
                : ClaimCheckResult.failure(new TokenFailure.InvalidClaim(Claims.TYPE, typ, expectedType));
    }
}
