package com.github.dimitryivaniuta.jwt.validation;

import com.github.dimitryivaniuta.jwt.claims.ClaimValues;
import com.github.dimitryivaniuta.jwt.error.TokenFailure;
import java.util.*;

/**
 * Every configured claim must be present with a non-empty value. Reports all
 * missing names at once, not just the first.
 */
public final class RequiredClaimsCheck implements ClaimCheck {

    private final List<String> required;

    public RequiredClaimsCheck(final Collection<String> required) {
        this.required = List.copyOf(required);
    }

    @Override
    public ClaimCheckResult check(final Map<String, Object> claims) {
        List<String> missing = new ArrayList<>();
        for (String claim : required) {
            if (!ClaimValues.isPresent(claims, claim)) {
                missing.add(claim);
            }
        }
        return missing.isEmpty() ? ClaimCheckResult.success()
                : ClaimCheckResult.failure(new TokenFailure.MissingClaims(missing));
    }
}
