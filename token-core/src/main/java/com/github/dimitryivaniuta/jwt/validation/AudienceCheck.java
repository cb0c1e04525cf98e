package com.github.dimitryivaniuta.jwt.validation;

import com.github.dimitryivaniuta.jwt.claims.ClaimValues;
import com.github.dimitryivaniuta.jwt.claims.Claims;
import com.github.dimitryivaniuta.jwt.error.TokenFailure;
import java.util.*;

/**
 * Validates that token 'aud' contains at least one of the accepted values.
 * Only string values take part in the match; numbers or booleans never equal
 * a configured audience.
 */
public final class AudienceCheck implements ClaimCheck {

    /** Audiences this consumer accepts, in configured order. */
    private final List<String> accepted;

    public AudienceCheck(final Collection<String> accepted) {
        this.accepted = List.copyOf(accepted);
    }

    @Override
    public ClaimCheckResult check(final Map<String, Object> claims) {
        Object aud = claims.get(Claims.AUDIENCE);
        if (aud == null) {
            return ClaimCheckResult.failure(new TokenFailure.InvalidClaim(Claims.AUDIENCE, null, accepted));
        }
        boolean ok = stringValues(aud).stream().anyMatch(accepted::contains);
        return ok ? ClaimCheckResult.success()
                : ClaimCheckResult.failure(new TokenFailure.InvalidClaim(Claims.AUDIENCE,
                        ClaimValues.getStringList(claims, Claims.AUDIENCE), accepted));
    }

    // a bare string is an audience list of one
    private static List<String> stringValues(final Object aud) {
        if (aud instanceof String s) return List.of(s);
        if (aud instanceof Collection<?> c) {
            List<String> values = new ArrayList<>();
            for (Object v : c) {
                if (v instanceof String s) values.add(s);
            }
            return values;
        }
        return List.of();
    }
}
