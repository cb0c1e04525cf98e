package com.github.dimitryivaniuta.jwt.validation;

import com.github.dimitryivaniuta.jwt.config.TokenConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs claim checks in order and stops at the first failure, so the reported
 * error for a given token is always the same.
 */
public final class ClaimValidator {

    /** Only tokens of this type are accepted by decode. */
    public static final String ACCESS_TOKEN_TYPE = "access";

    private final List<ClaimCheck> checks;

    public ClaimValidator(final List<ClaimCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    /**
     * Required claims, issuer, audience (only when the config restricts it),
     * then token type.
     */
    public static ClaimValidator forConfig(final TokenConfig config) {
        List<ClaimCheck> checks = new ArrayList<>();
        checks.add(new RequiredClaimsCheck(config.getRequiredClaims()));
        checks.add(new IssuerCheck(config.getIssuer()));
        config.getAudience().ifPresent(aud -> checks.add(new AudienceCheck(aud)));
        checks.add(new TokenTypeCheck(ACCESS_TOKEN_TYPE));
        return new ClaimValidator(checks);
    }

    public ClaimCheckResult validate(final Map<String, Object> claims) {
        for (ClaimCheck check : checks) {
            ClaimCheckResult result = check.check(claims);
            if (result.hasFailure()) {
                return result;
            }
        }
        return ClaimCheckResult.success();
    }

    public List<ClaimCheck> getChecks() {
        return checks;
    }
}
