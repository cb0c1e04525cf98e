package com.github.dimitryivaniuta.jwt.validation;

import java.util.Map;

/**
 * One semantic rule over a decoded, signature-verified claim map.
 * Implementations are pure and thread-safe.
 */
@FunctionalInterface
public interface ClaimCheck {

    ClaimCheckResult check(Map<String, Object> claims);
}
