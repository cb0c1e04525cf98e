package com.github.dimitryivaniuta.jwt;

import com.github.dimitryivaniuta.jwt.claims.ClaimValues;
import com.github.dimitryivaniuta.jwt.claims.Claims;
import com.github.dimitryivaniuta.jwt.validation.ClaimValidator;
import java.time.Clock;
import java.util.*;

/**
 * Read-only view over the claims of a token that passed signature, time and
 * claim validation. Only {@link TokenManager#decode(String)} creates these.
 */
public final class TokenPayload {

    private final Map<String, Object> claims;

    TokenPayload(final Map<String, Object> claims) {
        this.claims = freezeMap(claims);
    }

    public String getSubject() {
        return ClaimValues.getString(claims, Claims.SUBJECT).orElse(null);
    }

    public String getIssuer() {
        return ClaimValues.getString(claims, Claims.ISSUER).orElse(null);
    }

    /** Audience as a list; a bare string becomes a single entry, absent means empty. */
    public List<String> getAudience() {
        return ClaimValues.getStringList(claims, Claims.AUDIENCE);
    }

    public String getJti() {
        return ClaimValues.getString(claims, Claims.JWT_ID).orElse(null);
    }

    public Optional<String> getSessionId() {
        return ClaimValues.getString(claims, Claims.SESSION_ID);
    }

    /** Token type, "access" when the claim is absent. */
    public String getType() {
        return ClaimValues.getString(claims, Claims.TYPE).orElse(ClaimValidator.ACCESS_TOKEN_TYPE);
    }

    public long getIssuedAt() {
        return seconds(Claims.ISSUED_AT);
    }

    public long getNotBefore() {
        return seconds(Claims.NOT_BEFORE);
    }

    public long getExpiration() {
        return seconds(Claims.EXPIRATION);
    }

    public boolean isExpired() {
        return isExpired(Clock.systemUTC());
    }

    public boolean isExpired(final Clock clock) {
        return clock.instant().getEpochSecond() > getExpiration();
    }

    /** Untyped lookup, null when the claim is absent. */
    public Object getClaim(final String name) {
        return claims.get(name);
    }

    public Optional<String> getString(final String name) {
        return ClaimValues.getString(claims, name);
    }

    public List<String> getStringList(final String name) {
        return ClaimValues.getStringList(claims, name);
    }

    /** True when the claim exists with a non-null value. */
    public boolean hasClaim(final String name) {
        return claims.get(name) != null;
    }

    public Map<String, Object> toMap() {
        return claims;
    }

    private long seconds(final String claim) {
        return ClaimValues.getSeconds(claims, claim)
                .orElseThrow(() -> new IllegalStateException("Claim " + claim + " is not a numeric date"));
    }

    /** Unmodifiable copies all the way down; JSON arrays may hold nulls, so no List.copyOf. */
    private static Object freeze(final Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object v : list) {
                copy.add(freeze(v));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static <K> Map<K, Object> freezeMap(final Map<K, ?> map) {
        Map<K, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(k, freeze(v)));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "TokenPayload" + claims;
    }
}
