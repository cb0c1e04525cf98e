package com.github.dimitryivaniuta.jwt.config;

import com.github.dimitryivaniuta.jwt.claims.Claims;
import com.nimbusds.jose.jwk.JWK;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.Value;

/**
 * Immutable token settings: keys, algorithm, lifetimes, issuer, accepted
 * audiences and the claims every token must carry.
 * Safe to share between managers and threads.
 */
@Value
public class TokenConfig {

    public static final long DEFAULT_TTL_MINUTES = 60;
    public static final long DEFAULT_REFRESH_TTL_MINUTES = 20160;
    public static final Algorithm DEFAULT_ALGORITHM = Algorithm.RS256;

    /** Key used by encode; may be null for verify-only setups. */
    @ToString.Exclude
    JWK signingKey;

    /** Key used by decode; the shared secret for HMAC, a public key otherwise. */
    @ToString.Exclude
    JWK verificationKey;

    Algorithm algorithm;

    /** Value stamped into and required in {@code iss}. */
    String issuer;

    long ttlMinutes;

    long refreshTtlMinutes;

    /** Accepted audiences; null disables the audience check. */
    @Getter(AccessLevel.NONE)
    List<String> audience;

    List<String> requiredClaims;

    /** Zone of the default clock; tokens carry epoch seconds either way. */
    ZoneId zone;

    /**
     * @param signingKey        private or shared key used to sign
     * @param verificationKey   public or shared key used to verify; derived from the signing key when null
     * @param algorithm         signing algorithm, {@link #DEFAULT_ALGORITHM} when null
     * @param issuer            non-blank issuer
     * @param ttlMinutes        access token lifetime, {@link #DEFAULT_TTL_MINUTES} when null
     * @param refreshTtlMinutes refresh token lifetime, {@link #DEFAULT_REFRESH_TTL_MINUTES} when null
     * @param audience          accepted audiences, null to skip audience validation
     * @param requiredClaims    claims that must be present and non-empty, {@link Claims#DEFAULT_REQUIRED} when null
     * @param zone              clock zone, UTC when null
     */
    @Builder
    private TokenConfig(final JWK signingKey,
                        final JWK verificationKey,
                        final Algorithm algorithm,
                        final String issuer,
                        final Long ttlMinutes,
                        final Long refreshTtlMinutes,
                        final Collection<String> audience,
                        final Collection<String> requiredClaims,
                        final ZoneId zone) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be blank");
        }
        if (signingKey == null && verificationKey == null) {
            throw new IllegalArgumentException("either a signing key or a verification key is required");
        }
        this.algorithm = algorithm != null ? algorithm : DEFAULT_ALGORITHM;
        this.signingKey = signingKey;
        this.verificationKey = verificationKey != null ? verificationKey : derivePublic(signingKey, this.algorithm);
        this.issuer = issuer;
        this.ttlMinutes = ttlMinutes != null ? ttlMinutes : DEFAULT_TTL_MINUTES;
        this.refreshTtlMinutes = refreshTtlMinutes != null ? refreshTtlMinutes : DEFAULT_REFRESH_TTL_MINUTES;
        this.audience = audience == null ? null : distinct(audience);
        this.requiredClaims = requiredClaims == null ? Claims.DEFAULT_REQUIRED : distinct(requiredClaims);
        this.zone = zone != null ? zone : ZoneOffset.UTC;
    }

    public long getTtlSeconds() {
        return ttlMinutes * 60;
    }

    public long getRefreshTtlSeconds() {
        return refreshTtlMinutes * 60;
    }

    /** Accepted audiences, or empty when audience validation is disabled. */
    public Optional<List<String>> getAudience() {
        return Optional.ofNullable(audience);
    }

    private static JWK derivePublic(final JWK signingKey, final Algorithm algorithm) {
        // shared secrets have no public half; Nimbus returns null for them
        if (algorithm.isSymmetric() || !signingKey.isPrivate()) {
            return signingKey;
        }
        return signingKey.toPublicJWK();
    }

    private static List<String> distinct(final Collection<String> values) {
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }
}
