package com.github.dimitryivaniuta.jwt;

import com.github.dimitryivaniuta.jwt.claims.Claims;
import com.github.dimitryivaniuta.jwt.config.TokenConfig;
import com.github.dimitryivaniuta.jwt.error.TokenException;
import com.github.dimitryivaniuta.jwt.id.IdGenerator;
import com.github.dimitryivaniuta.jwt.signer.NimbusTokenSigner;
import com.github.dimitryivaniuta.jwt.signer.TokenSigner;
import com.github.dimitryivaniuta.jwt.validation.ClaimCheckResult;
import com.github.dimitryivaniuta.jwt.validation.ClaimValidator;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Issues and validates signed access tokens.
 *
 * <p>Claims written by {@link #encode(String, Map)}:</p>
 * <ul>
 *   <li>protected, never taken from the caller: iss, sub, iat, exp, jti, sid</li>
 *   <li>defaults the caller may override: aud (configured audience, if any), typ ("access"), nbf (iat - 5s)</li>
 *   <li>anything else the caller passes</li>
 * </ul>
 *
 * <p>{@link #decode(String)} verifies signature and nbf/exp first, then required
 * claims, issuer, audience and token type, in that order.</p>
 *
 * <p>Thread-safe except for {@link #getLastJti()} / {@link #getLastSessionId()},
 * which reflect whichever encode finished last on this instance. Concurrent
 * callers should use {@link #issue(String, Map)} instead.</p>
 */
@Slf4j
public class TokenManager {

    /** Backdating of nbf to tolerate clock drift between issuer and verifier. */
    static final long NOT_BEFORE_SKEW_SECONDS = 5;

    private final TokenConfig config;
    private final TokenSigner signer;
    private final IdGenerator ids;
    private final Clock clock;
    private final ClaimValidator validator;

    /** Last token issued by this instance, null before the first encode. */
    private volatile IssuedToken lastIssued;

    public TokenManager(final TokenConfig config) {
        this(config, Clock.system(config.getZone()));
    }

    public TokenManager(final TokenConfig config, final Clock clock) {
        this(config, new NimbusTokenSigner(clock), IdGenerator.timeOrdered(), clock);
    }

    public TokenManager(final TokenConfig config, final TokenSigner signer, final IdGenerator ids, final Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.validator = ClaimValidator.forConfig(config);
    }

    public String encode(final String subject) {
        return issue(subject, Map.of()).token();
    }

    /**
     * Creates a signed access token.
     *
     * @param subject      user id or other subject identifier, not blank
     * @param customClaims extra claims; values under protected keys are ignored
     * @return compact token
     * @throws TokenException with {@code SigningFailed} when the signing key does not fit the algorithm
     */
    public String encode(final String subject, final Map<String, ?> customClaims) {
        return issue(subject, customClaims).token();
    }

    /**
     * Same as {@link #encode(String, Map)} but also returns the jti and sid
     * stamped into the token, without going through shared state.
     */
    public IssuedToken issue(final String subject, final Map<String, ?> customClaims) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        long now = clock.instant().getEpochSecond();
        String jti = ids.nextId();
        String sid = ids.nextId();

        Map<String, Object> claims = new LinkedHashMap<>();
        config.getAudience().ifPresent(aud -> claims.put(Claims.AUDIENCE, aud));
        claims.put(Claims.TYPE, ClaimValidator.ACCESS_TOKEN_TYPE);
        claims.put(Claims.NOT_BEFORE, now - NOT_BEFORE_SKEW_SECONDS);

        if (customClaims != null) {
            customClaims.forEach((name, value) -> {
                if (name == null) {
                    throw new IllegalArgumentException("custom claim names must not be null");
                }
                if (Claims.PROTECTED.contains(name)) {
                    log.debug("Ignoring caller value for protected claim {}", name);
                } else {
                    claims.put(name, value);
                }
            });
        }

        claims.put(Claims.ISSUER, config.getIssuer());
        claims.put(Claims.SUBJECT, subject);
        claims.put(Claims.ISSUED_AT, now);
        claims.put(Claims.EXPIRATION, now + config.getTtlSeconds());
        claims.put(Claims.JWT_ID, jti);
        claims.put(Claims.SESSION_ID, sid);

        String token = signer.sign(claims, config.getAlgorithm(), config.getSigningKey());

        var issued = new IssuedToken(token, jti, sid, Duration.ofSeconds(config.getTtlSeconds()));
        lastIssued = issued;
        if (log.isDebugEnabled()) {
            log.debug("Issued token sub={} jti={} sid={} alg={} exp={}",
                    subject, jti, sid, config.getAlgorithm().getValue(), now + config.getTtlSeconds());
        }
        return issued;
    }

    /**
     * Verifies and validates a token.
     *
     * @param token raw compact token, without a "Bearer " prefix
     * @return validated payload
     * @throws TokenException carrying the first failure found; signature and
     *                        time-window failures always win over claim failures
     */
    public TokenPayload decode(final String token) {
        Map<String, Object> claims = signer.verify(token, config.getAlgorithm(), config.getVerificationKey());

        ClaimCheckResult result = validator.validate(claims);
        result.getFailure().ifPresent(failure -> {
            throw new TokenException(failure);
        });

        var payload = new TokenPayload(claims);
        log.debug("Decoded token sub={} jti={}", payload.getSubject(), payload.getJti());
        return payload;
    }

    /**
     * Opaque refresh credential: SHA-1 hex of the current epoch second.
     * Calls within the same second return the same value; store it server side
     * and expire it after {@link #getRefreshTokenTtlSeconds()}.
     *
     * @return 40 lowercase hex characters
     */
    public String generateRefreshToken() {
        return DigestUtils.sha1Hex(Long.toString(clock.instant().getEpochSecond()));
    }

    public long getTokenTtlSeconds() {
        return config.getTtlSeconds();
    }

    public long getRefreshTokenTtlSeconds() {
        return config.getRefreshTtlSeconds();
    }

    /** Session id of the last token encoded by this instance. */
    public Optional<String> getLastSessionId() {
        IssuedToken last = lastIssued;
        return last == null ? Optional.empty() : Optional.of(last.sessionId());
    }

    /** JWT id of the last token encoded by this instance. */
    public Optional<String> getLastJti() {
        IssuedToken last = lastIssued;
        return last == null ? Optional.empty() : Optional.of(last.jti());
    }

    public TokenConfig getConfig() {
        return config;
    }
}
