package com.github.dimitryivaniuta.jwt.autoconfigure;

import com.github.dimitryivaniuta.jwt.TokenManager;
import com.github.dimitryivaniuta.jwt.config.TokenConfig;
import com.github.dimitryivaniuta.jwt.id.IdGenerator;
import com.github.dimitryivaniuta.jwt.signer.NimbusTokenSigner;
import com.github.dimitryivaniuta.jwt.signer.TokenSigner;
import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires a {@link TokenManager} from {@code security.jwt.token.*} once an issuer
 * is configured. Every bean backs off when the application defines its own;
 * an application {@link Clock} bean is picked up when present.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(JwtTokenProperties.class)
@ConditionalOnClass(TokenManager.class)
@ConditionalOnProperty(prefix = "security.jwt.token", name = "issuer")
public class JwtTokenAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public TokenConfig tokenConfig(final JwtTokenProperties props) {
        TokenConfig config = TokenConfig.builder()
                .issuer(props.getIssuer())
                .algorithm(props.getAlgorithm())
                .signingKey(KeyMaterialLoader.signingKey(props))
                .verificationKey(KeyMaterialLoader.verificationKey(props))
                .ttlMinutes(wholeMinutes(props.getAccessTokenTtl(), "access-token-ttl"))
                .refreshTtlMinutes(wholeMinutes(props.getRefreshTokenTtl(), "refresh-token-ttl"))
                .audience(props.getAudience())
                .requiredClaims(props.getRequiredClaims())
                .zone(props.getZone())
                .build();
        log.info("JWT token manager configured: iss={} alg={} ttl={}m aud={}",
                config.getIssuer(), config.getAlgorithm().getValue(), config.getTtlMinutes(),
                config.getAudience().map(Object::toString).orElse("<any>"));
        return config;
    }

    /** Tokens carry lifetimes in whole minutes; anything finer would be truncated silently. */
    static long wholeMinutes(final Duration ttl, final String property) {
        if (ttl == null || ttl.isNegative() || ttl.isZero() || ttl.toSeconds() % 60 != 0 || ttl.toNanosPart() != 0) {
            throw new IllegalStateException("security.jwt.token." + property
                    + " must be a positive whole number of minutes, got " + ttl);
        }
        return ttl.toMinutes();
    }

    @Bean
    @ConditionalOnMissingBean
    public IdGenerator tokenIdGenerator() {
        return IdGenerator.timeOrdered();
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenSigner tokenSigner(final TokenConfig config, final ObjectProvider<Clock> clock) {
        return new NimbusTokenSigner(clock.getIfAvailable(() -> Clock.system(config.getZone())));
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenManager tokenManager(final TokenConfig config,
                                     final TokenSigner signer,
                                     final IdGenerator ids,
                                     final ObjectProvider<Clock> clock) {
        return new TokenManager(config, signer, ids, clock.getIfAvailable(() -> Clock.system(config.getZone())));
    }
}
