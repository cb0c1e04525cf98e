package com.github.dimitryivaniuta.jwt.autoconfigure;

import com.github.dimitryivaniuta.jwt.config.Algorithm;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

/**
 * Token issuing + validation settings, bound from {@code security.jwt.token.*}.
 */
@Data
@ConfigurationProperties(prefix = "security.jwt.token")
public class JwtTokenProperties {

    /** Issuer value to stamp into tokens and require on decode. */
    private String issuer;

    /** Signing algorithm; HS* needs {@link #secret}, the others key locations. */
    private Algorithm algorithm = Algorithm.RS256;

    /** Access token lifetime, whole minutes. */
    private Duration accessTokenTtl = Duration.ofMinutes(60);

    /** Refresh token lifetime, whole minutes; informational, the caller enforces it. */
    private Duration refreshTokenTtl = Duration.ofDays(14);

    /** Accepted audiences; leave unset to skip audience validation. */
    private List<String> audience;

    /** Claims that must be present and non-empty; unset keeps the library defaults. */
    private List<String> requiredClaims;

    /** Zone of the default clock. */
    private ZoneId zone = ZoneOffset.UTC;

    /** HMAC shared secret. */
    private String secret;

    /** Whether {@link #secret} is Base64 encoded rather than plain UTF-8. */
    private boolean secretBase64 = false;

    /** PEM or JWK JSON private key used for signing. */
    private Resource privateKeyLocation;

    /** PEM or JWK JSON public key used for verification. */
    private Resource publicKeyLocation;

    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }
}
