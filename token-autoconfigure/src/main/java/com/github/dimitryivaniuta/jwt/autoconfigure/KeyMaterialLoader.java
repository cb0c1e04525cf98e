package com.github.dimitryivaniuta.jwt.autoconfigure;

import com.github.dimitryivaniuta.jwt.signer.SigningKeys;
import com.nimbusds.jose.jwk.JWK;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.springframework.core.io.Resource;

/**
 * Resolves {@link JwtTokenProperties} key settings into Nimbus keys.
 */
final class KeyMaterialLoader {
    private KeyMaterialLoader() {}

    static JWK signingKey(final JwtTokenProperties props) {
        if (props.getAlgorithm().isSymmetric()) {
            if (!props.hasSecret()) {
                throw new IllegalStateException("security.jwt.token.secret is required for " + props.getAlgorithm());
            }
            byte[] bytes = props.isSecretBase64()
                    ? Base64.getDecoder().decode(props.getSecret().trim())
                    : props.getSecret().getBytes(StandardCharsets.UTF_8);
            return SigningKeys.hmac(bytes);
        }
        Resource privateKey = props.getPrivateKeyLocation();
        if (privateKey == null) {
            return null;
        }
        String material = read(privateKey).trim();
        // a PKCS#8 private key alone does not carry the public half Nimbus needs
        if (!material.startsWith("{") && props.getPublicKeyLocation() != null) {
            material = material + "\n" + read(props.getPublicKeyLocation()).trim();
        }
        return SigningKeys.parse(material);
    }

    static JWK verificationKey(final JwtTokenProperties props) {
        if (props.getAlgorithm().isSymmetric() || props.getPublicKeyLocation() == null) {
            return null;
        }
        return SigningKeys.parse(read(props.getPublicKeyLocation()));
    }

    private static String read(final Resource resource) {
        try {
            return resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read key material from " + resource.getDescription(), e);
        }
    }
}
