package com.github.dimitryivaniuta.jwt.signer;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.ParseException;
import java.util.Objects;

/**
 * Turns raw key material into Nimbus {@link JWK}s.
 *
 * <p>PEM input may hold a public key alone or a private and public block
 * together (RSA or EC). Ed25519 keys are only accepted as JWK JSON.</p>
 */
public final class SigningKeys {
    private SigningKeys() {}

    public static OctetSequenceKey hmac(final String secret) {
        Objects.requireNonNull(secret, "secret");
        return hmac(secret.getBytes(StandardCharsets.UTF_8));
    }

    public static OctetSequenceKey hmac(final byte[] secret) {
        Objects.requireNonNull(secret, "secret");
        if (secret.length == 0) {
            throw new IllegalArgumentException("HMAC secret must not be empty");
        }
        return new OctetSequenceKey.Builder(secret).build();
    }

    public static JWK fromPem(final String pem) {
        Objects.requireNonNull(pem, "pem");
        try {
            return JWK.parseFromPEMEncodedObjects(pem);
        } catch (JOSEException e) {
            throw new IllegalArgumentException("Unable to read PEM key material: " + e.getMessage(), e);
        }
    }

    public static JWK fromJson(final String json) {
        Objects.requireNonNull(json, "json");
        try {
            return JWK.parse(json);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Unable to read JWK: " + e.getMessage(), e);
        }
    }

    /** JSON objects are read as JWK, anything else as PEM. */
    public static JWK parse(final String keyMaterial) {
        Objects.requireNonNull(keyMaterial, "keyMaterial");
        String trimmed = keyMaterial.trim();
        return trimmed.startsWith("{") ? fromJson(trimmed) : fromPem(trimmed);
    }

    public static JWK read(final Path path) {
        Objects.requireNonNull(path, "path");
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read key file " + path, e);
        }
    }

    /** Reads a private and a public key file and combines them into one key pair. */
    public static JWK read(final Path privateKeyPath, final Path publicKeyPath) {
        Objects.requireNonNull(privateKeyPath, "privateKeyPath");
        Objects.requireNonNull(publicKeyPath, "publicKeyPath");
        try {
            String pem = Files.readString(privateKeyPath, StandardCharsets.UTF_8).trim()
                    + "\n" + Files.readString(publicKeyPath, StandardCharsets.UTF_8).trim();
            return fromPem(pem);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read key files " + privateKeyPath + ", " + publicKeyPath, e);
        }
    }
}
