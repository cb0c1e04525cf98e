package com.github.dimitryivaniuta.jwt.config;

import java.util.Optional;

import static java.util.Locale.ROOT;

/**
 * Supported JWS signing algorithms, grouped by the key shape they need.
 */
public enum Algorithm {

    HS256("HS256"),
    HS384("HS384"),
    HS512("HS512"),

    RS256("RS256"),
    RS384("RS384"),
    RS512("RS512"),

    ES256("ES256"),
    ES384("ES384"),
    ES512("ES512"),

    PS256("PS256"),
    PS384("PS384"),
    PS512("PS512"),

    EdDSA("EdDSA");

    /** JOSE "alg" header value. */
    private final String value;

    Algorithm(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /** HMAC family: one shared secret signs and verifies. */
    public boolean isSymmetric() {
        return this == HS256 || this == HS384 || this == HS512;
    }

    public boolean isAsymmetric() {
        return !isSymmetric();
    }

    /** RSASSA-PKCS1-v1_5 and RSASSA-PSS. */
    public boolean isRsa() {
        return switch (this) {
            case RS256, RS384, RS512, PS256, PS384, PS512 -> true;
            default -> false;
        };
    }

    public boolean isEcdsa() {
        return this == ES256 || this == ES384 || this == ES512;
    }

    public boolean isEdDsa() {
        return this == EdDSA;
    }

    /**
     * Safe parser; exact JOSE spelling first, then case-insensitive.
     * Returns empty if the value isn't a known algorithm.
     */
    public static Optional<Algorithm> from(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String trimmed = name.trim();
        for (Algorithm a : values()) {
            if (a.value.equals(trimmed)) return Optional.of(a);
        }
        for (Algorithm a : values()) {
            if (a.value.toUpperCase(ROOT).equals(trimmed.toUpperCase(ROOT))) return Optional.of(a);
        }
        return Optional.empty();
    }
}
