package com.github.dimitryivaniuta.jwt.error;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Sealed set of reasons a token could not be issued or accepted.
 *
 * <p>{@link #key()} is stable and meant for mapping to HTTP status codes or
 * message bundles; {@link #message()} is for humans.</p>
 */
public sealed interface TokenFailure permits
        TokenFailure.Expired,
        TokenFailure.InvalidSignature,
        TokenFailure.InvalidToken,
        TokenFailure.InvalidClaim,
        TokenFailure.MissingClaims,
        TokenFailure.SigningFailed {

    String key();

    String message();

    /** The "exp" claim lies in the past. */
    record Expired() implements TokenFailure {
        public String key() { return "expiredToken"; }
        public String message() { return "Token has expired"; }
    }

    /** The signature does not match the configured verification key. */
    record InvalidSignature() implements TokenFailure {
        public String key() { return "invalidSignature"; }
        public String message() {
            return "Token signature verification failed. The public key could not validate this token.";
        }
    }

    /**
     * Catch-all for tokens that were never usable: malformed input or a
     * not-before time in the future.
     */
    record InvalidToken(Reason reason, String detail) implements TokenFailure {

        public enum Reason { MALFORMED, NOT_YET_VALID }

        public InvalidToken {
            Objects.requireNonNull(reason, "reason");
        }

        public static InvalidToken malformed(String detail) {
            return new InvalidToken(Reason.MALFORMED, detail);
        }

        public static InvalidToken notYetValid() {
            return new InvalidToken(Reason.NOT_YET_VALID, "Token is not yet valid");
        }

        public String key() { return "invalidToken"; }

        public String message() {
            return detail == null || detail.isBlank() ? "Token is invalid" : detail;
        }
    }

    /**
     * A claim is present (or absent) with a value this consumer does not accept.
     * A {@code null} actual value means the claim was absent; a {@code null}
     * expected value is left out of the message.
     */
    record InvalidClaim(String claim, Object actual, Object expected) implements TokenFailure {

        static final String ABSENT = "<absent>";

        public InvalidClaim {
            Objects.requireNonNull(claim, "claim");
        }

        public boolean isAbsent() {
            return actual == null;
        }

        public String key() { return "invalidClaim"; }

        public String message() {
            String msg = "Invalid claim \"" + claim + "\": got " + render(actual);
            if (expected != null) {
                msg += ", expected " + render(expected);
            }
            return msg;
        }

        private static String render(Object value) {
            if (value == null) return ABSENT;
            if (value instanceof Collection<?> c) {
                return c.stream()
                        .map(v -> v instanceof String s ? "\"" + s + "\"" : String.valueOf(v))
                        .collect(Collectors.joining(",", "[", "]"));
            }
            return "\"" + value + "\"";
        }
    }

    /** One or more required claims are absent or empty; names kept in configured order. */
    record MissingClaims(List<String> claims) implements TokenFailure {

        public MissingClaims {
            claims = List.copyOf(claims);
        }

        public String key() { return "missingClaims"; }

        public String message() {
            return "Token is missing required claims: " + String.join(", ", claims);
        }
    }

    /** Token creation failed; the key does not fit the configured algorithm. */
    record SigningFailed(String detail) implements TokenFailure {
        public String key() { return "signingError"; }
        public String message() {
            return detail == null || detail.isBlank() ? "Token signing failed" : "Token signing failed: " + detail;
        }
    }
}
