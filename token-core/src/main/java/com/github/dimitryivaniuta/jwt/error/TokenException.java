package com.github.dimitryivaniuta.jwt.error;

import java.util.Objects;

/**
 * Raised by the token manager and signer. Inspect {@link #getFailure()} to
 * tell the kinds apart; none of them are worth retrying with the same token.
 */
public class TokenException extends RuntimeException {

    private final transient TokenFailure failure;

    public TokenException(final TokenFailure failure) {
        super(Objects.requireNonNull(failure, "failure").message());
        this.failure = failure;
    }

    public TokenException(final TokenFailure failure, final Throwable cause) {
        super(Objects.requireNonNull(failure, "failure").message(), cause);
        this.failure = failure;
    }

    public TokenFailure getFailure() {
        return failure;
    }

    /** Stable machine-readable key, e.g. {@code expiredToken}. */
    public String getErrorKey() {
        return failure.key();
    }
}
