package com.github.dimitryivaniuta.jwt.validation;

import com.github.dimitryivaniuta.jwt.error.TokenFailure;
import java.util.Objects;
import java.util.Optional;

/** Outcome of a {@link ClaimCheck}: success, or exactly one failure. */
public final class ClaimCheckResult {

    private static final ClaimCheckResult SUCCESS = new ClaimCheckResult(null);

    private final TokenFailure failure;

    private ClaimCheckResult(final TokenFailure failure) {
        this.failure = failure;
    }

    public static ClaimCheckResult success() {
        return SUCCESS;
    }

    public static ClaimCheckResult failure(final TokenFailure failure) {
        return new ClaimCheckResult(Objects.requireNonNull(failure, "failure"));
    }

    public boolean hasFailure() {
        return failure != null;
    }

    public Optional<TokenFailure> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return failure == null ? "ClaimCheckResult[success]" : "ClaimCheckResult[" + failure.key() + "]";
    }
}
