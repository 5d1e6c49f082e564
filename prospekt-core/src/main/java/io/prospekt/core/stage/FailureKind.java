package io.prospekt.core.stage;

/// Classification of a stage or provider failure that drives the retry decision.
public enum FailureKind {
    /// Retryable: network errors, timeouts, rate limits, provider outages.
    TRANSIENT,
    /// Not retryable: invalid input, rejected credentials, unusable provider output.
    TERMINAL;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
