package io.prospekt.core.execution;

import java.time.Duration;
import java.util.Objects;

/// Bounded retry policy applied to each stage.
///
/// Only {@link io.prospekt.core.stage.FailureKind#TRANSIENT} failures are retried. The
/// delay before attempt `n` (n ≥ 2) grows exponentially and is capped:
///
/// ```
/// delay(n) = min(maxDelay, initialDelay * multiplier^(n-2))
/// ```
///
/// Each attempt is bounded by {@link #getAttemptTimeout()}; an attempt exceeding it
/// counts as a transient failure.
///
/// ### Defaults
/// | Parameter | Default |
/// |-----------|---------|
/// | `maxAttempts` | 3 |
/// | `initialDelay` | 500 ms |
/// | `multiplier` | 2.0 |
/// | `maxDelay` | 5 s |
/// | `attemptTimeout` | 60 s |
///
/// @implNote Immutable and thread-safe.
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(500);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_ATTEMPT_TIMEOUT = Duration.ofSeconds(60);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final Duration attemptTimeout;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelay = builder.initialDelay;
        this.multiplier = builder.multiplier;
        this.maxDelay = builder.maxDelay;
        this.attemptTimeout = builder.attemptTimeout;
    }

    public static RetryPolicy defaults() {
        return builder().build();
    }

    /// Creates a policy that never retries.
    public static RetryPolicy noRetry() {
        return builder().maxAttempts(1).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the delay to wait before the given attempt.
    ///
    /// @param attempt 1-based attempt number
    /// @return zero for the first attempt, otherwise the capped exponential delay
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double factor = Math.pow(multiplier, attempt - 2);
        double millis = initialDelay.toMillis() * factor;
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public Duration getAttemptTimeout() {
        return attemptTimeout;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts="
                + maxAttempts
                + ", initialDelay="
                + initialDelay
                + ", multiplier="
                + multiplier
                + ", maxDelay="
                + maxDelay
                + ", attemptTimeout="
                + attemptTimeout
                + "}";
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration initialDelay = DEFAULT_INITIAL_DELAY;
        private double multiplier = DEFAULT_MULTIPLIER;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private Duration attemptTimeout = DEFAULT_ATTEMPT_TIMEOUT;

        private Builder() {}

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder attemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
            return this;
        }

        /// @throws IllegalArgumentException if a parameter is out of range
        public RetryPolicy build() {
            Objects.requireNonNull(initialDelay, "initialDelay must not be null");
            Objects.requireNonNull(maxDelay, "maxDelay must not be null");
            Objects.requireNonNull(attemptTimeout, "attemptTimeout must not be null");
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            if (initialDelay.isNegative() || maxDelay.isNegative()) {
                throw new IllegalArgumentException("delays must not be negative");
            }
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must not be below initialDelay");
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be at least 1.0");
            }
            if (attemptTimeout.isNegative() || attemptTimeout.isZero()) {
                throw new IllegalArgumentException("attemptTimeout must be positive");
            }
            return new RetryPolicy(this);
        }
    }
}
