package io.prospekt.core.stage;

import java.util.Objects;

/// Outcome of a single stage attempt.
///
/// Stages report failures as values rather than exceptions so the orchestrator's
/// retry decision depends only on {@link Failure#kind()}.
///
/// ### Permitted Subtypes
/// - {@link Success} - the stage produced its output
/// - {@link Failure} - the attempt failed, transiently or terminally
///
/// @see Stage#invoke(io.prospekt.core.subject.Subject, ContextView)
public sealed interface StageResult {

    static Success success(StageOutput output) {
        return new Success(output);
    }

    static Failure transientFailure(String message) {
        return new Failure(FailureKind.TRANSIENT, message, null);
    }

    static Failure terminalFailure(String message) {
        return new Failure(FailureKind.TERMINAL, message, null);
    }

    static Failure failure(FailureKind kind, String message, Throwable cause) {
        return new Failure(kind, message, cause);
    }

    /// The stage completed and produced output.
    ///
    /// @param output stage output, not null
    record Success(StageOutput output) implements StageResult {

        public Success {
            Objects.requireNonNull(output, "output must not be null");
        }
    }

    /// The attempt failed.
    ///
    /// @param kind retry classification, not null
    /// @param message human readable description, not null
    /// @param cause underlying exception, may be null
    record Failure(FailureKind kind, String message, Throwable cause) implements StageResult {

        public Failure {
            Objects.requireNonNull(kind, "kind must not be null");
            message = message != null ? message : "Unknown failure";
        }

        public boolean isRetryable() {
            return kind.isRetryable();
        }
    }
}
