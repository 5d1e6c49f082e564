package io.prospekt.core.provider;

import io.prospekt.core.stage.FailureKind;
import java.io.Serial;
import java.util.Objects;

/// Failure raised by an external provider (search backend or language model).
///
/// Carries the {@link FailureKind} so stages can translate it into a
/// {@link io.prospekt.core.stage.StageResult.Failure} without inspecting exception types.
public class ProviderException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4127384651289017733L;

    private final FailureKind kind;

    public ProviderException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ProviderException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ProviderException transientFailure(String message, Throwable cause) {
        return new ProviderException(FailureKind.TRANSIENT, message, cause);
    }

    public static ProviderException terminalFailure(String message, Throwable cause) {
        return new ProviderException(FailureKind.TERMINAL, message, cause);
    }

    public FailureKind getKind() {
        return kind;
    }
}
