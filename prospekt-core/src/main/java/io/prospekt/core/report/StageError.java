package io.prospekt.core.report;

import io.prospekt.core.stage.FailureKind;
import io.prospekt.core.stage.StageName;
import java.time.Instant;
import java.util.Objects;

/// A terminal stage failure retained in the report.
///
/// @param stage failed stage, not null
/// @param kind classification of the last failed attempt, not null
/// @param message description of the last failure, not null
/// @param attempts number of attempts made, at least 1
/// @param occurredAt when the stage gave up, not null
public record StageError(
        StageName stage, FailureKind kind, String message, int attempts, Instant occurredAt) {

    public StageError {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        message = message != null ? message : "";
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
    }
}
