package io.prospekt.core.execution;

import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.stage.StageResult;

/// Resolved outcome of a stage after the retry policy has been applied.
///
/// ### Permitted Subtypes
/// - {@link Succeeded} - an attempt produced output
/// - {@link Failed} - a terminal failure, or transient failures until attempts ran out
/// - {@link Cancelled} - the run was cancelled; any in-flight result was discarded
///
/// @see StageRunner
public sealed interface StageOutcome {

    /// Number of attempts started.
    int attempts();

    /// @param output recorded output, not null
    /// @param attempts attempts used, at least 1
    record Succeeded(StageOutput output, int attempts) implements StageOutcome {}

    /// @param failure failure of the last attempt, not null
    /// @param attempts attempts used, at least 1
    record Failed(StageResult.Failure failure, int attempts) implements StageOutcome {}

    /// @param attempts attempts started before cancellation was observed
    record Cancelled(int attempts) implements StageOutcome {}
}
