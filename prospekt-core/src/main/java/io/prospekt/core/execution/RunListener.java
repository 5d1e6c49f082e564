package io.prospekt.core.execution;

import io.prospekt.core.report.Report;
import io.prospekt.core.report.StageError;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.stage.StageResult;
import io.prospekt.core.subject.Subject;
import java.time.Duration;

/// Listener for orchestrator run lifecycle events.
///
/// All methods have default no-op implementations, so listeners override only the
/// events they care about.
///
/// ### Callback Lifecycle
/// ```
/// onStateChange(CACHE_CHECK)
/// onCacheHit(report)                      - cache hit, run ends here
/// onRunStart(subject, runId)              - cache miss
/// per stage:
///   onStageStart(stage, attempt)          - once per attempt
///   onStageRetry(stage, attempt, ...)     - before each retry
///   onStageComplete | onStageFailed | onStageSkipped
/// onStateChange(FINALIZING)
/// onRunComplete(report)
/// ```
///
/// @implNote Independent runs may notify the same listener from different threads;
/// implementations shared across runs must be thread-safe.
///
/// @see CompositeRunListener
/// @see LoggingRunListener
public interface RunListener {

    /// Called on every state transition of a run.
    ///
    /// @param subject subject of the run, not null
    /// @param state state being entered, not null
    default void onStateChange(Subject subject, RunState state) {}

    /// Called when a cached report is returned instead of running stages.
    ///
    /// @param report cached report flagged as served from cache, not null
    default void onCacheHit(Report report) {}

    /// Called after a fresh execution context is created.
    ///
    /// @param subject subject of the run, not null
    /// @param runId identifier of the new run, not null
    default void onRunStart(Subject subject, String runId) {}

    /// Called before each attempt of a stage.
    ///
    /// @param stage stage about to run, not null
    /// @param attempt 1-based attempt number
    default void onStageStart(StageName stage, int attempt) {}

    /// Called when a transient failure will be retried.
    ///
    /// @param stage stage that failed, not null
    /// @param nextAttempt 1-based number of the upcoming attempt
    /// @param failure failure of the previous attempt, not null
    /// @param delay backoff before the next attempt, not null
    default void onStageRetry(
            StageName stage, int nextAttempt, StageResult.Failure failure, Duration delay) {}

    /// Called when a stage output has been recorded.
    ///
    /// @param stage completed stage, not null
    /// @param output recorded output, not null
    /// @param attempts number of attempts used
    default void onStageComplete(StageName stage, StageOutput output, int attempts) {}

    /// Called when a stage failed terminally and its error has been recorded.
    ///
    /// @param error recorded error, not null
    default void onStageFailed(StageError error) {}

    /// Called when a stage is skipped because a dependency failed or was skipped.
    ///
    /// @param stage skipped stage, not null
    /// @param missingDependency the dependency whose output is absent, not null
    default void onStageSkipped(StageName stage, StageName missingDependency) {}

    /// Called once the report of a non-cached run has been assembled.
    ///
    /// @param report final report, not null
    default void onRunComplete(Report report) {}

    /// No-op listener instance that ignores all events.
    RunListener NOOP = new RunListener() {};
}
