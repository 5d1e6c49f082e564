package io.prospekt.core.stage;

/// Whether a stage's terminal failure aborts the run or only degrades it.
public enum StageCriticality {
    /// Terminal failure ends the run with {@link io.prospekt.core.report.RunStatus#FAILED}.
    REQUIRED,
    /// Terminal failure is recorded and the run finishes as
    /// {@link io.prospekt.core.report.RunStatus#PARTIAL_FAILURE}.
    BEST_EFFORT
}
