package io.prospekt.core.report;

/// Terminal status of one orchestrator run.
public enum RunStatus {
    /// Every stage produced output.
    COMPLETED,
    /// Required stages succeeded; at least one best-effort stage failed or was skipped.
    PARTIAL_FAILURE,
    /// A required stage failed terminally.
    FAILED,
    /// The run was cancelled before finishing.
    CANCELLED;

    /// Returns whether reports with this status may be cached.
    public boolean isCacheable() {
        return this == COMPLETED || this == PARTIAL_FAILURE;
    }

    /// Returns whether the run produced a usable report.
    public boolean isUsable() {
        return this == COMPLETED || this == PARTIAL_FAILURE;
    }
}
