package io.prospekt.core.execution;

/// States of one orchestrator run.
///
/// ```
/// IDLE -> CACHE_CHECK -> RUNNING -> FINALIZING -> COMPLETED | PARTIAL_FAILURE | FAILED
///                     \-> COMPLETED (cache hit)
/// ```
/// Any non-terminal state may move to `CANCELLED`.
public enum RunState {
    IDLE,
    CACHE_CHECK,
    RUNNING,
    FINALIZING,
    COMPLETED,
    PARTIAL_FAILURE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return ordinal() >= COMPLETED.ordinal();
    }
}
