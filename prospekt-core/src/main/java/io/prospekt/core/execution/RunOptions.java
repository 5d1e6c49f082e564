package io.prospekt.core.execution;

import java.util.Objects;

/// Per-call options for {@link Orchestrator#run(io.prospekt.core.subject.Subject, RunOptions)}.
///
/// @param useCache whether to consult the cache before running stages
/// @param cancellation cancellation signal, not null
/// @param listener additional listener for this run only, not null
public record RunOptions(boolean useCache, CancellationToken cancellation, RunListener listener) {

    public RunOptions {
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
    }

    /// Cached lookups on, no cancellation, no extra listener.
    public static RunOptions defaults() {
        return new RunOptions(true, CancellationToken.create(), RunListener.NOOP);
    }

    public RunOptions withUseCache(boolean useCache) {
        return new RunOptions(useCache, cancellation, listener);
    }

    public RunOptions withCancellation(CancellationToken cancellation) {
        return new RunOptions(useCache, cancellation, listener);
    }

    public RunOptions withListener(RunListener listener) {
        return new RunOptions(useCache, cancellation, listener);
    }
}
