package io.prospekt.core.execution;

import io.prospekt.core.report.Report;
import io.prospekt.core.report.StageError;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.stage.StageResult;
import io.prospekt.core.subject.Subject;
import java.time.Duration;

/// Fans out all run lifecycle events to an ordered set of delegates.
///
/// @implNote Thread-safe if all delegates are thread-safe. Delegates are captured at
/// construction and never mutated.
public final class CompositeRunListener implements RunListener {

    private final RunListener[] delegates;

    /// @param delegates listeners to notify in order; must not be null, elements must
    /// not be null
    public CompositeRunListener(RunListener... delegates) {
        this.delegates = delegates.clone();
    }

    /// Combines two listeners, skipping {@link RunListener#NOOP} operands.
    public static RunListener of(RunListener first, RunListener second) {
        if (first == RunListener.NOOP) return second;
        if (second == RunListener.NOOP) return first;
        return new CompositeRunListener(first, second);
    }

    @Override
    public void onStateChange(Subject subject, RunState state) {
        for (RunListener d : delegates) d.onStateChange(subject, state);
    }

    @Override
    public void onCacheHit(Report report) {
        for (RunListener d : delegates) d.onCacheHit(report);
    }

    @Override
    public void onRunStart(Subject subject, String runId) {
        for (RunListener d : delegates) d.onRunStart(subject, runId);
    }

    @Override
    public void onStageStart(StageName stage, int attempt) {
        for (RunListener d : delegates) d.onStageStart(stage, attempt);
    }

    @Override
    public void onStageRetry(
            StageName stage, int nextAttempt, StageResult.Failure failure, Duration delay) {
        for (RunListener d : delegates) d.onStageRetry(stage, nextAttempt, failure, delay);
    }

    @Override
    public void onStageComplete(StageName stage, StageOutput output, int attempts) {
        for (RunListener d : delegates) d.onStageComplete(stage, output, attempts);
    }

    @Override
    public void onStageFailed(StageError error) {
        for (RunListener d : delegates) d.onStageFailed(error);
    }

    @Override
    public void onStageSkipped(StageName stage, StageName missingDependency) {
        for (RunListener d : delegates) d.onStageSkipped(stage, missingDependency);
    }

    @Override
    public void onRunComplete(Report report) {
        for (RunListener d : delegates) d.onRunComplete(report);
    }
}
