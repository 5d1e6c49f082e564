package io.prospekt.core.execution;

import io.prospekt.core.report.Report;
import io.prospekt.core.report.StageError;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.stage.StageResult;
import io.prospekt.core.subject.Subject;
import java.time.Duration;
import java.util.logging.Logger;

/// Logs run lifecycle events through `java.util.logging`.
///
/// Lifecycle events go to `INFO`, state transitions and attempt starts to `FINE`,
/// retries and best-effort failures to `WARNING`, aborted runs to `SEVERE`.
///
/// @implNote Thread-safe. Stateless.
public final class LoggingRunListener implements RunListener {

    private static final Logger logger = Logger.getLogger(LoggingRunListener.class.getName());

    @Override
    public void onStateChange(Subject subject, RunState state) {
        logger.fine("[" + subject.key() + "] -> " + state);
    }

    @Override
    public void onCacheHit(Report report) {
        logger.info(
                "Serving cached report for '"
                        + report.subject().displayName()
                        + "' from run "
                        + report.runId());
    }

    @Override
    public void onRunStart(Subject subject, String runId) {
        logger.info("Starting run " + runId + " for '" + subject.displayName() + "'");
    }

    @Override
    public void onStageStart(StageName stage, int attempt) {
        logger.fine("Stage " + stage.id() + " attempt " + attempt);
    }

    @Override
    public void onStageRetry(
            StageName stage, int nextAttempt, StageResult.Failure failure, Duration delay) {
        logger.warning(
                "Stage "
                        + stage.id()
                        + " failed transiently ("
                        + failure.message()
                        + "), attempt "
                        + nextAttempt
                        + " in "
                        + delay.toMillis()
                        + "ms");
    }

    @Override
    public void onStageComplete(StageName stage, StageOutput output, int attempts) {
        logger.info("Stage " + stage.id() + " completed after " + attempts + " attempt(s)");
    }

    @Override
    public void onStageFailed(StageError error) {
        logger.warning(
                "Stage "
                        + error.stage().id()
                        + " failed "
                        + error.kind()
                        + " after "
                        + error.attempts()
                        + " attempt(s): "
                        + error.message());
    }

    @Override
    public void onStageSkipped(StageName stage, StageName missingDependency) {
        logger.warning(
                "Skipping stage "
                        + stage.id()
                        + ": dependency "
                        + missingDependency.id()
                        + " produced no output");
    }

    @Override
    public void onRunComplete(Report report) {
        String message =
                "Run "
                        + report.runId()
                        + " for '"
                        + report.subject().displayName()
                        + "' finished "
                        + report.status()
                        + " in "
                        + report.elapsed().toMillis()
                        + "ms";
        switch (report.status()) {
            case FAILED -> logger.severe(message);
            case PARTIAL_FAILURE, CANCELLED -> logger.warning(message);
            default -> logger.info(message);
        }
    }
}
