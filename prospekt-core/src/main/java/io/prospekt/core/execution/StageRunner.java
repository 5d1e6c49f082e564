package io.prospekt.core.execution;

import io.prospekt.core.provider.ProviderException;
import io.prospekt.core.stage.ContextView;
import io.prospekt.core.stage.FailureKind;
import io.prospekt.core.stage.Stage;
import io.prospekt.core.stage.StageResult;
import io.prospekt.core.subject.Subject;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Invokes one stage under a {@link RetryPolicy}.
///
/// Each attempt runs on the supplied executor and is awaited for at most
/// {@link RetryPolicy#getAttemptTimeout()}, counted from the moment the attempt starts
/// running on a worker thread. Attempt results are classified as follows:
///
/// | Attempt result | Classified as |
/// |----------------|---------------|
/// | {@link StageResult.Success} | success |
/// | {@link StageResult.Failure} | its own kind |
/// | {@link ProviderException} thrown | the exception's kind |
/// | attempt timeout | {@link FailureKind#TRANSIENT} |
/// | any other runtime exception | {@link FailureKind#TERMINAL} |
///
/// {@link DuplicateStageException} and {@link MissingDependencyException} thrown by a
/// stage are ordering violations and propagate unchanged.
///
/// @implNote Thread-safe. Holds no per-run state.
public final class StageRunner {

    private static final Logger logger = Logger.getLogger(StageRunner.class.getName());

    private static final long START_POLL_MILLIS = 50;

    private final RetryPolicy retryPolicy;
    private final ExecutorService executor;

    public StageRunner(RetryPolicy retryPolicy, ExecutorService executor) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /// Runs the stage until it succeeds, fails terminally, exhausts its attempts or the
    /// run is cancelled.
    ///
    /// @param stage stage to run, not null
    /// @param subject subject of the run, not null
    /// @param view read view handed to every attempt, not null
    /// @param cancellation run cancellation token, not null
    /// @param listener receives attempt and retry events, not null
    /// @return resolved outcome, never null
    public StageOutcome run(
            Stage stage,
            Subject subject,
            ContextView view,
            CancellationToken cancellation,
            RunListener listener) {
        StageResult.Failure lastFailure = null;
        int attempt = 0;

        while (attempt < retryPolicy.getMaxAttempts()) {
            attempt++;
            if (attempt > 1) {
                Duration delay = retryPolicy.delayBefore(attempt);
                listener.onStageRetry(stage.name(), attempt, lastFailure, delay);
                if (awaitCancellation(cancellation, delay)) {
                    return new StageOutcome.Cancelled(attempt - 1);
                }
            }
            if (cancellation.isCancelled()) {
                return new StageOutcome.Cancelled(attempt - 1);
            }

            listener.onStageStart(stage.name(), attempt);
            StageResult result = attempt(stage, subject, view, cancellation);

            if (cancellation.isCancelled()) {
                logger.info(
                        "Discarding result of stage " + stage.name().id() + ": run cancelled");
                return new StageOutcome.Cancelled(attempt);
            }
            if (result instanceof StageResult.Success success) {
                if (success.output().stage() != stage.name()) {
                    return new StageOutcome.Failed(
                            StageResult.terminalFailure(
                                    "Stage produced output for "
                                            + success.output().stage().id()),
                            attempt);
                }
                return new StageOutcome.Succeeded(success.output(), attempt);
            }

            lastFailure = (StageResult.Failure) result;
            if (!lastFailure.isRetryable()) {
                return new StageOutcome.Failed(lastFailure, attempt);
            }
        }
        return new StageOutcome.Failed(lastFailure, attempt);
    }

    private StageResult attempt(
            Stage stage, Subject subject, ContextView view, CancellationToken cancellation) {
        CountDownLatch started = new CountDownLatch(1);
        Future<StageResult> future =
                executor.submit(
                        () -> {
                            started.countDown();
                            return stage.invoke(subject, view);
                        });
        Duration timeout = retryPolicy.getAttemptTimeout();
        try {
            // The timeout covers the attempt itself, not time spent queued behind other runs.
            while (!started.await(START_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (cancellation.isCancelled()) {
                    future.cancel(true);
                    return StageResult.failure(
                            FailureKind.TERMINAL, "Run cancelled before attempt started", null);
                }
            }
            StageResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return StageResult.terminalFailure("Stage returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            return StageResult.failure(
                    FailureKind.TRANSIENT,
                    "Attempt timed out after " + timeout.toMillis() + "ms",
                    e);
        } catch (ExecutionException e) {
            return classify(e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return StageResult.failure(FailureKind.TERMINAL, "Interrupted while waiting", e);
        }
    }

    private static StageResult classify(Throwable cause) {
        if (cause instanceof DuplicateStageException duplicate) {
            throw duplicate;
        }
        if (cause instanceof MissingDependencyException missing) {
            throw missing;
        }
        if (cause instanceof ProviderException provider) {
            return StageResult.failure(provider.getKind(), provider.getMessage(), provider);
        }
        logger.warning("Stage threw unexpectedly: " + cause);
        return StageResult.failure(
                FailureKind.TERMINAL, "Unexpected error: " + cause.getMessage(), cause);
    }

    private static boolean awaitCancellation(CancellationToken cancellation, Duration delay) {
        try {
            return cancellation.await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
