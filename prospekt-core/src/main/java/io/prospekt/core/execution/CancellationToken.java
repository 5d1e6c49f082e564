package io.prospekt.core.execution;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/// Cooperative cancellation signal for one run.
///
/// The orchestrator checks the token before every stage and every retry attempt, and
/// waits for backoff delays through {@link #await(Duration)} so a cancel cuts the wait
/// short. A stage attempt already in flight is allowed to finish; its result is
/// discarded.
///
/// @implNote Thread-safe. Cancellation is one-way.
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    /// Returns a fresh, uncancelled token.
    public static CancellationToken create() {
        return new CancellationToken();
    }

    /// Requests cancellation. Idempotent.
    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /// Waits up to `timeout` for cancellation.
    ///
    /// @param timeout maximum wait, not null
    /// @return true if the token was cancelled before or during the wait
    /// @throws InterruptedException if the waiting thread is interrupted
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
