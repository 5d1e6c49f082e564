package io.prospekt.core.report;

/// Durable archive for finished reports, independent of the report cache.
///
/// The orchestrator calls {@link #archive(Report)} once per finished, non-cached run.
/// Failures are logged by the caller and never change the run's status.
@FunctionalInterface
public interface ReportSink {

    /// Sink that discards every report.
    ReportSink NOOP = report -> {};

    /// Persists a report.
    ///
    /// @param report finished report, not null
    /// @throws RuntimeException if the report could not be written
    void archive(Report report);
}
