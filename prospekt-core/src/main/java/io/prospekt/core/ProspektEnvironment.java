package io.prospekt.core;

import io.prospekt.core.cache.ReportCache;
import io.prospekt.core.execution.Orchestrator;
import io.prospekt.core.report.ReportSink;
import java.util.concurrent.ExecutorService;

/// Container holding the wired pipeline components.
///
/// Implements {@link AutoCloseable} to release the stage worker pool.
///
/// ### Contracts
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link ProspektFactory#builder()} rather than direct
/// construction.
///
/// @see ProspektFactory.Builder
public final class ProspektEnvironment implements AutoCloseable {

    private final ProspektConfig config;
    private final Orchestrator orchestrator;
    private final ReportCache reportCache;
    private final ReportSink reportSink;
    private final ExecutorService executorService;

    /// @param config effective configuration, not null
    /// @param orchestrator pipeline driver, not null
    /// @param reportCache cache shared by all runs, not null
    /// @param reportSink report archive, not null
    /// @param executorService pool running stage attempts, not null
    public ProspektEnvironment(
            ProspektConfig config,
            Orchestrator orchestrator,
            ReportCache reportCache,
            ReportSink reportSink,
            ExecutorService executorService) {
        this.config = config;
        this.orchestrator = orchestrator;
        this.reportCache = reportCache;
        this.reportSink = reportSink;
        this.executorService = executorService;
    }

    public ProspektConfig getConfig() {
        return config;
    }

    public Orchestrator getOrchestrator() {
        return orchestrator;
    }

    public ReportCache getReportCache() {
        return reportCache;
    }

    public ReportSink getReportSink() {
        return reportSink;
    }

    /// Shuts down the stage worker pool.
    ///
    /// @apiNote **Side effects**:
    /// - Initiates orderly shutdown of the thread pool
    /// - In-flight attempts continue; no new attempts are accepted
    @Override
    public void close() {
        executorService.shutdown();
    }
}
