package io.prospekt.core.execution;

import io.prospekt.core.cache.CacheIOException;
import io.prospekt.core.cache.ReportCache;
import io.prospekt.core.report.Report;
import io.prospekt.core.report.ReportSink;
import io.prospekt.core.report.RunStatus;
import io.prospekt.core.report.StageError;
import io.prospekt.core.stage.Stage;
import io.prospekt.core.stage.StageCriticality;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.subject.Subject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Drives the fixed stage sequence for one subject at a time.
///
/// ### Run Lifecycle
/// 1. **Cache check** - the normalized subject is looked up; a hit is returned flagged
///    as served from cache and no stage runs
/// 2. **Running** - stages run strictly in order through the {@link StageRunner}; each
///    output is recorded in a fresh {@link ExecutionContext}
/// 3. **Finalizing** - the {@link Report} is assembled, cached when usable, and archived
///    through the {@link ReportSink}
///
/// ### Failure Policy
/// - A terminal failure of a {@link StageCriticality#REQUIRED} stage ends the run as
///   {@link RunStatus#FAILED}; later stages do not run
/// - A terminal failure of a {@link StageCriticality#BEST_EFFORT} stage is recorded,
///   stages depending on it are skipped, and the run ends as
///   {@link RunStatus#PARTIAL_FAILURE}
/// - Cache and sink errors are logged and never change the returned status
///
/// ### Contracts
/// - **Invariant**: a `FAILED` or `CANCELLED` run is never cached
/// - **Invariant**: a stage never starts before every declared dependency has output
///
/// @implNote Thread-safe. Holds no per-run state; concurrent runs each own their
/// {@link ExecutionContext}. The {@link ReportCache} is the only shared mutable resource.
///
/// @see ExecutionContext
/// @see RetryPolicy
public final class Orchestrator {

    private static final Logger logger = Logger.getLogger(Orchestrator.class.getName());

    private final List<Stage> stages;
    private final ReportCache cache;
    private final ReportSink sink;
    private final StageRunner runner;
    private final RunListener listener;
    private final Clock clock;

    private Orchestrator(Builder builder) {
        this.stages = List.copyOf(builder.stages);
        this.cache = builder.cache;
        this.sink = builder.sink;
        this.runner = new StageRunner(builder.retryPolicy, builder.executor);
        this.listener = builder.listener;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Runs the pipeline for raw user input with default options.
    ///
    /// @param company company name as typed, not blank
    /// @return final report, never null
    /// @throws IllegalArgumentException if the name is blank
    public Report run(String company) {
        return run(Subject.of(company), RunOptions.defaults());
    }

    /// Runs the pipeline for a subject.
    ///
    /// @param subject normalized subject, not null
    /// @param options cache usage, cancellation and per-run listener, not null
    /// @return final report carrying status, outputs and stage errors; never null
    /// @throws DuplicateStageException if a stage records output twice
    /// @throws MissingDependencyException if a dependency is absent without having failed
    public Report run(Subject subject, RunOptions options) {
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(options, "options must not be null");
        RunListener events = CompositeRunListener.of(listener, options.listener());

        events.onStateChange(subject, RunState.CACHE_CHECK);
        if (options.useCache()) {
            Optional<Report> cached = lookup(subject);
            if (cached.isPresent()) {
                Report report = cached.get().asServedFromCache();
                events.onCacheHit(report);
                events.onStateChange(subject, RunState.COMPLETED);
                return report;
            }
        }

        ExecutionContext context = new ExecutionContext(subject, clock.instant());
        events.onRunStart(subject, context.getRunId());
        events.onStateChange(subject, RunState.RUNNING);

        RunStatus abortStatus = runStages(context, options.cancellation(), events);

        context.finish(clock.instant());
        events.onStateChange(subject, RunState.FINALIZING);
        RunStatus status = abortStatus != null ? abortStatus : completionStatus(context);
        Report report = context.toReport(status);

        if (status.isCacheable() && hasRequiredOutputs(context)) {
            store(subject, report);
        }
        if (status != RunStatus.CANCELLED) {
            archive(report);
        }

        events.onRunComplete(report);
        events.onStateChange(subject, RunState.valueOf(status.name()));
        return report;
    }

    /// Returns the stages in execution order.
    public List<Stage> getStages() {
        return stages;
    }

    /// Runs every stage in order and returns the status that aborted the run, or null
    /// when all stages were attempted.
    private RunStatus runStages(
            ExecutionContext context, CancellationToken cancellation, RunListener events) {
        for (Stage stage : stages) {
            StageName name = stage.name();
            if (cancellation.isCancelled()) {
                logger.info("Run " + context.getRunId() + " cancelled before " + name.id());
                return RunStatus.CANCELLED;
            }

            Optional<StageName> missing = missingDependency(stage, context);
            if (missing.isPresent()) {
                context.markSkipped(name);
                events.onStageSkipped(name, missing.get());
                if (stage.criticality() == StageCriticality.REQUIRED) {
                    return RunStatus.FAILED;
                }
                continue;
            }

            Instant stageStart = clock.instant();
            StageOutcome outcome =
                    runner.run(stage, context.getSubject(), context.view(), cancellation, events);
            context.recordDuration(name, Duration.between(stageStart, clock.instant()));

            if (outcome instanceof StageOutcome.Succeeded succeeded) {
                context.record(name, succeeded.output());
                events.onStageComplete(name, succeeded.output(), succeeded.attempts());
            } else if (outcome instanceof StageOutcome.Failed failed) {
                StageError error =
                        new StageError(
                                name,
                                failed.failure().kind(),
                                failed.failure().message(),
                                Math.max(1, failed.attempts()),
                                clock.instant());
                context.recordError(error);
                events.onStageFailed(error);
                if (stage.criticality() == StageCriticality.REQUIRED) {
                    return RunStatus.FAILED;
                }
            } else {
                return RunStatus.CANCELLED;
            }
        }
        return null;
    }

    /// Returns the first declared dependency without output. Absence is expected only
    /// when the dependency failed or was skipped; anything else is a wiring error.
    private static Optional<StageName> missingDependency(Stage stage, ExecutionContext context) {
        for (StageName dependency : stage.dependencies()) {
            if (context.hasOutput(dependency)) {
                continue;
            }
            if (context.isFailedOrSkipped(dependency)) {
                return Optional.of(dependency);
            }
            throw new MissingDependencyException(stage.name(), dependency);
        }
        return Optional.empty();
    }

    private static RunStatus completionStatus(ExecutionContext context) {
        return context.getErrors().isEmpty() && context.getSkipped().isEmpty()
                ? RunStatus.COMPLETED
                : RunStatus.PARTIAL_FAILURE;
    }

    private boolean hasRequiredOutputs(ExecutionContext context) {
        return stages.stream()
                .filter(stage -> stage.criticality() == StageCriticality.REQUIRED)
                .allMatch(stage -> context.hasOutput(stage.name()));
    }

    private Optional<Report> lookup(Subject subject) {
        try {
            return cache.lookup(subject);
        } catch (CacheIOException e) {
            logger.warning("Cache lookup failed for '" + subject.key() + "': " + e.getMessage());
            return Optional.empty();
        }
    }

    private void store(Subject subject, Report report) {
        try {
            cache.insert(subject, report);
        } catch (CacheIOException e) {
            logger.warning(
                    "Report for '" + subject.key() + "' was not cached: " + e.getMessage());
        }
    }

    private void archive(Report report) {
        try {
            sink.archive(report);
        } catch (RuntimeException e) {
            logger.warning("Report " + report.runId() + " was not archived: " + e.getMessage());
        }
    }

    /// Builder for {@link Orchestrator}.
    ///
    /// Validates at build time that stage names are unique and that every declared
    /// dependency runs earlier in the sequence.
    public static final class Builder {
        private final List<Stage> stages = new ArrayList<>();
        private ReportCache cache;
        private ReportSink sink = ReportSink.NOOP;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private ExecutorService executor;
        private RunListener listener = RunListener.NOOP;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder stage(Stage stage) {
            stages.add(Objects.requireNonNull(stage, "stage must not be null"));
            return this;
        }

        public Builder stages(List<? extends Stage> stages) {
            stages.forEach(this::stage);
            return this;
        }

        public Builder cache(ReportCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder sink(ReportSink sink) {
            this.sink = sink;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder listener(RunListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /// @throws IllegalStateException if a required component is missing
        /// @throws DuplicateStageException if two stages share a name
        /// @throws MissingDependencyException if a dependency does not run earlier
        public Orchestrator build() {
            if (stages.isEmpty()) {
                throw new IllegalStateException("at least one stage is required");
            }
            if (cache == null) {
                throw new IllegalStateException("cache is required");
            }
            if (executor == null) {
                throw new IllegalStateException("executor is required");
            }
            Objects.requireNonNull(sink, "sink must not be null");
            Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
            Objects.requireNonNull(listener, "listener must not be null");
            Objects.requireNonNull(clock, "clock must not be null");
            validateOrder();
            return new Orchestrator(this);
        }

        private void validateOrder() {
            Set<StageName> earlier = EnumSet.noneOf(StageName.class);
            for (Stage stage : stages) {
                for (StageName dependency : stage.dependencies()) {
                    if (!earlier.contains(dependency)) {
                        throw new MissingDependencyException(stage.name(), dependency);
                    }
                }
                if (!earlier.add(stage.name())) {
                    throw new DuplicateStageException(
                            stage.name(),
                            "Stage '" + stage.name().id() + "' appears more than once");
                }
            }
        }
    }
}
