package io.prospekt.core.execution;

import io.prospekt.core.report.Report;
import io.prospekt.core.report.RunStatus;
import io.prospekt.core.report.StageError;
import io.prospekt.core.stage.ContextView;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.subject.Subject;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/// Mutable state of one orchestrator run.
///
/// Accumulates stage outputs in execution order, terminal stage errors, skipped stages
/// and per-stage durations. Owned by exactly one run and discarded after
/// {@link #toReport(RunStatus)}; it is never persisted itself.
///
/// Stages never see this class. They receive a {@link ContextView} snapshot from
/// {@link #view()} and return output for the orchestrator to record.
///
/// ### Contracts
/// - **Invariant**: each stage records output at most once per run
/// - **Invariant**: recorded outputs are never removed or replaced
///
/// @implNote **Not thread-safe**. Only the orchestrator thread running the owning run
/// mutates it; stage attempts on worker threads see immutable snapshots.
public final class ExecutionContext {

    private final String runId;
    private final Subject subject;
    private final Instant startedAt;
    private final Map<StageName, StageOutput> outputs = new LinkedHashMap<>();
    private final List<StageError> errors = new ArrayList<>();
    private final Set<StageName> skipped = new LinkedHashSet<>();
    private final Map<StageName, Duration> durations = new LinkedHashMap<>();
    private Instant finishedAt;

    /// Creates a context with a random run identifier.
    ///
    /// @param subject subject of the run, not null
    /// @param startedAt run start, not null
    public ExecutionContext(Subject subject, Instant startedAt) {
        this(UUID.randomUUID().toString(), subject, startedAt);
    }

    ExecutionContext(String runId, Subject subject, Instant startedAt) {
        this.runId = Objects.requireNonNull(runId, "runId must not be null");
        this.subject = Objects.requireNonNull(subject, "subject must not be null");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    /// Records the output of a stage.
    ///
    /// @param stage stage name, not null
    /// @param output output to record, not null
    /// @throws DuplicateStageException if the stage already recorded output in this run
    /// @throws IllegalArgumentException if the output variant belongs to another stage
    public void record(StageName stage, StageOutput output) {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(output, "output must not be null");
        if (outputs.containsKey(stage)) {
            throw new DuplicateStageException(stage);
        }
        if (output.stage() != stage) {
            throw new IllegalArgumentException(
                    "Output of type "
                            + output.getClass().getSimpleName()
                            + " cannot be recorded for stage "
                            + stage.id());
        }
        outputs.put(stage, output);
    }

    /// Records a terminal stage failure. Prior outputs are kept.
    ///
    /// @param error failure to record, not null
    public void recordError(StageError error) {
        errors.add(Objects.requireNonNull(error, "error must not be null"));
    }

    /// Marks a stage as not run because a dependency is absent.
    public void markSkipped(StageName stage) {
        skipped.add(Objects.requireNonNull(stage, "stage must not be null"));
    }

    /// Records wall time spent on a stage, retries included.
    public void recordDuration(StageName stage, Duration duration) {
        durations.put(stage, duration);
    }

    /// Sets the run end time.
    public void finish(Instant finishedAt) {
        this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt must not be null");
    }

    public Optional<StageOutput> outputOf(StageName stage) {
        return Optional.ofNullable(outputs.get(stage));
    }

    /// Returns whether the stage failed terminally or was skipped in this run.
    public boolean isFailedOrSkipped(StageName stage) {
        return skipped.contains(stage) || errors.stream().anyMatch(e -> e.stage() == stage);
    }

    public boolean hasOutput(StageName stage) {
        return outputs.containsKey(stage);
    }

    public String getRunId() {
        return runId;
    }

    public Subject getSubject() {
        return subject;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    /// Returns recorded outputs in execution order.
    public Map<StageName, StageOutput> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    public List<StageError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public Set<StageName> getSkipped() {
        return Collections.unmodifiableSet(skipped);
    }

    /// Returns an immutable snapshot of the outputs recorded so far.
    ///
    /// @return read-only view, never null
    public ContextView view() {
        return new Snapshot(runId, subject, Map.copyOf(outputs));
    }

    /// Assembles the report for this run.
    ///
    /// @param status overall status, not null
    /// @return immutable report, never null
    /// @throws IllegalStateException if {@link #finish(Instant)} was not called
    public Report toReport(RunStatus status) {
        if (finishedAt == null) {
            throw new IllegalStateException("Run " + runId + " has not finished");
        }
        return new Report(
                subject,
                runId,
                status,
                outputs,
                errors,
                new ArrayList<>(skipped),
                startedAt,
                finishedAt,
                durations,
                false);
    }

    private record Snapshot(String runId, Subject subject, Map<StageName, StageOutput> outputs)
            implements ContextView {

        @Override
        public Optional<StageOutput> outputOf(StageName stage) {
            return Optional.ofNullable(outputs.get(stage));
        }
    }
}
