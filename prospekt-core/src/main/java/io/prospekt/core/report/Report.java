package io.prospekt.core.report;

import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.stage.StageOutput.CompanyProfile;
import io.prospekt.core.stage.StageOutput.ContactRoster;
import io.prospekt.core.stage.StageOutput.MarketAnalysis;
import io.prospekt.core.stage.StageOutput.OutreachDrafts;
import io.prospekt.core.subject.Subject;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable result of one orchestrator run.
///
/// Holds the outputs that were recorded, in execution order, together with the stage
/// errors, the stages skipped because a dependency failed, and timing data. Created
/// only by {@link io.prospekt.core.execution.Orchestrator}.
///
/// ### Contracts
/// - **Invariant**: {@link #status()} is {@link RunStatus#FAILED} iff a required stage
///   failed; the triggering {@link StageError} is in {@link #errors()}
/// - **Invariant**: collections are unmodifiable and never null
///
/// @param subject processed subject, not null
/// @param runId identifier of the run that produced the outputs, not null
/// @param status overall status, not null
/// @param outputs recorded outputs in execution order
/// @param errors terminal stage failures in occurrence order
/// @param skipped stages not run because a dependency was missing
/// @param startedAt run start, not null
/// @param finishedAt run end, not null
/// @param stageDurations wall time per executed stage including retries
/// @param servedFromCache true when returned from the cache without running stages
public record Report(
        Subject subject,
        String runId,
        RunStatus status,
        Map<StageName, StageOutput> outputs,
        List<StageError> errors,
        List<StageName> skipped,
        Instant startedAt,
        Instant finishedAt,
        Map<StageName, Duration> stageDurations,
        boolean servedFromCache) {

    public Report {
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        outputs = outputs != null ? orderedCopy(outputs) : Map.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
        stageDurations = stageDurations != null ? orderedCopy(stageDurations) : Map.of();
    }

    /// Returns a copy flagged as served from the cache.
    public Report asServedFromCache() {
        return new Report(
                subject,
                runId,
                status,
                outputs,
                errors,
                skipped,
                startedAt,
                finishedAt,
                stageDurations,
                true);
    }

    /// Returns the output of one stage.
    public Optional<StageOutput> outputOf(StageName stage) {
        return Optional.ofNullable(outputs.get(stage));
    }

    public Optional<CompanyProfile> companyProfile() {
        return outputOf(StageName.RESEARCH).map(CompanyProfile.class::cast);
    }

    public Optional<MarketAnalysis> marketAnalysis() {
        return outputOf(StageName.ANALYSIS).map(MarketAnalysis.class::cast);
    }

    public Optional<ContactRoster> contactRoster() {
        return outputOf(StageName.CONTACT_DISCOVERY).map(ContactRoster.class::cast);
    }

    public Optional<OutreachDrafts> outreachDrafts() {
        return outputOf(StageName.OUTREACH).map(OutreachDrafts.class::cast);
    }

    /// Returns the wall time between run start and end.
    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    private static <K, V> Map<K, V> orderedCopy(Map<K, V> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
