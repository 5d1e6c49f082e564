package io.prospekt.core.stage;

import io.prospekt.core.subject.Subject;
import java.util.Set;

/// One step of the pipeline: turns the subject and prior outputs into a
/// {@link StageOutput}.
///
/// Implementations call external collaborators (search, language model) and must map
/// their errors onto {@link FailureKind}: network, timeout and rate-limit problems are
/// {@link FailureKind#TRANSIENT}, everything the same input would reproduce is
/// {@link FailureKind#TERMINAL}. Unexpected runtime exceptions escaping
/// {@link #invoke} are treated as terminal by the orchestrator.
///
/// ### Contracts
/// - **Precondition**: every stage in {@link #dependencies()} has recorded output
/// - **Postcondition**: a {@link StageResult.Success} carries the variant matching
///   {@link #name()}
///
/// @implNote Implementations must be stateless or thread-safe; one instance serves
/// concurrent runs.
///
/// @see io.prospekt.core.execution.Orchestrator
public interface Stage {

    /// Returns the pipeline slot this stage fills.
    StageName name();

    /// Returns the stages whose output this stage reads.
    ///
    /// @return declared dependencies, never null
    default Set<StageName> dependencies() {
        return Set.of();
    }

    /// Returns whether a terminal failure of this stage aborts the run.
    default StageCriticality criticality() {
        return name().defaultCriticality();
    }

    /// Executes one attempt.
    ///
    /// @param subject subject being processed, not null
    /// @param context read view of outputs recorded so far, not null
    /// @return success with output, or a classified failure; never null
    StageResult invoke(Subject subject, ContextView context);
}
