package io.prospekt.core.stage;

import io.prospekt.core.subject.Subject;
import java.util.Optional;

/// Read-only window onto the outputs recorded so far in one run.
///
/// Stages receive this view instead of the mutable context; they return output and
/// the orchestrator records it.
public interface ContextView {

    /// Returns the identifier of the run this view belongs to.
    String runId();

    /// Returns the subject being processed.
    Subject subject();

    /// Returns the output recorded by an earlier stage.
    ///
    /// @param stage stage name, not null
    /// @return output if recorded, empty otherwise
    Optional<StageOutput> outputOf(StageName stage);

    /// Returns the output of an earlier stage narrowed to its variant type.
    ///
    /// @param stage stage name, not null
    /// @param type expected variant, not null
    /// @return typed output if recorded, empty otherwise
    /// @throws ClassCastException if the recorded output is of another variant
    default <T extends StageOutput> Optional<T> outputOf(StageName stage, Class<T> type) {
        return outputOf(stage).map(type::cast);
    }

    /// Returns the output of a declared dependency.
    ///
    /// The orchestrator guarantees declared dependencies are present before invoking a
    /// stage, so absence here indicates the stage read something it did not declare.
    ///
    /// @throws IllegalStateException if the output is absent
    default <T extends StageOutput> T require(StageName stage, Class<T> type) {
        return outputOf(stage, type)
                .orElseThrow(
                        () ->
                                new IllegalStateException(
                                        "Output of stage '" + stage.id() + "' is not available"));
    }
}
