package io.prospekt.core.execution;

import io.prospekt.core.stage.StageName;
import java.io.Serial;

/// Thrown when a stage would start without the output of a declared dependency that
/// neither failed nor was skipped, meaning the pipeline is wired in the wrong order.
///
/// An ordering violation: never retried, always fatal to the run.
public class MissingDependencyException extends IllegalStateException {

    @Serial private static final long serialVersionUID = -5348109946627145529L;

    private final StageName stage;
    private final StageName dependency;

    public MissingDependencyException(StageName stage, StageName dependency) {
        super(
                "Stage '"
                        + stage.id()
                        + "' requires output of '"
                        + dependency.id()
                        + "' which is not available");
        this.stage = stage;
        this.dependency = dependency;
    }

    public StageName getStage() {
        return stage;
    }

    public StageName getDependency() {
        return dependency;
    }
}
