package io.prospekt.core.execution;

import io.prospekt.core.stage.StageName;
import java.io.Serial;

/// Thrown when a stage records output twice in one run, or appears twice in a pipeline.
///
/// An ordering violation: never retried, always fatal to the run.
public class DuplicateStageException extends IllegalStateException {

    @Serial private static final long serialVersionUID = 7903368512440981185L;

    private final StageName stage;

    public DuplicateStageException(StageName stage) {
        super("Stage '" + stage.id() + "' already recorded output in this run");
        this.stage = stage;
    }

    public DuplicateStageException(StageName stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageName getStage() {
        return stage;
    }
}
