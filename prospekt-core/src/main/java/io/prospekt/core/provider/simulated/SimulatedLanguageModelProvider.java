package io.prospekt.core.provider.simulated;

import io.prospekt.core.provider.LanguageModel;
import io.prospekt.core.provider.LanguageModelProvider;
import java.util.Map;
import java.util.logging.Logger;

/// Provider that serves {@link SimulatedLanguageModel} for every model name when mock
/// mode is on.
///
/// ### Priority Behavior
/// - When enabled: priority 1000 (intercepts all models)
/// - When disabled: priority -1 and {@link #supportsModel(String)} is false
public final class SimulatedLanguageModelProvider implements LanguageModelProvider {

    private static final Logger logger =
            Logger.getLogger(SimulatedLanguageModelProvider.class.getName());

    private final boolean enabled;

    public SimulatedLanguageModelProvider(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public String getName() {
        return "simulated";
    }

    @Override
    public boolean supportsModel(String modelName) {
        return enabled;
    }

    /// @throws IllegalStateException if called while mock mode is off
    @Override
    public LanguageModel createModel(String modelName, Map<String, String> credentials) {
        if (!enabled) {
            throw new IllegalStateException("Simulated provider called but mock mode is off");
        }
        logger.info("[SIMULATED] Creating simulated model for: " + modelName);
        return new SimulatedLanguageModel(modelName);
    }

    @Override
    public int getPriority() {
        return enabled ? 1000 : -1;
    }
}
