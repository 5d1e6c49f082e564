package io.prospekt.core.provider;

import java.util.Map;

/// Service provider interface for creating {@link LanguageModel} instances.
///
/// Providers are registered with {@link io.prospekt.core.ProspektFactory.Builder} and
/// selected by {@link #supportsModel(String)}; when several match, the highest
/// {@link #getPriority()} wins.
///
/// ### Contracts
/// - **Precondition**: {@link #createModel} is only called when
///   {@link #supportsModel(String)} returned true for the same name
/// - **Postcondition**: returned models are safe for concurrent use
public interface LanguageModelProvider {

    /// Returns the provider name for logging.
    String getName();

    /// Returns whether this provider can create the named model.
    ///
    /// @param modelName model identifier such as `gemini-2.0-flash`, not null
    boolean supportsModel(String modelName);

    /// Creates a model instance.
    ///
    /// @param modelName model identifier, not null
    /// @param credentials API keys keyed by variable name, not null
    /// @return configured model, never null
    /// @throws IllegalStateException if a required credential is missing
    LanguageModel createModel(String modelName, Map<String, String> credentials);

    /// Returns the selection priority; higher wins.
    default int getPriority() {
        return 0;
    }
}
