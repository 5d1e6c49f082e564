package io.prospekt.core.provider;

/// Text generation collaborator consumed by the analysis and outreach stages.
///
/// Implementations enforce their own request timeout and report failures through
/// {@link ProviderException} so rate limits and timeouts stay distinguishable from
/// rejected requests.
///
/// @see LanguageModelProvider
public interface LanguageModel {

    /// Generates a completion.
    ///
    /// @param prompt user prompt, not null
    /// @param options generation settings, not null
    /// @return generated text, never null
    /// @throws ProviderException if generation fails
    String complete(String prompt, CompletionOptions options);

    /// Returns the model identifier for logging.
    String modelName();
}
