package io.prospekt.core.provider;

/// Per-call generation settings for a {@link LanguageModel}.
///
/// @param systemPrompt instructions sent ahead of the prompt, may be null
/// @param temperature sampling temperature, null for the model default
/// @param maxOutputTokens output token ceiling, null for the model default
public record CompletionOptions(String systemPrompt, Double temperature, Integer maxOutputTokens) {

    public static final CompletionOptions DEFAULTS = new CompletionOptions(null, null, null);

    public static CompletionOptions of(double temperature, int maxOutputTokens) {
        return new CompletionOptions(null, temperature, maxOutputTokens);
    }

    public CompletionOptions withSystemPrompt(String systemPrompt) {
        return new CompletionOptions(systemPrompt, temperature, maxOutputTokens);
    }
}
