package io.prospekt.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.prospekt.core.provider.LanguageModel;
import io.prospekt.core.provider.LanguageModelProvider;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link LanguageModelProvider}.
///
/// Creates {@link ChatModel} instances for supported AI providers and wraps them in
/// {@link LangChain4jLanguageModel}. The backend is chosen by model name prefix:
/// - `gemini*`, `gemma*`: Google AI Gemini, key `GOOGLE_API_KEY`
/// - `gpt*`, `o1*`: OpenAI, key `OPENAI_API_KEY`
/// - `claude*`: Anthropic, key `ANTHROPIC_API_KEY`
///
/// Sampling settings are passed per request by the stages; the values configured here
/// are the model defaults used when a request leaves them unset.
///
/// @implNote Stateless and thread-safe. Each call to {@link #createModel} builds a new
/// chat model; no shared mutable state.
///
/// @see LangChain4jLanguageModel for the model wrapper
public class LangChain4jModelProvider implements LanguageModelProvider {

    private static final Logger logger =
            Logger.getLogger(LangChain4jModelProvider.class.getName());

    private static final int DEFAULT_MAX_TOKENS = 2000;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    private static final double DEFAULT_TEMPERATURE = 0.7;

    private final Duration timeout;

    public LangChain4jModelProvider() {
        this(DEFAULT_TIMEOUT);
    }

    /// @param timeout HTTP request timeout applied to every created model, not null
    public LangChain4jModelProvider(Duration timeout) {
        this.timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
    }

    @Override
    public String getName() {
        return "langchain4j";
    }

    @Override
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("gemini")
                || modelName.startsWith("gemma");
    }

    @Override
    public LanguageModel createModel(String modelName, Map<String, String> credentials) {
        logger.info("Creating LangChain4j model: " + modelName);
        return new LangChain4jLanguageModel(modelName, createChatModel(modelName, credentials));
    }

    @Override
    public int getPriority() {
        return 100;
    }

    /// Creates the appropriate {@link ChatModel} based on model name prefix.
    ///
    /// @param modelName model identifier, not null
    /// @param credentials API keys, not null
    /// @return configured chat model, never null
    /// @throws IllegalArgumentException if the model name is not supported
    /// @throws IllegalStateException if the required API key is missing
    ChatModel createChatModel(String modelName, Map<String, String> credentials) {
        if (modelName.startsWith("claude")) {
            return AnthropicChatModel.builder()
                    .apiKey(requireApiKey(credentials, "ANTHROPIC_API_KEY", "anthropic_api_key"))
                    .modelName(modelName)
                    .temperature(DEFAULT_TEMPERATURE)
                    .maxTokens(DEFAULT_MAX_TOKENS)
                    .timeout(timeout)
                    .build();
        } else if (modelName.startsWith("gpt") || modelName.startsWith("o1")) {
            return OpenAiChatModel.builder()
                    .apiKey(requireApiKey(credentials, "OPENAI_API_KEY", "openai_api_key"))
                    .modelName(modelName)
                    .temperature(DEFAULT_TEMPERATURE)
                    .maxTokens(DEFAULT_MAX_TOKENS)
                    .timeout(timeout)
                    .build();
        } else if (modelName.startsWith("gemini") || modelName.startsWith("gemma")) {
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(requireApiKey(credentials, "GOOGLE_API_KEY", "google_api_key"))
                    .modelName(modelName)
                    .temperature(DEFAULT_TEMPERATURE)
                    .maxOutputTokens(DEFAULT_MAX_TOKENS)
                    .timeout(timeout)
                    .build();
        }

        throw new IllegalArgumentException("Unsupported model: " + modelName);
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @param credentials credential map to search, not null
    /// @param keyNames candidate key names in priority order
    /// @return the first non-blank value found, never null
    /// @throws IllegalStateException if no key name resolves to a value
    static String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }
}
