package io.prospekt.adapter.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.prospekt.core.provider.CompletionOptions;
import io.prospekt.core.provider.LanguageModel;
import io.prospekt.core.provider.ProviderException;
import io.prospekt.core.stage.FailureKind;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link LanguageModel}.
///
/// Wraps a {@link ChatModel} and sends one stateless request per completion: an optional
/// system message followed by the user prompt, with the per-call temperature and output
/// token limit.
///
/// ### Failure classification
/// | Cause                                          | Kind        |
/// |------------------------------------------------|-------------|
/// | `RetriableException` (rate limit, timeout, 5xx) | `TRANSIENT` |
/// | `IOException` / `TimeoutException` in the chain | `TRANSIENT` |
/// | empty model answer                             | `TRANSIENT` |
/// | `NonRetriableException` (auth, bad request)    | `TERMINAL`  |
/// | anything else                                  | `TERMINAL`  |
///
/// @implNote Thread-safe if the wrapped model is; LangChain4j chat models are.
///
/// @see LangChain4jModelProvider for model creation
public class LangChain4jLanguageModel implements LanguageModel {

    private static final Logger logger = Logger.getLogger(LangChain4jLanguageModel.class.getName());

    private final String modelName;
    private final ChatModel model;

    /// Creates a model wrapping the given chat model.
    ///
    /// @param modelName model identifier used in logs, not null
    /// @param model the LangChain4j chat model to delegate to, not null
    public LangChain4jLanguageModel(String modelName, ChatModel model) {
        this.modelName = Objects.requireNonNull(modelName, "modelName must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    @Override
    public String complete(String prompt, CompletionOptions options) {
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Instant startTime = Instant.now();

        ChatResponse response;
        try {
            response = model.chat(buildRequest(prompt, options));
        } catch (RuntimeException e) {
            throw classify(e);
        }

        String text = extractText(response);
        if (text == null || text.isBlank()) {
            throw new ProviderException(
                    FailureKind.TRANSIENT,
                    "Model " + modelName + " returned an empty response");
        }

        logger.fine(
                "Model "
                        + modelName
                        + " answered in "
                        + Duration.between(startTime, Instant.now()).toMillis()
                        + " ms");
        return text;
    }

    @Override
    public String modelName() {
        return modelName;
    }

    private ChatRequest buildRequest(String prompt, CompletionOptions options) {
        List<ChatMessage> messages = new ArrayList<>();
        if (options.systemPrompt() != null && !options.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(options.systemPrompt()));
        }
        messages.add(UserMessage.from(prompt));

        var builder = ChatRequest.builder().messages(messages);
        if (options.temperature() != null) builder.temperature(options.temperature());
        if (options.maxOutputTokens() != null) builder.maxOutputTokens(options.maxOutputTokens());
        return builder.build();
    }

    private static String extractText(ChatResponse response) {
        if (response == null) {
            return null;
        }
        AiMessage aiMessage = response.aiMessage();
        return aiMessage != null ? aiMessage.text() : null;
    }

    /// Maps a LangChain4j failure onto the provider failure taxonomy.
    ProviderException classify(RuntimeException e) {
        String message = "Model " + modelName + " failed: " + e.getMessage();
        if (!(e instanceof NonRetriableException)
                && (e instanceof RetriableException || hasTransientCause(e))) {
            logger.warning(message);
            return ProviderException.transientFailure(message, e);
        }
        logger.severe(message);
        return ProviderException.terminalFailure(message, e);
    }

    private static boolean hasTransientCause(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException || cause instanceof TimeoutException) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }
}
