package io.prospekt.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.prospekt.core.provider.LanguageModel;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class LangChain4jModelProviderTest {

    private final LangChain4jModelProvider provider = new LangChain4jModelProvider();

    @ParameterizedTest
    @ValueSource(
            strings = {"gemini-2.0-flash", "gemma-2", "gpt-4o", "o1-mini", "claude-sonnet-4"})
    void shouldSupportKnownPrefixes(String modelName) {
        assertThat(provider.supportsModel(modelName)).isTrue();
    }

    @Test
    void shouldNotSupportUnknownOrNullModels() {
        assertThat(provider.supportsModel("llama-3")).isFalse();
        assertThat(provider.supportsModel("simulated")).isFalse();
        assertThat(provider.supportsModel(null)).isFalse();
    }

    @Test
    void shouldOutrankDefaultPriority() {
        assertThat(provider.getPriority()).isGreaterThan(0);
        assertThat(provider.getName()).isEqualTo("langchain4j");
    }

    @Test
    void shouldCreateGeminiModelWithGoogleKey() {
        LanguageModel model =
                provider.createModel("gemini-2.0-flash", Map.of("GOOGLE_API_KEY", "test-key"));

        assertThat(model).isInstanceOf(LangChain4jLanguageModel.class);
        assertThat(model.modelName()).isEqualTo("gemini-2.0-flash");
    }

    @Test
    void shouldCreateOpenAiAndAnthropicModels() {
        Map<String, String> credentials =
                Map.of("OPENAI_API_KEY", "sk-test", "anthropic_api_key", "ak-test");

        assertThat(provider.createModel("gpt-4o-mini", credentials).modelName())
                .isEqualTo("gpt-4o-mini");
        assertThat(provider.createModel("claude-sonnet-4", credentials).modelName())
                .isEqualTo("claude-sonnet-4");
    }

    @Test
    void shouldFailWhenApiKeyIsMissing() {
        assertThatThrownBy(() -> provider.createModel("gemini-2.0-flash", Map.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GOOGLE_API_KEY");
    }

    @Test
    void shouldIgnoreBlankApiKey() {
        assertThatThrownBy(
                        () ->
                                LangChain4jModelProvider.requireApiKey(
                                        Map.of("OPENAI_API_KEY", " "), "OPENAI_API_KEY"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldRejectUnsupportedModelName() {
        assertThatThrownBy(() -> provider.createChatModel("llama-3", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("llama-3");
    }
}
