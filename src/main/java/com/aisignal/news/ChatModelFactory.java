package com.aisignal.news;

import com.aisignal.config.Config;
import com.aisignal.core.diagnostics.CauseCode;
import com.aisignal.core.diagnostics.Outcome;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Locale;

/**
 * Builds the LangChain4j chat model selected by {@code ai.provider}. A missing credential is a
 * failure with {@link CauseCode#CLASSIFY_NO_CREDENTIAL}, never an exception.
 */
public final class ChatModelFactory {
    private static final Logger log = LogManager.getLogger(ChatModelFactory.class);
    static final String OWNER = "chat-model";

    private ChatModelFactory() {
    }

    /**
     * Anthropic needs {@code ai.api_key}, Ollama needs {@code ai.base_url}. Retries are off; the
     * classifier decides what a failed call means.
     */
    public static Outcome<ChatLanguageModel> create(Config config) {
        String provider = config.getString("ai.provider", "anthropic").toLowerCase(Locale.ROOT);
        String model = config.getString("ai.model");
        int maxTokens = Math.max(1, config.getInt("ai.max_tokens", 600));
        double temperature = config.getDouble("ai.temperature", 0.2);
        Duration timeout = Duration.ofSeconds(Math.max(1, config.getInt("ai.timeout_sec", 30)));

        if ("ollama".equals(provider)) {
            String baseUrl = config.getString("ai.base_url");
            if (baseUrl.isEmpty()) {
                return Outcome.failure(CauseCode.CLASSIFY_NO_CREDENTIAL, OWNER, "ai.base_url not set");
            }
            return Outcome.attempt(OWNER, CauseCode.CLASSIFY_NO_CREDENTIAL, () -> OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(model)
                    .temperature(temperature)
                    .numPredict(maxTokens)
                    .timeout(timeout)
                    .maxRetries(0)
                    .build());
        }
        if (!"anthropic".equals(provider)) {
            log.warn("unknown ai.provider '{}', classification disabled", provider);
            return Outcome.failure(CauseCode.CLASSIFY_NO_CREDENTIAL, OWNER, "unknown provider " + provider);
        }

        String apiKey = config.getString("ai.api_key");
        if (apiKey.isEmpty()) {
            return Outcome.failure(CauseCode.CLASSIFY_NO_CREDENTIAL, OWNER, "ai.api_key not set");
        }
        return Outcome.attempt(OWNER, CauseCode.CLASSIFY_NO_CREDENTIAL, () -> AnthropicChatModel.builder()
                .apiKey(apiKey)
                .modelName(model)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .timeout(timeout)
                .maxRetries(0)
                .build());
    }
}
