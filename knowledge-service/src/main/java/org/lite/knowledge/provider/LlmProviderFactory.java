package org.lite.knowledge.provider;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.knowledge.config.LlmProviderProperties;
import org.lite.knowledge.enums.LlmProviderType;
import org.lite.knowledge.exception.ConfigurationException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a provider by type or name, creating each implementation once.
 * A blank name means the configured default.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LlmProviderFactory {

    private final WebClient.Builder webClientBuilder;
    private final LlmProviderProperties properties;

    private final Map<LlmProviderType, LlmProvider> providers = new ConcurrentHashMap<>();

    public LlmProvider getProvider(LlmProviderType type) {
        return providers.computeIfAbsent(type, this::createProvider);
    }

    public LlmProvider getProvider(String name) {
        if (name == null || name.isBlank()) {
            return getDefaultProvider();
        }
        return getProvider(LlmProviderType.fromId(name));
    }

    public LlmProviderType getDefaultType() {
        return LlmProviderType.fromId(properties.getDefaultProvider());
    }

    public LlmProvider getDefaultProvider() {
        return getProvider(getDefaultType());
    }

    private LlmProvider createProvider(LlmProviderType type) {
        log.info("Creating {} provider", type.getId());
        switch (type) {
            case OLLAMA:
                LlmProviderProperties.Ollama ollama = properties.getOllama();
                requireSetting(type, "base-url", ollama.getBaseUrl());
                requireSetting(type, "embedding-model", ollama.getEmbeddingModel());
                return new OllamaLlmProvider(webClientBuilder, ollama);
            case OPENAI:
                LlmProviderProperties.OpenAi openAi = properties.getOpenai();
                requireSetting(type, "api-key", openAi.getApiKey());
                requireSetting(type, "embedding-model", openAi.getEmbeddingModel());
                return new OpenAiLlmProvider(webClientBuilder, openAi);
            case GEMINI:
                LlmProviderProperties.Gemini gemini = properties.getGemini();
                requireSetting(type, "api-key", gemini.getApiKey());
                requireSetting(type, "embedding-model", gemini.getEmbeddingModel());
                return new GeminiLlmProvider(webClientBuilder, gemini);
            default:
                throw new ConfigurationException("Unsupported provider: '" + type.getId() + "'");
        }
    }

    private static void requireSetting(LlmProviderType type, String setting, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(type.getId(), setting);
        }
    }
}
