package org.lite.knowledge.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "knowledge.providers")
@Validated
@Data
public class LlmProviderProperties {

    @NotBlank
    private String defaultProvider = "ollama";

    /**
     * When set, a failing local embedding call degrades to zero vectors instead of failing ingestion.
     * Meant for tests and offline demos.
     */
    private boolean offlineMode = false;

    private Ollama ollama = new Ollama();
    private OpenAi openai = new OpenAi();
    private Gemini gemini = new Gemini();

    @Data
    public static class Ollama {
        private String baseUrl = "http://localhost:11434";
        private String embeddingModel = "nomic-embed-text";
        private String llmModel = "qwen3:8b";
        private int embeddingDimension = 768;
    }

    @Data
    public static class OpenAi {
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private String embeddingModel = "text-embedding-3-small";
        private int embeddingDimensions = 768;
        private String chatModel = "gpt-4o-mini";
    }

    @Data
    public static class Gemini {
        private String baseUrl = "https://generativelanguage.googleapis.com";
        private String apiKey;
        private String embeddingModel = "text-embedding-004";
        private int embeddingDimension = 768;
        private String chatModel = "gemini-1.5-flash";
    }
}
