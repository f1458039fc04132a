package org.lite.knowledge.enums;

import org.lite.knowledge.exception.ConfigurationException;

import java.util.Locale;

/**
 * Embedding / text-generation backends. OLLAMA is the locally reachable default,
 * the others are remote APIs that need credentials.
 */
public enum LlmProviderType {
    OLLAMA("ollama"),
    OPENAI("openai"),
    GEMINI("gemini");

    private final String id;

    LlmProviderType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static LlmProviderType fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Provider name must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (LlmProviderType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new ConfigurationException("Unsupported provider: '" + value + "'");
    }
}
