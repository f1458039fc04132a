package org.lite.knowledge.exception;

/**
 * Exception thrown when a provider is selected but its credentials or settings are missing
 */
public class ConfigurationException extends KnowledgePipelineException {

    public ConfigurationException(String provider, String setting) {
        super(String.format("Provider '%s' is not configured: missing %s", provider, setting),
                provider, "configure", 0, null);
    }

    public ConfigurationException(String message) {
        super(message);
    }
}
