package org.lite.knowledge.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Batching and retry policy applied by the embedding gateway to remote providers.
 */
@Configuration
@ConfigurationProperties(prefix = "knowledge.embedding")
@Validated
@Data
public class EmbeddingProperties {

    @Min(1)
    private int batchSize = 100;

    @Min(1)
    private int maxAttempts = 5;

    private Duration baseDelay = Duration.ofSeconds(1);

    private Duration maxDelay = Duration.ofSeconds(60);

    private Duration timeout = Duration.ofSeconds(120);
}
