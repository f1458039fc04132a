package org.lite.knowledge.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "knowledge.vector-store")
@Validated
@Data
public class VectorStoreProperties {

    @NotBlank
    private String indexName = "document_embeddings";

    @Min(1)
    private int dimension = 768;

    /** cosine or euclidean */
    @NotBlank
    private String similarityFunction = "cosine";

    private boolean verifyConnectivity = true;

    /** Minimum time between connectivity probes while the store is degraded */
    private Duration reprobeInterval = Duration.ofSeconds(30);
}
