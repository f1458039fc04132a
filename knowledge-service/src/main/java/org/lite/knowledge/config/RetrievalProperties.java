package org.lite.knowledge.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "knowledge.retrieval")
@Validated
@Data
public class RetrievalProperties {

    @Min(1)
    private int topK = 5;

    private boolean fallbackEnabled = true;
}
