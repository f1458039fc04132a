package org.lite.knowledge.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "knowledge.cache")
@Validated
@Data
public class DocumentCacheProperties {

    private Duration ttl = Duration.ofMinutes(30);

    @Min(1)
    private int maxDocuments = 100;

    private Duration cleanupInterval = Duration.ofMinutes(5);
}
