package org.lite.knowledge.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "knowledge.chunking")
@Validated
@Data
public class ChunkingProperties {

    @Min(1)
    private int chunkSize = 1000;

    @Min(0)
    private int chunkOverlap = 200;

    /** Leading characters of a document handed to schema inference during ingestion */
    @Min(1)
    private int schemaSampleLength = 4000;
}
