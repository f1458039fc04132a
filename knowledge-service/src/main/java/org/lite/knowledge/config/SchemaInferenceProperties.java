package org.lite.knowledge.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "knowledge.schema")
@Validated
@Data
public class SchemaInferenceProperties {

    @Min(1)
    private int defaultSampleLength = 1000;

    @Min(1)
    private int minSampleLength = 50;

    @Min(1)
    private int maxSampleLength = 2000;
}
