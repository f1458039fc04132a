package org.lite.knowledge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "knowledge.graph")
@Data
public class GraphExtractionProperties {

    /** Entity/relationship extraction after persistence; only ever runs for the local provider */
    private boolean extractionEnabled = true;
}
