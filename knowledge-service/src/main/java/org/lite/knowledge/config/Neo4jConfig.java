package org.lite.knowledge.config;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PreDestroy;

@Configuration
@Slf4j
public class Neo4jConfig {

    @Value("${neo4j.uri}")
    private String neo4jUri;

    @Value("${neo4j.username}")
    private String neo4jUsername;

    @Value("${neo4j.password}")
    private String neo4jPassword;

    private Driver driverInstance;

    /**
     * Creates the driver without touching the network. Connectivity is probed by the vector store,
     * which switches to degraded mode instead of failing application startup.
     */
    @Bean
    public Driver neo4jDriver() {
        neo4jUri = normalizeUri(neo4jUri);

        if (neo4jUsername == null || neo4jUsername.isEmpty() || neo4jPassword == null || neo4jPassword.isEmpty()) {
            log.error("Neo4j username or password is required but not provided. Please set NEO4J_USERNAME and NEO4J_PASSWORD environment variables");
            throw new IllegalStateException("Neo4j authentication credentials are required");
        }

        log.info("Initializing Neo4j driver with URI: {}", neo4jUri);
        driverInstance = GraphDatabase.driver(neo4jUri, AuthTokens.basic(neo4jUsername, neo4jPassword));
        return driverInstance;
    }

    static String normalizeUri(String uri) {
        // The Java driver requires bolt:// or neo4j://, http(s):// is the Browser UI
        if (uri != null && uri.startsWith("http://")) {
            log.warn("Neo4j URI uses http:// scheme, converting to bolt://");
            uri = uri.replace("http://", "bolt://");
        } else if (uri != null && uri.startsWith("https://")) {
            log.warn("Neo4j URI uses https:// scheme, converting to neo4j+s://");
            uri = uri.replace("https://", "neo4j+s://");
        }

        if (uri == null || (!uri.startsWith("bolt://") && !uri.startsWith("neo4j://")
                && !uri.startsWith("neo4j+s://") && !uri.startsWith("neo4j+ssc://"))) {
            throw new IllegalArgumentException(
                    "Neo4j URI must use a supported protocol (bolt://, neo4j://, neo4j+s://). Found: " + uri);
        }
        return uri;
    }

    @PreDestroy
    public void closeDriver() {
        if (driverInstance != null) {
            log.info("Closing Neo4j driver connection");
            driverInstance.close();
        }
    }
}
