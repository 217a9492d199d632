package com.nevis.ingest.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class Neo4jConfig {

    @Value("${neo4j.uri}")
    private String neo4jUri;

    @Value("${neo4j.username}")
    private String neo4jUsername;

    @Value("${neo4j.password}")
    private String neo4jPassword;

    private Driver driverInstance;

    @Bean
    public Driver neo4jDriver() {
        String uri = normalizeUri(neo4jUri);
        log.info("Initializing Neo4j driver with URI: {}", uri);

        if (neo4jUsername == null || neo4jUsername.isBlank() || neo4jPassword == null || neo4jPassword.isBlank()) {
            throw new IllegalStateException("Neo4j credentials are required (neo4j.username, neo4j.password)");
        }

        driverInstance = GraphDatabase.driver(uri, AuthTokens.basic(neo4jUsername, neo4jPassword));
        return driverInstance;
    }

    static String normalizeUri(String uri) {
        if (uri == null) {
            throw new IllegalArgumentException("neo4j.uri is not configured");
        }
        // The Java driver speaks bolt; http(s) URIs point at the browser UI
        if (uri.startsWith("http://")) {
            log.warn("Neo4j URI uses http://, converting to bolt://");
            return uri.replace("http://", "bolt://");
        }
        if (uri.startsWith("https://")) {
            log.warn("Neo4j URI uses https://, converting to neo4j+s://");
            return uri.replace("https://", "neo4j+s://");
        }
        if (!uri.startsWith("bolt") && !uri.startsWith("neo4j")) {
            throw new IllegalArgumentException("Unsupported Neo4j URI scheme: " + uri);
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
