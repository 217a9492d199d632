package com.nevis.ingest.model;

import java.util.Map;

public record Relationship(
    Node subject,
    Node object,
    String type,
    String timestamp,
    Map<String, Object> properties
) {

    public Relationship {
        properties = Map.copyOf(properties);
    }
}
