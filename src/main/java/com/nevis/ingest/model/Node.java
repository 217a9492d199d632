package com.nevis.ingest.model;

import java.util.Map;

public record Node(
    String id,
    String type,
    Map<String, Object> properties
) {

    public Node {
        properties = Map.copyOf(properties);
    }
}
