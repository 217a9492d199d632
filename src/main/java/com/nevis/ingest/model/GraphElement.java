package com.nevis.ingest.model;

import java.util.List;

public record GraphElement(
    List<Node> nodes,
    List<Relationship> relationships,
    String sourceRef
) {

    public GraphElement {
        nodes = List.copyOf(nodes);
        relationships = List.copyOf(relationships);
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && relationships.isEmpty();
    }
}
