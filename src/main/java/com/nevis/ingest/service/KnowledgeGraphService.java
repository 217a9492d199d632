package com.nevis.ingest.service;

import java.util.Map;

public interface KnowledgeGraphService {

    /**
     * Extracts a knowledge graph from {@code text} and writes it to the graph store.
     * Every node and relationship carries {@code metadata} as provenance.
     */
    GraphBuildOutcome build(String text, Map<String, ?> metadata);

    record GraphBuildOutcome(
        boolean success,
        int nodeCount,
        int relationshipCount,
        String message
    ) {

        public static GraphBuildOutcome failure(String message) {
            return new GraphBuildOutcome(false, 0, 0, message);
        }
    }
}
