package com.nevis.ingest.graph;

import java.util.List;

public final class GraphVocabulary {

    public static final List<String> NODE_TYPES = List.of(
        "ClinicalObservation",
        "TherapeuticOutcome",
        "ContextualFactor",
        "MechanisticConcept",
        "TherapeuticApproach",
        "SourceText"
    );

    public static final List<String> RELATIONSHIP_TYPES = List.of(
        "co_occurs_with",
        "preceded_by",
        "followed_by",
        "modified_by",
        "responds_to",
        "associated_with",
        "results_in",
        "described_in",
        "contradicts",
        "corroborates"
    );

    private GraphVocabulary() {
    }

    public static boolean isKnownNodeType(String type) {
        return NODE_TYPES.contains(type);
    }

    public static boolean isKnownRelationshipType(String type) {
        return RELATIONSHIP_TYPES.contains(type);
    }
}
