package com.nevis.ingest.service;

import com.nevis.ingest.client.GraphStore;
import com.nevis.ingest.config.IngestProperties;
import com.nevis.ingest.graph.GraphExtractor;
import com.nevis.ingest.graph.GraphVocabulary;
import com.nevis.ingest.infra.RateLimiter;
import com.nevis.ingest.model.GraphElement;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

import static com.nevis.ingest.infra.RateLimitKeys.CHAT_LIMIT;

@Slf4j
@Service
public class KnowledgeGraphServiceImpl implements KnowledgeGraphService {

    static final String EXTRACTION_PROMPT_TEMPLATE =
        """
            You are tasked with extracting entities (nodes) and relationships from historical spine science texts
            and traditional medicine documents, then structuring them into Node and Relationship objects.
            Whatever the language of the documents, extracted nodes and relationships must be in English.

            Node Extraction:
            For each identified entity, create a Node with a unique identifier (id) and a type (type).
            Node types must be one of the following:
            - ClinicalObservation (signs, symptoms, disease presentations)
            - TherapeuticOutcome (treatment responses, recovery patterns)
            - ContextualFactor (environmental, behavioral, constitutional factors)
            - MechanisticConcept (traditional explanatory models, processes)
            - TherapeuticApproach (interventions, remedies, methods)
            - SourceText (reference to original documents or authors)

            Relationship Extraction:
            For each relationship between extracted entities, create a Relationship with a subject (subj)
            and an object (obj), which are Node objects, and a type (type) from the following options:
            - co_occurs_with (between related clinical observations)
            - preceded_by/followed_by (temporal relationships)
            - modified_by (how contexts affect observations)
            - responds_to (observation responses to treatments)
            - associated_with (contextual associations with observations)
            - results_in (effects produced by treatments)
            - described_in (attribution to source texts)
            - contradicts/corroborates (consistency relationships)

            Output Formatting:
            Do not wrap the output in lists or dictionaries. Strictly follow the format of the example output
            and do not add any additional information.

            Example Content:
            "Ollivier describes cases of paralysis linked to spinal blood congestions, where an accumulation of
            blood in the spinal veins leads to symptoms like incomplete paralysis without intellectual impairment.
            He notes that these congestions often resolve spontaneously."

            Expected Output:
            Nodes:
            Node(id='paralysis_spinal_blood_congestion', type='ClinicalObservation')
            Node(id='incomplete_paralysis', type='ClinicalObservation')
            Node(id='blood_accumulation_spinal_veins', type='MechanisticConcept')
            Node(id='spontaneous_resolution', type='TherapeuticOutcome')
            Node(id='Ollivier', type='SourceText')

            Relationships:
            Relationship(subj=Node(id='blood_accumulation_spinal_veins', type='MechanisticConcept'), obj=Node(id='paralysis_spinal_blood_congestion', type='ClinicalObservation'), type='associated_with')
            Relationship(subj=Node(id='paralysis_spinal_blood_congestion', type='ClinicalObservation'), obj=Node(id='incomplete_paralysis', type='ClinicalObservation'), type='co_occurs_with')
            Relationship(subj=Node(id='paralysis_spinal_blood_congestion', type='ClinicalObservation'), obj=Node(id='spontaneous_resolution', type='TherapeuticOutcome'), type='results_in')
            Relationship(subj=Node(id='paralysis_spinal_blood_congestion', type='ClinicalObservation'), obj=Node(id='Ollivier', type='SourceText'), type='described_in')

            ===== TASK =====
            Extract nodes and relationships from the given content and structure them into Node and Relationship objects.

            {task}
            """;

    private final ChatModel chatModel;
    private final RateLimiter chatLimiter;
    private final GraphExtractor graphExtractor;
    private final GraphStore graphStore;
    private final int maxChars;

    public KnowledgeGraphServiceImpl(
        ChatModel chatModel,
        @Qualifier("chatLimiter") RateLimiter chatLimiter,
        GraphExtractor graphExtractor,
        GraphStore graphStore,
        IngestProperties properties
    ) {
        this.chatModel = chatModel;
        this.chatLimiter = chatLimiter;
        this.graphExtractor = graphExtractor;
        this.graphStore = graphStore;
        this.maxChars = properties.limits().graphMaxChars();
    }

    @Override
    public GraphBuildOutcome build(String text, Map<String, ?> metadata) {
        if (text == null || text.isBlank()) {
            log.warn("No text to build a knowledge graph from");
            return GraphBuildOutcome.failure("No text extracted from document");
        }

        String content = text.substring(0, Math.min(text.length(), maxChars));
        String prompt = EXTRACTION_PROMPT_TEMPLATE.replace("{task}", content);

        try {
            String response = chatLimiter.execute(CHAT_LIMIT, 1, () -> chatModel.chat(prompt));
            GraphElement element = graphExtractor.extract(response, metadata);
            warnOnUnknownTypes(element);

            if (element.isEmpty()) {
                log.warn("Model output contained no usable nodes or relationships");
                return new GraphBuildOutcome(true, 0, 0, "No entities found");
            }

            graphStore.addGraphElements(List.of(element));
            log.info("Stored knowledge graph with {} nodes and {} relationships",
                element.nodes().size(), element.relationships().size());
            return new GraphBuildOutcome(
                true,
                element.nodes().size(),
                element.relationships().size(),
                "Knowledge graph created"
            );
        } catch (Exception e) {
            log.error("Knowledge graph build failed: {}", e.getMessage(), e);
            return GraphBuildOutcome.failure(e.getMessage());
        }
    }

    private static void warnOnUnknownTypes(GraphElement element) {
        element.nodes().stream()
            .filter(node -> !GraphVocabulary.isKnownNodeType(node.type()))
            .forEach(node -> log.warn("Node {} has off-vocabulary type {}", node.id(), node.type()));
        element.relationships().stream()
            .filter(relationship -> !GraphVocabulary.isKnownRelationshipType(relationship.type()))
            .forEach(relationship -> log.warn("Relationship {} -> {} has off-vocabulary type {}",
                relationship.subject().id(), relationship.object().id(), relationship.type()));
    }
}
