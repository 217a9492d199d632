package com.nevis.ingest.graph;

import com.nevis.ingest.model.GraphElement;
import com.nevis.ingest.model.Node;
import com.nevis.ingest.model.Relationship;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
public class GraphExtractor {

    public static final String SOURCE_KEY = "source";
    public static final String DEFAULT_SOURCE = "agent_created";
    public static final String NAME_KEY = "name";

    private final GraphLiteralParser parser = new GraphLiteralParser();

    public GraphElement extract(String generatedText) {
        return extract(generatedText, Map.of());
    }

    public GraphElement extract(String generatedText, Map<String, ?> metadata) {
        ParseResult parsed = parser.parse(generatedText);
        parsed.diagnostics().forEach(d ->
            log.debug("Skipped malformed literal at {}: {} [{}]", d.position(), d.reason(), d.fragment()));

        Map<String, Object> provenance = new LinkedHashMap<>();
        provenance.put(SOURCE_KEY, DEFAULT_SOURCE);
        if (metadata != null) {
            metadata.forEach((key, value) -> {
                if (key != null && value != null) {
                    provenance.put(key, value);
                }
            });
        }

        Map<String, Node> nodes = new LinkedHashMap<>();
        int droppedNodes = 0;
        for (GraphLiteral literal : parsed.nodes()) {
            String id = nodeId(literal.argument(0, "id"));
            String type = typeName(literal.argument(1, "type"));
            if (id == null || type == null) {
                droppedNodes++;
                continue;
            }
            if (nodes.containsKey(id)) {
                continue;
            }
            Map<String, Object> properties = new LinkedHashMap<>();
            properties.put(NAME_KEY, id);
            properties.putAll(provenance);
            nodes.put(id, new Node(id, type, properties));
        }

        List<Relationship> relationships = new ArrayList<>();
        int droppedRelationships = 0;
        for (GraphLiteral literal : parsed.relationships()) {
            Node subject = endpoint(literal.argument(0, "subj", "subject"), nodes);
            Node object = endpoint(literal.argument(1, "obj", "object"), nodes);
            String type = typeName(literal.argument(2, "type"));
            if (subject == null || object == null || type == null) {
                droppedRelationships++;
                continue;
            }
            Object timestamp = literal.argument(3, "timestamp");
            relationships.add(new Relationship(
                subject,
                object,
                type,
                timestamp instanceof String || timestamp instanceof Long ? timestamp.toString() : null,
                provenance
            ));
        }

        if (droppedNodes > 0 || droppedRelationships > 0 || !parsed.diagnostics().isEmpty()) {
            log.warn("Graph extraction dropped {} nodes, {} relationships and {} malformed fragments",
                droppedNodes, droppedRelationships, parsed.diagnostics().size());
        }
        log.info("Extracted {} nodes and {} relationships", nodes.size(), relationships.size());

        return new GraphElement(new ArrayList<>(nodes.values()), relationships, generatedText);
    }

    /**
     * Resolves a relationship endpoint to a node captured in this extraction, or null
     * when the endpoint is malformed or was never admitted as a node.
     */
    private static Node endpoint(Object value, Map<String, Node> nodes) {
        Object idValue = value instanceof GraphLiteral literal && literal.kind() == GraphLiteral.Kind.NODE
            ? literal.argument(0, "id")
            : value;
        String id = nodeId(idValue);
        return id == null ? null : nodes.get(id);
    }

    static String nodeId(Object value) {
        if (value instanceof Long number) {
            return number.toString();
        }
        if (value instanceof String text && !text.isBlank()) {
            return text.trim();
        }
        return null;
    }

    static String typeName(Object value) {
        if (value instanceof String text && !text.isBlank()) {
            return text.trim();
        }
        return null;
    }
}
