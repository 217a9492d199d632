package com.nevis.ingest.client;

import com.nevis.ingest.exception.GraphStoreException;
import com.nevis.ingest.model.GraphElement;
import com.nevis.ingest.model.Node;
import com.nevis.ingest.model.Relationship;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class Neo4jGraphStore implements GraphStore {

    private final Driver neo4jDriver;

    @Override
    public void addGraphElements(List<GraphElement> elements) {
        Map<String, List<Map<String, Object>>> nodesByLabel = new LinkedHashMap<>();
        Map<RelationshipShape, List<Map<String, Object>>> relationshipsByShape = new LinkedHashMap<>();

        for (GraphElement element : elements) {
            for (Node node : element.nodes()) {
                nodesByLabel.computeIfAbsent(node.type(), k -> new ArrayList<>())
                    .add(Map.of("id", node.id(), "properties", node.properties()));
            }
            for (Relationship relationship : element.relationships()) {
                RelationshipShape shape = new RelationshipShape(
                    relationship.subject().type(), relationship.type(), relationship.object().type());
                Map<String, Object> properties = new HashMap<>(relationship.properties());
                if (relationship.timestamp() != null) {
                    properties.put("timestamp", relationship.timestamp());
                }
                relationshipsByShape.computeIfAbsent(shape, k -> new ArrayList<>())
                    .add(Map.of(
                        "subjectId", relationship.subject().id(),
                        "objectId", relationship.object().id(),
                        "properties", properties));
            }
        }

        try (Session session = neo4jDriver.session()) {
            session.executeWrite(tx -> {
                nodesByLabel.forEach((label, rows) ->
                    tx.run(mergeNodesCypher(label), Map.of("rows", rows)).consume());
                relationshipsByShape.forEach((shape, rows) ->
                    tx.run(mergeRelationshipsCypher(shape.subjectLabel(), shape.type(), shape.objectLabel()),
                        Map.of("rows", rows)).consume());
                return null;
            });
        } catch (Neo4jException e) {
            log.error("Failed to write graph elements: {}", e.getMessage());
            throw new GraphStoreException("Failed to write graph elements", e);
        }

        log.info("Stored {} node labels and {} relationship shapes in Neo4j",
            nodesByLabel.size(), relationshipsByShape.size());
    }

    static String mergeNodesCypher(String label) {
        return "UNWIND $rows AS row "
            + "MERGE (n:" + quote(label) + " {id: row.id}) "
            + "SET n += row.properties";
    }

    static String mergeRelationshipsCypher(String subjectLabel, String type, String objectLabel) {
        return "UNWIND $rows AS row "
            + "MATCH (s:" + quote(subjectLabel) + " {id: row.subjectId}) "
            + "MATCH (o:" + quote(objectLabel) + " {id: row.objectId}) "
            + "MERGE (s)-[r:" + quote(type) + "]->(o) "
            + "SET r += row.properties";
    }

    static String quote(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    private record RelationshipShape(String subjectLabel, String type, String objectLabel) {}
}
