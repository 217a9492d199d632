package com.nevis.ingest.graph;

import java.util.List;

public record ParseResult(
    List<GraphLiteral> nodes,
    List<GraphLiteral> relationships,
    List<ParseDiagnostic> diagnostics
) {

    public ParseResult {
        nodes = List.copyOf(nodes);
        relationships = List.copyOf(relationships);
        diagnostics = List.copyOf(diagnostics);
    }
}
