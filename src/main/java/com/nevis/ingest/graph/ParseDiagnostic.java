package com.nevis.ingest.graph;

public record ParseDiagnostic(
    int position,
    String fragment,
    String reason
) {}
