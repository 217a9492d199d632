package com.nevis.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IngestionResult(
    @JsonProperty("document_name")
    String documentName,

    String title,

    String id,

    @JsonProperty("file_name")
    String fileName,

    @JsonProperty("document_type")
    DocumentType documentType,

    @JsonProperty("kg_success")
    boolean kgSuccess,

    @JsonProperty("kg_nodes")
    int kgNodes,

    @JsonProperty("kg_relationships")
    int kgRelationships,

    @JsonProperty("kg_message")
    String kgMessage
) {}
