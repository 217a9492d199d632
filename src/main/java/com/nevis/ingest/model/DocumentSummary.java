package com.nevis.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DocumentSummary(
    String name,

    @JsonProperty("display_name")
    String displayName,

    @JsonProperty("short_name")
    String shortName,

    String title,

    String id,

    @JsonProperty("file_name")
    String fileName,

    MetadataSchema schema
) {

    public static final String UNKNOWN = "Unknown";

    public static DocumentSummary of(DocumentRecord record) {
        DocumentMetadata metadata = record.metadata();
        return new DocumentSummary(
            record.remoteId(),
            orDefault(record.displayName(), UNKNOWN),
            metadata.shortName(),
            orDefault(metadata.title(), UNKNOWN),
            orDefault(metadata.documentId(), DocumentMetadata.NOT_AVAILABLE),
            orDefault(metadata.fileName(), UNKNOWN),
            record.schema()
        );
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
