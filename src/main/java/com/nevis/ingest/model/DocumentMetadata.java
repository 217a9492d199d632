package com.nevis.ingest.model;

import java.util.Map;

public record DocumentMetadata(
    MetadataSchema schema,
    String shortName,
    String title,
    String documentId,
    String fileName
) {

    public static final String NOT_AVAILABLE = "N/A";

    public static DocumentMetadata legacy(String title, String documentId, String fileName) {
        return new DocumentMetadata(MetadataSchema.LEGACY, title, title, documentId, fileName);
    }

    public static DocumentMetadata current(String shortName, String title, String documentId, String fileName) {
        return new DocumentMetadata(MetadataSchema.CURRENT, shortName, title, documentId, fileName);
    }

    public String dedupKey() {
        return shortName;
    }

    public String displayName() {
        if (schema == MetadataSchema.CURRENT && title != null && !title.isBlank()) {
            return title;
        }
        return shortName;
    }

    public Map<String, String> toCustomMetadata() {
        return schema.toCustomMetadata(this);
    }
}
