package com.nevis.ingest.model;

import java.util.Map;

public record DocumentRecord(
    String remoteId,
    String displayName,
    MetadataSchema schema,
    Map<String, String> customMetadata
) {

    public DocumentRecord {
        customMetadata = customMetadata == null ? Map.of() : Map.copyOf(customMetadata);
    }

    public static DocumentRecord of(String remoteId, String displayName, Map<String, String> customMetadata) {
        Map<String, String> entries = customMetadata == null ? Map.of() : customMetadata;
        return new DocumentRecord(remoteId, displayName, MetadataSchema.detect(entries), entries);
    }

    public DocumentMetadata metadata() {
        return schema.fromCustomMetadata(customMetadata);
    }

    public String dedupKey() {
        return metadata().dedupKey();
    }
}
