package com.nevis.ingest.service;

import com.nevis.ingest.exception.MetadataValidationException;
import com.nevis.ingest.model.DocumentMetadata;
import com.nevis.ingest.model.ExtractedMetadata;

import java.nio.file.Path;

public class ManualMetadataExtractor implements MetadataExtractor {

    private final ExtractedMetadata metadata;

    public ManualMetadataExtractor(String title, String id) {
        if (title == null || title.trim().isEmpty()) {
            throw new MetadataValidationException("Title must not be empty");
        }
        String resolvedId = id == null || id.trim().isEmpty() ? DocumentMetadata.NOT_AVAILABLE : id.trim();
        this.metadata = new ExtractedMetadata(title.trim(), resolvedId);
    }

    @Override
    public ExtractedMetadata extractMetadata(Path file, String filename) {
        return metadata;
    }
}
