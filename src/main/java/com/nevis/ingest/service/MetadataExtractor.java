package com.nevis.ingest.service;

import com.nevis.ingest.model.ExtractedMetadata;

import java.nio.file.Path;

public interface MetadataExtractor {

    ExtractedMetadata extractMetadata(Path file, String filename);
}
