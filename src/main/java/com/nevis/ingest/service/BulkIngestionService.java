package com.nevis.ingest.service;

import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.FileMetadataOverride;

import java.nio.file.Path;
import java.util.Map;

public interface BulkIngestionService {

    /**
     * Validates the request, registers a task and starts the folder ingestion in the background.
     *
     * @return the id of the task tracking the job
     */
    String start(Path folder, DocumentType documentType, Map<String, FileMetadataOverride> overrides);
}
