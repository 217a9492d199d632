package com.nevis.ingest.service;

import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.IngestionResult;

import java.io.InputStream;

public interface DocumentIngestionService {

    /**
     * Indexes one uploaded document and builds its knowledge graph.
     *
     * @param title manual title, or {@code null} to infer title and id from the content
     * @param id manual identifier, only used together with a manual title
     */
    IngestionResult ingest(
        String originalFilename,
        InputStream content,
        DocumentType documentType,
        String title,
        String id
    );
}
