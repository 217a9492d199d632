package com.nevis.ingest.service;

import com.nevis.ingest.model.DocumentSummary;
import com.nevis.ingest.model.DocumentType;

import java.util.List;

public interface DocumentCatalogService {

    List<DocumentSummary> list(DocumentType documentType);

    /**
     * Deletes a document together with its chunks.
     */
    void delete(String remoteId);
}
