package com.nevis.ingest.service;

import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.QueryAnswer;

public interface StoreQueryService {

    /**
     * Answers {@code question} grounded on the documents of one store.
     */
    QueryAnswer query(String question, DocumentType documentType);
}
