package com.nevis.ingest.client;

import com.nevis.ingest.model.GraphElement;

import java.util.List;

public interface GraphStore {

    /**
     * Writes all elements in one batch.
     *
     * @throws com.nevis.ingest.exception.GraphStoreException if the write fails
     */
    void addGraphElements(List<GraphElement> elements);
}
