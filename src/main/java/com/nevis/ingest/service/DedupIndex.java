package com.nevis.ingest.service;

import com.nevis.ingest.model.Store;

import java.util.Set;

public interface DedupIndex {

    /**
     * Dedup keys of every document already present in {@code store}.
     */
    Set<String> existingKeys(Store store);
}
