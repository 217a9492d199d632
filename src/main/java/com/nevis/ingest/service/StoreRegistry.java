package com.nevis.ingest.service;

import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.Store;

public interface StoreRegistry {

    /**
     * Returns the store whose display name equals or contains {@code logicalName},
     * creating one when none exists. Resolved stores are cached for the process lifetime.
     *
     * @throws com.nevis.ingest.exception.StoreResolutionException if the store cannot be created
     */
    Store resolve(String logicalName);

    Store resolve(DocumentType documentType);
}
