package com.nevis.ingest.client;

import com.nevis.ingest.model.ChunkingConfig;
import com.nevis.ingest.model.DocumentRecord;
import com.nevis.ingest.model.QueryAnswer;
import com.nevis.ingest.model.Store;
import com.nevis.ingest.model.UploadOperation;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public interface FileSearchClient {

    List<Store> listStores();

    Store createStore(String displayName);

    UploadOperation upload(
        String storeName,
        Path file,
        String displayName,
        ChunkingConfig chunkingConfig,
        Map<String, String> customMetadata
    );

    UploadOperation getOperation(String operationName);

    List<DocumentRecord> listDocuments(String storeName);

    void deleteDocument(String remoteId, boolean force);

    QueryAnswer generateWithFileSearch(String prompt, List<String> storeNames);
}
