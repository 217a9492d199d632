package com.nevis.ingest.service;

import com.nevis.ingest.client.FileSearchClient;
import com.nevis.ingest.exception.InvalidRequestException;
import com.nevis.ingest.model.DocumentSummary;
import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.Store;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentCatalogServiceImpl implements DocumentCatalogService {

    static final String DOCUMENT_NAME_PREFIX = "fileSearchStores/";

    private final StoreRegistry storeRegistry;
    private final FileSearchClient fileSearchClient;

    @Override
    public List<DocumentSummary> list(DocumentType documentType) {
        Store store = storeRegistry.resolve(documentType);
        return fileSearchClient.listDocuments(store.name()).stream()
            .map(DocumentSummary::of)
            .toList();
    }

    @Override
    public void delete(String remoteId) {
        String name = remoteId == null ? "" : remoteId.trim();
        if (!name.startsWith(DOCUMENT_NAME_PREFIX) || !name.contains("/documents/")) {
            throw new InvalidRequestException("Invalid document name format: " + remoteId);
        }
        fileSearchClient.deleteDocument(name, true);
        log.info("Deleted document {}", name);
    }
}
