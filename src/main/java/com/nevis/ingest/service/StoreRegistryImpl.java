package com.nevis.ingest.service;

import com.nevis.ingest.client.FileSearchClient;
import com.nevis.ingest.config.IngestProperties;
import com.nevis.ingest.exception.StoreResolutionException;
import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.Store;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class StoreRegistryImpl implements StoreRegistry {

    private final FileSearchClient fileSearchClient;
    private final IngestProperties properties;

    private final ConcurrentHashMap<String, Store> stores = new ConcurrentHashMap<>();

    @Override
    public Store resolve(DocumentType documentType) {
        return resolve(properties.storeName(documentType));
    }

    @Override
    public Store resolve(String logicalName) {
        if (logicalName == null || logicalName.isBlank()) {
            throw new IllegalArgumentException("Store name must not be blank");
        }
        // One resolution per name at a time, so a process never creates the same store twice
        return stores.computeIfAbsent(logicalName, this::findOrCreate);
    }

    private Store findOrCreate(String logicalName) {
        Optional<Store> existing = findExisting(logicalName);
        if (existing.isPresent()) {
            log.info("Using existing store {} for '{}'", existing.get().name(), logicalName);
            return existing.get();
        }

        try {
            Store created = fileSearchClient.createStore(logicalName);
            log.info("Created new store {} for '{}'", created.name(), logicalName);
            return created;
        } catch (RuntimeException e) {
            log.error("Failed to create store '{}': {}", logicalName, e.getMessage(), e);
            throw new StoreResolutionException(logicalName, e);
        }
    }

    private Optional<Store> findExisting(String logicalName) {
        List<Store> listed;
        try {
            listed = fileSearchClient.listStores();
        } catch (RuntimeException e) {
            log.warn("Listing stores failed, creating '{}' instead: {}", logicalName, e.getMessage());
            return Optional.empty();
        }

        return listed.stream()
            .filter(store -> logicalName.equals(store.displayName()))
            .findFirst()
            .or(() -> listed.stream()
                .filter(store -> store.displayName() != null && store.displayName().contains(logicalName))
                .findFirst());
    }
}
