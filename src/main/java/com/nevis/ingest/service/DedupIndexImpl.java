package com.nevis.ingest.service;

import com.nevis.ingest.client.FileSearchClient;
import com.nevis.ingest.model.DocumentRecord;
import com.nevis.ingest.model.Store;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class DedupIndexImpl implements DedupIndex {

    private final FileSearchClient fileSearchClient;

    @Override
    public Set<String> existingKeys(Store store) {
        List<DocumentRecord> documents = fileSearchClient.listDocuments(store.name());

        Set<String> keys = new HashSet<>();
        for (DocumentRecord document : documents) {
            String key = document.dedupKey();
            if (key != null && !key.isBlank()) {
                keys.add(key);
            }
        }

        log.info("Store {} holds {} documents with {} distinct keys", store.name(), documents.size(), keys.size());
        return keys;
    }
}
