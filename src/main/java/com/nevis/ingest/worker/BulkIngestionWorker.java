package com.nevis.ingest.worker;

import com.nevis.ingest.model.BatchResult;
import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.FileMetadataOverride;
import com.nevis.ingest.service.BulkOrchestrator;
import com.nevis.ingest.service.TaskTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class BulkIngestionWorker {

    private final BulkOrchestrator bulkOrchestrator;
    private final TaskTracker taskTracker;

    @Async("bulkIngestionExecutor")
    public void run(
        String taskId,
        Path folder,
        DocumentType documentType,
        Map<String, FileMetadataOverride> overrides
    ) {
        log.info("Task {}: starting {} ingestion of {}", taskId, documentType, folder);
        try {
            BatchResult result = bulkOrchestrator.ingestFolder(
                folder,
                documentType,
                overrides,
                event -> taskTracker.update(taskId, event)
            );
            taskTracker.complete(taskId, result);
        } catch (Exception e) {
            log.error("Task {} aborted: {}", taskId, e.getMessage(), e);
            taskTracker.fail(taskId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
