package com.nevis.ingest.service;

import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.FileMetadataOverride;
import com.nevis.ingest.worker.BulkIngestionWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class BulkIngestionServiceImpl implements BulkIngestionService {

    private final BulkOrchestrator bulkOrchestrator;
    private final TaskTracker taskTracker;
    private final BulkIngestionWorker bulkIngestionWorker;

    @Override
    public String start(Path folder, DocumentType documentType, Map<String, FileMetadataOverride> overrides) {
        bulkOrchestrator.validate(folder, documentType);

        String taskId = taskTracker.create();
        log.info("Queued {} ingestion of {} as task {}", documentType, folder, taskId);

        try {
            bulkIngestionWorker.run(taskId, folder, documentType, overrides == null ? Map.of() : Map.copyOf(overrides));
        } catch (TaskRejectedException e) {
            log.warn("Bulk executor rejected task {}: {}", taskId, e.getMessage());
            taskTracker.fail(taskId, "Bulk ingestion queue is full");
            throw e;
        }
        return taskId;
    }
}
