package com.nevis.ingest.worker;

import com.nevis.ingest.exception.StoreResolutionException;
import com.nevis.ingest.model.BatchResult;
import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.FileStatus;
import com.nevis.ingest.model.ProgressEvent;
import com.nevis.ingest.model.Task;
import com.nevis.ingest.model.TaskStatus;
import com.nevis.ingest.service.BulkOrchestrator;
import com.nevis.ingest.service.InMemoryTaskTracker;
import com.nevis.ingest.service.ProgressListener;
import com.nevis.ingest.service.TaskTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkIngestionWorkerTest {

    private static final Path FOLDER = Path.of("/data/abstracts");

    @Mock
    private BulkOrchestrator bulkOrchestrator;

    private TaskTracker taskTracker;
    private BulkIngestionWorker worker;

    @BeforeEach
    void setUp() {
        taskTracker = new InMemoryTaskTracker();
        worker = new BulkIngestionWorker(bulkOrchestrator, taskTracker);
    }

    @Test
    @DisplayName("Should forward progress to the task and complete it with the batch result")
    void shouldCompleteTask() {
        String taskId = taskTracker.create();
        BatchResult result = new BatchResult(2, 2, 0, 0, List.of(), List.of());
        when(bulkOrchestrator.ingestFolder(eq(FOLDER), eq(DocumentType.ABSTRACTS), anyMap(), any()))
            .thenAnswer(invocation -> {
                ProgressListener listener = invocation.getArgument(3);
                listener.onProgress(ProgressEvent.of(1, 2, "1.pdf", FileStatus.SUCCESS));
                listener.onProgress(ProgressEvent.of(2, 2, "2.pdf", FileStatus.SUCCESS));
                return result;
            });

        worker.run(taskId, FOLDER, DocumentType.ABSTRACTS, Map.of());

        Task task = taskTracker.get(taskId);
        assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.current()).isEqualTo(2);
        assertThat(task.total()).isEqualTo(2);
        assertThat(task.processedFiles()).hasSize(2);
        assertThat(task.result()).isEqualTo(result);
    }

    @Test
    @DisplayName("Should mark the task failed when the batch aborts")
    void shouldFailTask() {
        String taskId = taskTracker.create();
        when(bulkOrchestrator.ingestFolder(eq(FOLDER), eq(DocumentType.MANUSCRIPTS), anyMap(), any()))
            .thenThrow(new StoreResolutionException("manuscripts_store", new RuntimeException("403")));

        worker.run(taskId, FOLDER, DocumentType.MANUSCRIPTS, Map.of());

        Task task = taskTracker.get(taskId);
        assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.errorMessage()).contains("manuscripts_store");
    }
}
