package com.nevis.ingest.service;

import com.nevis.ingest.exception.FolderNotFoundException;
import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.FileMetadataOverride;
import com.nevis.ingest.worker.BulkIngestionWorker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulkIngestionServiceImplTest {

    @Mock
    private BulkOrchestrator bulkOrchestrator;

    @Mock
    private TaskTracker taskTracker;

    @Mock
    private BulkIngestionWorker bulkIngestionWorker;

    @InjectMocks
    private BulkIngestionServiceImpl bulkIngestionService;

    @Test
    @DisplayName("Should register a task and hand the job to the worker")
    void shouldStartJob() {
        Path folder = Path.of("/data/manuscripts");
        Map<String, FileMetadataOverride> overrides = Map.of("354.pdf", new FileMetadataOverride("354", null, null));
        when(taskTracker.create()).thenReturn("task-1");

        String taskId = bulkIngestionService.start(folder, DocumentType.MANUSCRIPTS, overrides);

        assertThat(taskId).isEqualTo("task-1");
        verify(bulkOrchestrator).validate(folder, DocumentType.MANUSCRIPTS);
        verify(bulkIngestionWorker).run("task-1", folder, DocumentType.MANUSCRIPTS, overrides);
    }

    @Test
    @DisplayName("Precondition failures should surface before a task exists")
    void shouldRejectInvalidRequestSynchronously() {
        Path folder = Path.of("/missing");
        doThrow(new FolderNotFoundException("/missing")).when(bulkOrchestrator).validate(folder, DocumentType.ABSTRACTS);

        assertThatThrownBy(() -> bulkIngestionService.start(folder, DocumentType.ABSTRACTS, null))
            .isInstanceOf(FolderNotFoundException.class);
        verifyNoInteractions(taskTracker, bulkIngestionWorker);
    }

    @Test
    @DisplayName("A rejected hand-off should leave the task failed, not processing")
    void shouldFailTaskWhenExecutorRejects() {
        Path folder = Path.of("/data/abstracts");
        when(taskTracker.create()).thenReturn("task-2");
        doThrow(new TaskRejectedException("queue full"))
            .when(bulkIngestionWorker).run("task-2", folder, DocumentType.ABSTRACTS, Map.of());

        assertThatThrownBy(() -> bulkIngestionService.start(folder, DocumentType.ABSTRACTS, null))
            .isInstanceOf(TaskRejectedException.class);
        verify(taskTracker).fail("task-2", "Bulk ingestion queue is full");
    }
}
