package com.nevis.ingest.controller;

import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.TaskStatus;
import com.nevis.ingest.service.BulkIngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;

@RestController
@RequestMapping("/ingest")
@RequiredArgsConstructor
public class BulkIngestionController {

    private final BulkIngestionService bulkIngestionService;

    @PostMapping("/folder")
    public ResponseEntity<TaskAcceptedResponse> ingestFolder(@Valid @RequestBody FolderIngestionRequest request) {
        String taskId = bulkIngestionService.start(
            Path.of(request.folderPath().trim()),
            DocumentType.parse(request.documentType()),
            request.metadata()
        );
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TaskAcceptedResponse(taskId, TaskStatus.PROCESSING));
    }
}
