package com.nevis.ingest.controller;

import com.nevis.ingest.exception.InvalidRequestException;
import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.IngestionResult;
import com.nevis.ingest.service.DocumentCatalogService;
import com.nevis.ingest.service.DocumentIngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentIngestionService documentIngestionService;
    private final DocumentCatalogService documentCatalogService;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestionResult> upload(
        @RequestPart("file") MultipartFile file,
        @RequestParam(name = "documentType", defaultValue = "GENERAL") String documentType,
        @RequestParam(name = "title", required = false) String title,
        @RequestParam(name = "id", required = false) String id) throws IOException {

        if (file.isEmpty() || file.getOriginalFilename() == null || file.getOriginalFilename().isBlank()) {
            throw new InvalidRequestException("No file selected");
        }
        DocumentType type = DocumentType.parse(documentType);

        try (InputStream content = file.getInputStream()) {
            IngestionResult result = documentIngestionService.ingest(
                file.getOriginalFilename(), content, type, title, id);
            return ResponseEntity.ok(result);
        }
    }

    @GetMapping
    public ResponseEntity<DocumentListResponse> list(
        @RequestParam(name = "documentType", defaultValue = "GENERAL") String documentType) {

        var documents = documentCatalogService.list(DocumentType.parse(documentType));
        return ResponseEntity.ok(new DocumentListResponse(documents));
    }

    @DeleteMapping
    public ResponseEntity<Void> delete(@RequestParam(name = "name") String name) {
        documentCatalogService.delete(name);
        return ResponseEntity.noContent().build();
    }
}
