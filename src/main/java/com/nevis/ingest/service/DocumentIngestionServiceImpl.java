package com.nevis.ingest.service;

import com.nevis.ingest.client.DocumentTextExtractor;
import com.nevis.ingest.config.IngestProperties;
import com.nevis.ingest.exception.InvalidRequestException;
import com.nevis.ingest.model.DocumentMetadata;
import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.ExtractedMetadata;
import com.nevis.ingest.model.IngestionResult;
import com.nevis.ingest.model.OperationResult;
import com.nevis.ingest.model.Store;
import com.nevis.ingest.model.UploadOperation;
import com.nevis.ingest.service.KnowledgeGraphService.GraphBuildOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
public class DocumentIngestionServiceImpl implements DocumentIngestionService {

    static final String KG_SOURCE = "SpineDAO_Pipeline";

    private final StoreRegistry storeRegistry;
    private final IngestionPipeline ingestionPipeline;
    private final LlmMetadataExtractor llmMetadataExtractor;
    private final DocumentTextExtractor textExtractor;
    private final KnowledgeGraphService knowledgeGraphService;
    private final Path uploadFolder;

    public DocumentIngestionServiceImpl(
        StoreRegistry storeRegistry,
        IngestionPipeline ingestionPipeline,
        LlmMetadataExtractor llmMetadataExtractor,
        DocumentTextExtractor textExtractor,
        KnowledgeGraphService knowledgeGraphService,
        IngestProperties properties
    ) {
        this.storeRegistry = storeRegistry;
        this.ingestionPipeline = ingestionPipeline;
        this.llmMetadataExtractor = llmMetadataExtractor;
        this.textExtractor = textExtractor;
        this.knowledgeGraphService = knowledgeGraphService;
        this.uploadFolder = Path.of(properties.limits().uploadFolder());
    }

    @Override
    public IngestionResult ingest(
        String originalFilename,
        InputStream content,
        DocumentType documentType,
        String title,
        String id
    ) {
        String filename = FileNames.sanitize(originalFilename);
        if (filename.isEmpty()) {
            throw new InvalidRequestException("No file selected");
        }
        if (!textExtractor.supports(filename)) {
            throw new InvalidRequestException("Unsupported file type: " + filename);
        }
        // Manual metadata is validated before anything is written or sent
        MetadataExtractor metadataExtractor = title != null
            ? new ManualMetadataExtractor(title, id)
            : llmMetadataExtractor;

        Path workDir = uploadFolder.resolve(UUID.randomUUID().toString());
        Path file = workDir.resolve(filename);
        try {
            save(content, workDir, file);

            ExtractedMetadata extracted = metadataExtractor.extractMetadata(file, filename);
            DocumentMetadata metadata = documentType == DocumentType.GENERAL
                ? DocumentMetadata.legacy(extracted.title(), extracted.id(), filename)
                : DocumentMetadata.current(FileNames.stem(filename), extracted.title(), extracted.id(), filename);

            Store store = storeRegistry.resolve(documentType);
            UploadOperation operation = ingestionPipeline.upload(store, file, metadata);
            String documentName = operation.result().map(OperationResult::documentName).orElse(null);

            GraphBuildOutcome graph = buildGraph(file, extracted, filename);

            return new IngestionResult(
                documentName,
                extracted.title(),
                extracted.id(),
                filename,
                documentType,
                graph.success(),
                graph.nodeCount(),
                graph.relationshipCount(),
                graph.message()
            );
        } finally {
            cleanUp(file, workDir);
        }
    }

    private GraphBuildOutcome buildGraph(Path file, ExtractedMetadata extracted, String filename) {
        String text;
        try {
            text = textExtractor.extract(file);
        } catch (RuntimeException e) {
            log.error("Text extraction failed for {}: {}", filename, e.getMessage(), e);
            return GraphBuildOutcome.failure("Text extraction failed: " + e.getMessage());
        }

        Map<String, Object> provenance = new LinkedHashMap<>();
        provenance.put("document_title", extracted.title());
        provenance.put("document_id", extracted.id());
        provenance.put("file_name", filename);
        provenance.put("source", KG_SOURCE);
        return knowledgeGraphService.build(text, provenance);
    }

    private static void save(InputStream content, Path workDir, Path file) {
        try {
            Files.createDirectories(workDir);
            Files.copy(content, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save upload " + file.getFileName(), e);
        }
    }

    private static void cleanUp(Path file, Path workDir) {
        try {
            Files.deleteIfExists(file);
            Files.deleteIfExists(workDir);
        } catch (IOException e) {
            log.warn("Failed to remove temporary upload {}: {}", file, e.getMessage());
        }
    }
}
