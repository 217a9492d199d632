package com.nevis.ingest.service;

import com.nevis.ingest.config.IngestProperties;
import com.nevis.ingest.exception.FolderNotFoundException;
import com.nevis.ingest.exception.InvalidDocumentTypeException;
import com.nevis.ingest.exception.OperationCancelledException;
import com.nevis.ingest.model.BatchResult;
import com.nevis.ingest.model.DocumentMetadata;
import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.FileMetadataOverride;
import com.nevis.ingest.model.FileStatus;
import com.nevis.ingest.model.ProcessedFile;
import com.nevis.ingest.model.ProgressEvent;
import com.nevis.ingest.model.Store;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
public class BulkOrchestrator {

    private final StoreRegistry storeRegistry;
    private final DedupIndex dedupIndex;
    private final IngestionPipeline ingestionPipeline;
    private final String fileExtension;

    public BulkOrchestrator(
        StoreRegistry storeRegistry,
        DedupIndex dedupIndex,
        IngestionPipeline ingestionPipeline,
        IngestProperties properties
    ) {
        this.storeRegistry = storeRegistry;
        this.dedupIndex = dedupIndex;
        this.ingestionPipeline = ingestionPipeline;
        this.fileExtension = properties.bulk().fileExtension();
    }

    /**
     * Checks the preconditions of a folder ingestion without touching any remote service.
     */
    public void validate(Path folder, DocumentType documentType) {
        if (documentType == null || !documentType.bulkCapable()) {
            throw new InvalidDocumentTypeException(
                documentType == null ? null : documentType.name(), "folder ingestion is not supported");
        }
        if (folder == null || !Files.isDirectory(folder)) {
            throw new FolderNotFoundException(String.valueOf(folder));
        }
    }

    public BatchResult ingestFolder(
        Path folder,
        DocumentType documentType,
        Map<String, FileMetadataOverride> overrides,
        ProgressListener listener
    ) {
        validate(folder, documentType);
        Map<String, FileMetadataOverride> metadataOverrides = overrides == null ? Map.of() : overrides;
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;

        List<Path> files = listFiles(folder);
        int total = files.size();
        log.info("Starting {} ingestion of {} files from {}", documentType, total, folder);

        Store store = storeRegistry.resolve(documentType);
        Set<String> existingKeys = documentType.requiresDedup()
            ? new HashSet<>(dedupIndex.existingKeys(store))
            : new HashSet<>();

        List<ProcessedFile> processed = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int successful = 0;
        int failed = 0;
        int skipped = 0;

        for (int i = 0; i < total; i++) {
            Path file = files.get(i);
            String filename = file.getFileName().toString();
            DocumentMetadata metadata = metadataFor(filename, metadataOverrides.get(filename));

            ProgressEvent event;
            if (documentType.requiresDedup() && existingKeys.contains(metadata.dedupKey())) {
                log.info("Skipping {}: '{}' already ingested", filename, metadata.dedupKey());
                skipped++;
                event = new ProgressEvent(i + 1, total, filename, FileStatus.SKIPPED, "already ingested");
            } else {
                try {
                    ingestionPipeline.upload(store, file, metadata);
                    successful++;
                    existingKeys.add(metadata.dedupKey());
                    event = ProgressEvent.of(i + 1, total, filename, FileStatus.SUCCESS);
                } catch (OperationCancelledException e) {
                    throw e;
                } catch (RuntimeException e) {
                    log.error("Failed to ingest {}: {}", filename, e.getMessage(), e);
                    failed++;
                    errors.add(filename + ": " + e.getMessage());
                    event = new ProgressEvent(i + 1, total, filename, FileStatus.FAILED, e.getMessage());
                }
            }

            processed.add(event.toProcessedFile());
            progress.onProgress(event);
        }

        log.info("Finished {} ingestion from {}: {} successful, {} failed, {} skipped",
            documentType, folder, successful, failed, skipped);
        return new BatchResult(total, successful, failed, skipped, processed, errors);
    }

    static DocumentMetadata metadataFor(String filename, FileMetadataOverride override) {
        String shortName = FileNames.stem(filename);
        String title = null;
        String id = null;
        if (override != null) {
            if (override.shortName() != null && !override.shortName().isBlank()) {
                shortName = override.shortName().trim();
            }
            title = override.title();
            id = override.id();
        }
        return DocumentMetadata.current(shortName, title, id, filename);
    }

    private List<Path> listFiles(Path folder) {
        try (Stream<Path> entries = Files.list(folder)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(path -> FileNames.hasExtension(path, fileExtension))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + folder, e);
        }
    }
}
