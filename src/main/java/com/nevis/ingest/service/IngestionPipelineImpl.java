package com.nevis.ingest.service;

import com.nevis.ingest.client.FileSearchClient;
import com.nevis.ingest.config.IngestProperties;
import com.nevis.ingest.exception.MetadataValidationException;
import com.nevis.ingest.infra.RateLimiter;
import com.nevis.ingest.model.ChunkingConfig;
import com.nevis.ingest.model.DocumentMetadata;
import com.nevis.ingest.model.MetadataSchema;
import com.nevis.ingest.model.Store;
import com.nevis.ingest.model.UploadOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Map;

import static com.nevis.ingest.infra.RateLimitKeys.FILE_SEARCH_LIMIT;

@Slf4j
@Service
public class IngestionPipelineImpl implements IngestionPipeline {

    private final FileSearchClient fileSearchClient;
    private final OperationPoller operationPoller;
    private final RateLimiter fileSearchLimiter;
    private final ChunkingConfig chunkingConfig;

    public IngestionPipelineImpl(
        FileSearchClient fileSearchClient,
        OperationPoller operationPoller,
        @Qualifier("fileSearchLimiter") RateLimiter fileSearchLimiter,
        IngestProperties properties
    ) {
        this.fileSearchClient = fileSearchClient;
        this.operationPoller = operationPoller;
        this.fileSearchLimiter = fileSearchLimiter;
        this.chunkingConfig = properties.chunkingConfig();
    }

    @Override
    public UploadOperation upload(Store store, Path file, DocumentMetadata metadata) {
        validate(metadata);
        Map<String, String> customMetadata = metadata.toCustomMetadata();

        log.info("Uploading {} to store {} as '{}'", file.getFileName(), store.name(), metadata.displayName());

        UploadOperation submitted = fileSearchLimiter.execute(FILE_SEARCH_LIMIT, 1, () ->
            fileSearchClient.upload(store.name(), file, metadata.displayName(), chunkingConfig, customMetadata));

        UploadOperation completed = operationPoller.awaitCompletion(submitted);
        log.info("Upload of {} complete (operation {})", file.getFileName(), completed.name());
        return completed;
    }

    private static void validate(DocumentMetadata metadata) {
        if (metadata == null || metadata.schema() == null) {
            throw new MetadataValidationException("Document metadata and its schema are required");
        }
        if (isBlank(metadata.fileName())) {
            throw new MetadataValidationException("file_name is required");
        }
        if (metadata.schema() == MetadataSchema.CURRENT && isBlank(metadata.shortName())) {
            throw new MetadataValidationException("short_name is required for " + metadata.fileName());
        }
        if (metadata.schema() == MetadataSchema.LEGACY && isBlank(metadata.title())) {
            throw new MetadataValidationException("title is required for " + metadata.fileName());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
