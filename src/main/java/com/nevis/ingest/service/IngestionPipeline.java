package com.nevis.ingest.service;

import com.nevis.ingest.model.DocumentMetadata;
import com.nevis.ingest.model.Store;
import com.nevis.ingest.model.UploadOperation;

import java.nio.file.Path;

public interface IngestionPipeline {

    /**
     * Uploads one document into {@code store} and blocks until the remote ingestion finishes.
     *
     * @return the completed operation
     * @throws com.nevis.ingest.exception.MetadataValidationException if mandatory metadata is missing
     * @throws com.nevis.ingest.exception.OperationFailedException if the remote job reports an error
     * @throws com.nevis.ingest.exception.OperationTimeoutException if the job does not finish in time
     */
    UploadOperation upload(Store store, Path file, DocumentMetadata metadata);
}
