package com.nevis.ingest.service;

import com.nevis.ingest.client.FileSearchClient;
import com.nevis.ingest.config.IngestProperties;
import com.nevis.ingest.exception.OperationCancelledException;
import com.nevis.ingest.exception.OperationFailedException;
import com.nevis.ingest.exception.OperationTimeoutException;
import com.nevis.ingest.model.OperationError;
import com.nevis.ingest.model.UploadOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Slf4j
@Component
public class OperationPoller {

    private final FileSearchClient fileSearchClient;
    private final Duration interval;
    private final Duration timeout;

    @Autowired
    public OperationPoller(FileSearchClient fileSearchClient, IngestProperties properties) {
        this(fileSearchClient, properties.polling().interval(), properties.polling().timeout());
    }

    OperationPoller(FileSearchClient fileSearchClient, Duration interval, Duration timeout) {
        this.fileSearchClient = fileSearchClient;
        this.interval = interval;
        this.timeout = timeout;
    }

    public UploadOperation awaitCompletion(UploadOperation operation) {
        long deadline = System.nanoTime() + timeout.toNanos();
        UploadOperation current = operation;
        throwIfFailed(current);

        while (!current.done()) {
            if (System.nanoTime() - deadline > 0) {
                throw new OperationTimeoutException(current.name(), timeout);
            }
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException(current.name(), e);
            }
            current = fileSearchClient.getOperation(current.name());
            throwIfFailed(current);
        }

        throwIfFailed(current);
        log.debug("Operation {} completed", current.name());
        return current;
    }

    private static void throwIfFailed(UploadOperation operation) {
        Optional<OperationError> failure = operation.failure();
        if (failure.isPresent()) {
            throw new OperationFailedException(operation.name(), failure.get());
        }
    }
}
