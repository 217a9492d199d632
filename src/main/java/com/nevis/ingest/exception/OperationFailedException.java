package com.nevis.ingest.exception;

import com.nevis.ingest.model.OperationError;
import lombok.Getter;

@Getter
public class OperationFailedException extends RuntimeException {
    private final String operationName;
    private final OperationError error;

    public OperationFailedException(String operationName, OperationError error) {
        super("Ingestion operation " + operationName + " failed: " + error.describe());
        this.operationName = operationName;
        this.error = error;
    }
}
