package com.nevis.ingest.exception;

import lombok.Getter;

@Getter
public class OperationCancelledException extends RuntimeException {
    private final String operationName;

    public OperationCancelledException(String operationName, InterruptedException cause) {
        super("Waiting for ingestion operation " + operationName + " was cancelled", cause);
        this.operationName = operationName;
    }

    public OperationCancelledException(String operationName, String message, InterruptedException cause) {
        super(message, cause);
        this.operationName = operationName;
    }
}
