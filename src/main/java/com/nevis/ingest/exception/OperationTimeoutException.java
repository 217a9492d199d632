package com.nevis.ingest.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class OperationTimeoutException extends RuntimeException {
    private final String operationName;

    public OperationTimeoutException(String operationName, Duration timeout) {
        super("Ingestion operation " + operationName + " did not complete within " + timeout);
        this.operationName = operationName;
    }
}
