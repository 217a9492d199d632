package com.nevis.ingest.model;

import java.util.Optional;

public record UploadOperation(
    String name,
    boolean done,
    Optional<OperationError> error,
    Optional<OperationResult> result
) {

    public UploadOperation {
        error = error == null ? Optional.empty() : error;
        result = result == null ? Optional.empty() : result;
    }

    public static UploadOperation pending(String name) {
        return new UploadOperation(name, false, Optional.empty(), Optional.empty());
    }

    public Optional<OperationError> failure() {
        if (error.isPresent()) {
            return error;
        }
        return result.flatMap(OperationResult::error);
    }
}
