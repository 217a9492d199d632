package com.nevis.ingest.model;

import java.util.Optional;

public record OperationResult(
    String documentName,
    Optional<OperationError> error
) {

    public OperationResult {
        error = error == null ? Optional.empty() : error;
    }
}
