package com.nevis.ingest.model;

public record OperationError(
    Integer code,
    String message
) {

    public String describe() {
        if (message == null || message.isBlank()) {
            return code != null ? "Remote operation failed with code " + code : "Remote operation failed";
        }
        return code != null ? message + " (code " + code + ")" : message;
    }
}
