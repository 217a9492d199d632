package com.nevis.ingest.exception;

import lombok.Getter;

@Getter
public class InvalidDocumentTypeException extends RuntimeException {
    private final String documentType;

    public InvalidDocumentTypeException(String documentType) {
        super("Invalid document type: " + documentType);
        this.documentType = documentType;
    }

    public InvalidDocumentTypeException(String documentType, String reason) {
        super("Invalid document type " + documentType + ": " + reason);
        this.documentType = documentType;
    }
}
