package com.nevis.ingest.exception;

public class MetadataValidationException extends RuntimeException {

    public MetadataValidationException(String message) {
        super(message);
    }
}
