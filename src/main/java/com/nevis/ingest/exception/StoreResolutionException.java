package com.nevis.ingest.exception;

import lombok.Getter;

@Getter
public class StoreResolutionException extends RuntimeException {
    private final String logicalName;

    public StoreResolutionException(String logicalName, Throwable cause) {
        super("Could not resolve file search store: " + logicalName, cause);
        this.logicalName = logicalName;
    }
}
