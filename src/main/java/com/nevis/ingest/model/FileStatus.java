package com.nevis.ingest.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FileStatus {
    SUCCESS,
    FAILED,
    SKIPPED;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
