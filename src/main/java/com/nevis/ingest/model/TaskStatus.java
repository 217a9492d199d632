package com.nevis.ingest.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PROCESSING;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }
}
