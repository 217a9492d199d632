package com.nevis.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BatchResult(
    int total,
    int successful,
    int failed,
    int skipped,

    @JsonProperty("processed_files")
    List<ProcessedFile> processedFiles,

    List<String> errors
) {

    public BatchResult {
        processedFiles = List.copyOf(processedFiles);
        errors = List.copyOf(errors);
    }
}
