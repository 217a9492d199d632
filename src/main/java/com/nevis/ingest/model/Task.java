package com.nevis.ingest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(
    String id,
    TaskStatus status,
    int current,
    int total,

    @JsonProperty("current_file")
    String currentFile,

    @JsonProperty("started_at")
    OffsetDateTime startedAt,

    @JsonProperty("completed_at")
    OffsetDateTime completedAt,

    List<String> errors,

    @JsonProperty("processed_files")
    List<ProcessedFile> processedFiles,

    BatchResult result,

    @JsonProperty("error_message")
    String errorMessage
) {}
