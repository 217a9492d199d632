package com.nevis.ingest.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessedFile(
    String filename,
    FileStatus status,
    String detail
) {}
