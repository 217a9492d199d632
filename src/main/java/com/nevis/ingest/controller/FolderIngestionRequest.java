package com.nevis.ingest.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.ingest.model.FileMetadataOverride;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record FolderIngestionRequest(
    @NotBlank
    @JsonProperty("folder_path")
    String folderPath,

    @NotBlank
    @JsonProperty("document_type")
    String documentType,

    Map<String, FileMetadataOverride> metadata
) {}
