package com.nevis.ingest.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record QueryRequest(
    @NotBlank
    String question,

    @JsonProperty("document_type")
    String documentType
) {}
