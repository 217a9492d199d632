package com.nevis.ingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FileMetadataOverride(
    @JsonProperty("short_name")
    String shortName,

    String title,

    String id
) {}
