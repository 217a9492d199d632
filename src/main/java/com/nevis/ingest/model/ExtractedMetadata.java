package com.nevis.ingest.model;

public record ExtractedMetadata(
    String title,
    String id
) {}
