package com.nevis.ingest.model;

public record Store(
    String name,
    String displayName
) {}
