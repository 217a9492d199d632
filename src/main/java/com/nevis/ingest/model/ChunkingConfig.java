package com.nevis.ingest.model;

public record ChunkingConfig(
    int maxTokensPerChunk,
    int maxOverlapTokens
) {}
