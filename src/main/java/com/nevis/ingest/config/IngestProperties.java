package com.nevis.ingest.config;

import com.nevis.ingest.model.ChunkingConfig;
import com.nevis.ingest.model.DocumentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.ingest")
public record IngestProperties(
    @NotNull @Valid Stores stores,
    @NotNull @Valid Chunking chunking,
    @NotNull @Valid Polling polling,
    @NotNull @Valid Bulk bulk,
    @NotNull @Valid Limits limits
) {

    public record Stores(
        @NotBlank String general,
        @NotBlank String abstracts,
        @NotBlank String manuscripts
    ) {}

    public record Chunking(
        @Min(1) int maxTokensPerChunk,
        @Min(0) int maxOverlapTokens
    ) {}

    public record Polling(
        @NotNull Duration interval,
        @NotNull Duration timeout
    ) {}

    public record Bulk(
        @NotBlank String fileExtension
    ) {}

    public record Limits(
        @Min(1) int metadataMaxChars,
        @Min(1) int graphMaxChars,
        @NotBlank String uploadFolder
    ) {}

    public String storeName(DocumentType documentType) {
        return switch (documentType) {
            case GENERAL -> stores.general();
            case ABSTRACTS -> stores.abstracts();
            case MANUSCRIPTS -> stores.manuscripts();
        };
    }

    public ChunkingConfig chunkingConfig() {
        return new ChunkingConfig(chunking.maxTokensPerChunk(), chunking.maxOverlapTokens());
    }
}
