package com.nevis.ingest.client;

import java.nio.file.Path;

public interface DocumentTextExtractor {

    /**
     * @throws com.nevis.ingest.exception.TextExtractionException if the file cannot be read
     */
    String extract(Path file);

    boolean supports(String fileName);
}
