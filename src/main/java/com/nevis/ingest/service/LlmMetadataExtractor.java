package com.nevis.ingest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.ingest.client.DocumentTextExtractor;
import com.nevis.ingest.config.IngestProperties;
import com.nevis.ingest.infra.RateLimiter;
import com.nevis.ingest.model.DocumentMetadata;
import com.nevis.ingest.model.ExtractedMetadata;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

import static com.nevis.ingest.infra.RateLimitKeys.CHAT_LIMIT;

@Slf4j
@Component
public class LlmMetadataExtractor implements MetadataExtractor {

    private static final String METADATA_PROMPT_TEMPLATE =
        """
            Analyze this document and extract:
            1. The title of the document, paper or study.
            2. Any identifier present (Control ID, Abstract ID, Paper ID, Study ID, etc.).

            If there is no explicit title, use the first heading.
            If there is no identifier, use "N/A".

            Return ONLY a valid JSON object:
            {"title": "extracted title", "id": "extracted id"}

            File name: %s

            Document Content:
            %s
            """;

    private final DocumentTextExtractor textExtractor;
    private final ChatModel chatModel;
    private final RateLimiter chatLimiter;
    private final ObjectMapper objectMapper;
    private final int maxChars;

    public LlmMetadataExtractor(
        DocumentTextExtractor textExtractor,
        ChatModel chatModel,
        @Qualifier("chatLimiter") RateLimiter chatLimiter,
        ObjectMapper objectMapper,
        IngestProperties properties
    ) {
        this.textExtractor = textExtractor;
        this.chatModel = chatModel;
        this.chatLimiter = chatLimiter;
        this.objectMapper = objectMapper;
        this.maxChars = properties.limits().metadataMaxChars();
    }

    @Override
    public ExtractedMetadata extractMetadata(Path file, String filename) {
        log.info("Extracting metadata for {}", filename);
        try {
            String content = textExtractor.extract(file);
            String head = content.substring(0, Math.min(content.length(), maxChars));

            String response = chatLimiter.execute(CHAT_LIMIT, 1, () ->
                chatModel.chat(String.format(METADATA_PROMPT_TEMPLATE, filename, head)));

            JsonNode json = objectMapper.readTree(stripCodeFence(response));
            String title = textOrNull(json.get("title"));
            String id = textOrNull(json.get("id"));

            return new ExtractedMetadata(
                title != null ? title : filenameTitle(filename),
                id != null ? id : DocumentMetadata.NOT_AVAILABLE
            );
        } catch (Exception e) {
            log.warn("Metadata inference failed for {}, using filename: {}", filename, e.getMessage());
            return new ExtractedMetadata(filenameTitle(filename), DocumentMetadata.NOT_AVAILABLE);
        }
    }

    static String stripCodeFence(String response) {
        String text = response == null ? "" : response.strip();
        if (!text.startsWith("```")) {
            return text;
        }
        int firstLineEnd = text.indexOf('\n');
        text = firstLineEnd < 0 ? text.substring(3) : text.substring(firstLineEnd + 1);
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.strip();
    }

    static String filenameTitle(String filename) {
        return FileNames.stem(filename);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
