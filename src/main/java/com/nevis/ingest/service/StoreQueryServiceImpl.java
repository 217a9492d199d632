package com.nevis.ingest.service;

import com.nevis.ingest.client.FileSearchClient;
import com.nevis.ingest.exception.InvalidRequestException;
import com.nevis.ingest.infra.RateLimiter;
import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.QueryAnswer;
import com.nevis.ingest.model.Store;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

import static com.nevis.ingest.infra.RateLimitKeys.FILE_SEARCH_LIMIT;

@Slf4j
@Service
public class StoreQueryServiceImpl implements StoreQueryService {

    private static final String QUERY_PROMPT_TEMPLATE =
        """
            %s
            (return your answer in markdown as concise bullet points)
            ANSWER:
            """;

    private final StoreRegistry storeRegistry;
    private final FileSearchClient fileSearchClient;
    private final RateLimiter fileSearchLimiter;

    public StoreQueryServiceImpl(
        StoreRegistry storeRegistry,
        FileSearchClient fileSearchClient,
        @Qualifier("fileSearchLimiter") RateLimiter fileSearchLimiter
    ) {
        this.storeRegistry = storeRegistry;
        this.fileSearchClient = fileSearchClient;
        this.fileSearchLimiter = fileSearchLimiter;
    }

    @Override
    public QueryAnswer query(String question, DocumentType documentType) {
        if (question == null || question.isBlank()) {
            throw new InvalidRequestException("No question provided");
        }
        DocumentType type = documentType == null ? DocumentType.GENERAL : documentType;
        Store store = storeRegistry.resolve(type);

        log.info("Querying store {} ({})", store.name(), type);
        String prompt = String.format(QUERY_PROMPT_TEMPLATE, question.trim());
        return fileSearchLimiter.execute(FILE_SEARCH_LIMIT, 1, () ->
            fileSearchClient.generateWithFileSearch(prompt, List.of(store.name())));
    }
}
