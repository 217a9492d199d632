package com.nevis.ingest.client;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.ingest.exception.FileSearchException;
import com.nevis.ingest.exception.TransientFileSearchException;
import com.nevis.ingest.model.ChunkingConfig;
import com.nevis.ingest.model.DocumentRecord;
import com.nevis.ingest.model.OperationError;
import com.nevis.ingest.model.OperationResult;
import com.nevis.ingest.model.QueryAnswer;
import com.nevis.ingest.model.Store;
import com.nevis.ingest.model.UploadOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Component
public class GeminiFileSearchClient implements FileSearchClient {

    private static final String API_VERSION = "/v1beta/";
    private static final int DOCUMENTS_PAGE_SIZE = 20;

    private final RestClient restClient;
    private final String modelName;

    public GeminiFileSearchClient(
        @Qualifier("fileSearchRestClient") RestClient restClient,
        @Value("${app.gemini.model:gemini-2.5-flash}") String modelName
    ) {
        this.restClient = restClient;
        this.modelName = modelName;
    }

    @Override
    public List<Store> listStores() {
        List<Store> stores = new ArrayList<>();
        String pageToken = null;
        do {
            ListStoresResponse page = getPage(
                "list stores", API_VERSION + "fileSearchStores", pageToken, ListStoresResponse.class);
            if (page == null) {
                break;
            }
            if (page.fileSearchStores() != null) {
                page.fileSearchStores().forEach(dto -> stores.add(new Store(dto.name(), dto.displayName())));
            }
            pageToken = page.nextPageToken();
        } while (pageToken != null && !pageToken.isBlank());
        return stores;
    }

    @Override
    public Store createStore(String displayName) {
        StoreDto created = call("create store " + displayName, () ->
            restClient.post()
                .uri(API_VERSION + "fileSearchStores")
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("displayName", displayName))
                .retrieve()
                .body(StoreDto.class));
        if (created == null || created.name() == null) {
            throw new FileSearchException("Store creation returned no store for " + displayName);
        }
        return new Store(created.name(), created.displayName());
    }

    @Override
    public UploadOperation upload(
        String storeName,
        Path file,
        String displayName,
        ChunkingConfig chunkingConfig,
        Map<String, String> customMetadata
    ) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("displayName", displayName);
        metadata.put("customMetadata", customMetadata.entrySet().stream()
            .map(entry -> Map.of("key", entry.getKey(), "stringValue", entry.getValue()))
            .toList());
        metadata.put("chunkingConfig", Map.of("whiteSpaceConfig", Map.of(
            "maxTokensPerChunk", chunkingConfig.maxTokensPerChunk(),
            "maxOverlapTokens", chunkingConfig.maxOverlapTokens())));

        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("metadata", metadata, MediaType.APPLICATION_JSON);
        body.part("file", new FileSystemResource(file),
            MediaTypeFactory.getMediaType(file.getFileName().toString()).orElse(MediaType.APPLICATION_OCTET_STREAM));

        OperationDto operation = call("upload " + file.getFileName(), () ->
            restClient.post()
                .uri("/upload" + API_VERSION + storeName + ":uploadToFileSearchStore?uploadType=multipart")
                .contentType(MediaType.MULTIPART_RELATED)
                .body(body.build())
                .retrieve()
                .body(OperationDto.class));
        if (operation == null || operation.name() == null) {
            throw new FileSearchException("Upload of " + file.getFileName() + " returned no operation handle");
        }
        return operation.toModel();
    }

    @Override
    @Retryable(
        retryFor = TransientFileSearchException.class,
        maxAttemptsExpression = "${app.gemini.max-attempts:3}",
        backoff = @Backoff(delay = 1000, multiplier = 2)
    )
    public UploadOperation getOperation(String operationName) {
        OperationDto operation = call("get operation " + operationName, () ->
            restClient.get().uri(API_VERSION + operationName).retrieve().body(OperationDto.class));
        if (operation == null) {
            throw new FileSearchException("Operation lookup returned nothing for " + operationName);
        }
        return operation.toModel();
    }

    @Override
    public List<DocumentRecord> listDocuments(String storeName) {
        List<DocumentRecord> documents = new ArrayList<>();
        String pageToken = null;
        do {
            ListDocumentsResponse page = getPage(
                "list documents of " + storeName,
                API_VERSION + storeName + "/documents?pageSize=" + DOCUMENTS_PAGE_SIZE,
                pageToken,
                ListDocumentsResponse.class);
            if (page == null) {
                break;
            }
            if (page.documents() != null) {
                page.documents().forEach(dto -> documents.add(dto.toModel()));
            }
            pageToken = page.nextPageToken();
        } while (pageToken != null && !pageToken.isBlank());

        log.debug("Listed {} documents in store {}", documents.size(), storeName);
        return documents;
    }

    @Override
    public void deleteDocument(String remoteId, boolean force) {
        call("delete document " + remoteId, () ->
            restClient.delete()
                .uri(API_VERSION + remoteId + "?force=" + force)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public QueryAnswer generateWithFileSearch(String prompt, List<String> storeNames) {
        Map<String, Object> request = Map.of(
            "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
            "tools", List.of(Map.of("fileSearch", Map.of("fileSearchStoreNames", storeNames))));

        JsonNode response = call("generate content", () ->
            restClient.post()
                .uri(API_VERSION + "models/" + modelName + ":generateContent")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(JsonNode.class));

        JsonNode candidate = response == null ? null : response.path("candidates").path(0);
        if (candidate == null || candidate.isMissingNode()) {
            return new QueryAnswer("", List.of());
        }

        StringBuilder answer = new StringBuilder();
        candidate.path("content").path("parts").forEach(part -> answer.append(part.path("text").asText("")));

        List<String> citations = new ArrayList<>();
        candidate.path("groundingMetadata").path("groundingChunks").forEach(chunk -> {
            String title = chunk.path("retrievedContext").path("title").asText(null);
            if (title != null && !citations.contains(title)) {
                citations.add(title);
            }
        });
        return new QueryAnswer(answer.toString(), citations);
    }

    // The token goes in as a template variable so it is strictly encoded (+, / and = included)
    private <T> T getPage(String action, String path, String pageToken, Class<T> type) {
        return call(action, () -> {
            RestClient.RequestHeadersSpec<?> request = pageToken == null || pageToken.isBlank()
                ? restClient.get().uri(path)
                : restClient.get().uri(path + (path.contains("?") ? "&" : "?") + "pageToken={pageToken}", pageToken);
            return request.retrieve().body(type);
        });
    }

    private <T> T call(String action, Supplier<T> request) {
        try {
            return request.get();
        } catch (ResourceAccessException | HttpServerErrorException e) {
            throw new TransientFileSearchException("File search call failed (" + action + "): " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new FileSearchException("File search call failed (" + action + "): " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoreDto(String name, String displayName) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ListStoresResponse(List<StoreDto> fileSearchStores, String nextPageToken) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CustomMetadataDto(String key, String stringValue, Double numericValue) {

        String value() {
            if (stringValue != null) {
                return stringValue;
            }
            return numericValue != null ? String.valueOf(numericValue) : null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DocumentDto(String name, String displayName, List<CustomMetadataDto> customMetadata) {

        DocumentRecord toModel() {
            Map<String, String> entries = new LinkedHashMap<>();
            if (customMetadata != null) {
                customMetadata.stream()
                    .filter(entry -> entry.key() != null && entry.value() != null)
                    .forEach(entry -> entries.put(entry.key(), entry.value()));
            }
            return DocumentRecord.of(name, displayName, entries);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ListDocumentsResponse(List<DocumentDto> documents, String nextPageToken) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StatusDto(Integer code, String message) {

        OperationError toModel() {
            return new OperationError(code, message);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OperationResponseDto(String documentName, StatusDto error) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OperationDto(
        String name,
        Boolean done,
        StatusDto error,
        @JsonAlias("result") OperationResponseDto response
    ) {

        UploadOperation toModel() {
            Optional<OperationResult> result = Optional.ofNullable(response)
                .map(dto -> new OperationResult(dto.documentName(), Optional.ofNullable(dto.error()).map(StatusDto::toModel)));
            return new UploadOperation(
                name,
                Boolean.TRUE.equals(done),
                Optional.ofNullable(error).map(StatusDto::toModel),
                result
            );
        }
    }
}
