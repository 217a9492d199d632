package com.nevis.ingest.client;

import com.nevis.ingest.exception.FileSearchException;
import com.nevis.ingest.exception.TransientFileSearchException;
import com.nevis.ingest.model.ChunkingConfig;
import com.nevis.ingest.model.DocumentRecord;
import com.nevis.ingest.model.MetadataSchema;
import com.nevis.ingest.model.QueryAnswer;
import com.nevis.ingest.model.Store;
import com.nevis.ingest.model.UploadOperation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeminiFileSearchClientTest {

    private static final String BASE_URL = "https://generativelanguage.test";

    private MockRestServiceServer server;
    private GeminiFileSearchClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new GeminiFileSearchClient(builder.build(), "gemini-2.5-flash");
    }

    @AfterEach
    void verifyServer() {
        server.verify();
    }

    @Test
    @DisplayName("Should follow store pages to the end")
    void shouldListAllStorePages() {
        server.expect(requestTo(BASE_URL + "/v1beta/fileSearchStores"))
            .andExpect(method(HttpMethod.GET))
            .andRespond(withSuccess("""
                {"fileSearchStores": [{"name": "fileSearchStores/a-1", "displayName": "abstracts_store"}],
                 "nextPageToken": "p2"}
                """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/v1beta/fileSearchStores?pageToken=p2"))
            .andRespond(withSuccess("""
                {"fileSearchStores": [{"name": "fileSearchStores/m-1", "displayName": "manuscripts_store"}]}
                """, MediaType.APPLICATION_JSON));

        List<Store> stores = client.listStores();

        assertThat(stores).containsExactly(
            new Store("fileSearchStores/a-1", "abstracts_store"),
            new Store("fileSearchStores/m-1", "manuscripts_store"));
    }

    @Test
    @DisplayName("Should create a store by display name")
    void shouldCreateStore() {
        server.expect(requestTo(BASE_URL + "/v1beta/fileSearchStores"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.displayName").value("pdf_rag_store"))
            .andRespond(withSuccess("""
                {"name": "fileSearchStores/pdf-1", "displayName": "pdf_rag_store"}
                """, MediaType.APPLICATION_JSON));

        assertThat(client.createStore("pdf_rag_store")).isEqualTo(new Store("fileSearchStores/pdf-1", "pdf_rag_store"));
    }

    @Test
    @DisplayName("Should upload the file and return the operation handle")
    void shouldUploadFile(@TempDir Path folder) throws IOException {
        Path file = folder.resolve("354.pdf");
        Files.writeString(file, "%PDF-1.4 test");

        server.expect(requestTo(BASE_URL
                + "/upload/v1beta/fileSearchStores/m-1:uploadToFileSearchStore?uploadType=multipart"))
            .andExpect(method(HttpMethod.POST))
            .andRespond(withSuccess("""
                {"name": "fileSearchStores/m-1/upload/operations/op-1", "done": false}
                """, MediaType.APPLICATION_JSON));

        UploadOperation operation = client.upload("fileSearchStores/m-1", file, "354",
            new ChunkingConfig(512, 50), Map.of("short_name", "354"));

        assertThat(operation.name()).isEqualTo("fileSearchStores/m-1/upload/operations/op-1");
        assertThat(operation.done()).isFalse();
    }

    @Test
    @DisplayName("Should read an error nested in the operation result")
    void shouldReadNestedOperationError() {
        server.expect(requestTo(BASE_URL + "/v1beta/fileSearchStores/m-1/upload/operations/op-1"))
            .andRespond(withSuccess("""
                {"name": "fileSearchStores/m-1/upload/operations/op-1", "done": true,
                 "result": {"error": {"code": 3, "message": "Unsupported file"}}}
                """, MediaType.APPLICATION_JSON));

        UploadOperation operation = client.getOperation("fileSearchStores/m-1/upload/operations/op-1");

        assertThat(operation.done()).isTrue();
        assertThat(operation.error()).isEmpty();
        assertThat(operation.failure()).hasValueSatisfying(error ->
            assertThat(error.message()).isEqualTo("Unsupported file"));
    }

    @Test
    @DisplayName("Should read the document name of a completed operation")
    void shouldReadCompletedOperation() {
        server.expect(requestTo(BASE_URL + "/v1beta/operations/op-2"))
            .andRespond(withSuccess("""
                {"name": "operations/op-2", "done": true,
                 "response": {"documentName": "fileSearchStores/m-1/documents/d-1"}}
                """, MediaType.APPLICATION_JSON));

        UploadOperation operation = client.getOperation("operations/op-2");

        assertThat(operation.failure()).isEmpty();
        assertThat(operation.result()).hasValueSatisfying(result ->
            assertThat(result.documentName()).isEqualTo("fileSearchStores/m-1/documents/d-1"));
    }

    @Test
    @DisplayName("Server errors should be reported as transient")
    void serverErrorsShouldBeTransient() {
        server.expect(requestTo(BASE_URL + "/v1beta/operations/op-3"))
            .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.getOperation("operations/op-3"))
            .isInstanceOf(TransientFileSearchException.class);
    }

    @Test
    @DisplayName("Client errors should be reported as permanent")
    void clientErrorsShouldBePermanent() {
        server.expect(requestTo(BASE_URL + "/v1beta/fileSearchStores"))
            .andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> client.listStores())
            .isInstanceOf(FileSearchException.class)
            .isNotInstanceOf(TransientFileSearchException.class);
    }

    @Test
    @DisplayName("Should map documents and their custom metadata")
    void shouldListDocuments() {
        server.expect(requestTo(BASE_URL + "/v1beta/fileSearchStores/m-1/documents?pageSize=20"))
            .andRespond(withSuccess("""
                {"documents": [{
                  "name": "fileSearchStores/m-1/documents/d-1",
                  "displayName": "Lumbar outcomes",
                  "customMetadata": [
                    {"key": "short_name", "stringValue": "354"},
                    {"key": "file_name", "stringValue": "354.pdf"},
                    {"key": "year", "numericValue": 1824}
                  ]}]}
                """, MediaType.APPLICATION_JSON));

        List<DocumentRecord> documents = client.listDocuments("fileSearchStores/m-1");

        assertThat(documents).hasSize(1);
        DocumentRecord document = documents.get(0);
        assertThat(document.schema()).isEqualTo(MetadataSchema.CURRENT);
        assertThat(document.dedupKey()).isEqualTo("354");
        assertThat(document.customMetadata()).containsEntry("year", "1824.0");
    }

    @Test
    @DisplayName("Should encode page tokens that contain reserved characters")
    void shouldEncodeReservedCharactersInPageToken() {
        server.expect(requestTo(BASE_URL + "/v1beta/fileSearchStores/m-1/documents?pageSize=20"))
            .andRespond(withSuccess("""
                {"documents": [{"name": "fileSearchStores/m-1/documents/d-1",
                  "customMetadata": [{"key": "short_name", "stringValue": "354"}]}],
                 "nextPageToken": "ab+cd/ef=="}
                """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE_URL + "/v1beta/fileSearchStores/m-1/documents?pageSize=20&pageToken=ab%2Bcd%2Fef%3D%3D"))
            .andRespond(withSuccess("""
                {"documents": [{"name": "fileSearchStores/m-1/documents/d-2",
                  "customMetadata": [{"key": "short_name", "stringValue": "355"}]}]}
                """, MediaType.APPLICATION_JSON));

        List<DocumentRecord> documents = client.listDocuments("fileSearchStores/m-1");

        assertThat(documents).extracting(DocumentRecord::dedupKey).containsExactly("354", "355");
    }

    @Test
    @DisplayName("Should force-delete a document")
    void shouldDeleteDocument() {
        server.expect(requestTo(BASE_URL + "/v1beta/fileSearchStores/m-1/documents/d-1?force=true"))
            .andExpect(method(HttpMethod.DELETE))
            .andRespond(withSuccess());

        client.deleteDocument("fileSearchStores/m-1/documents/d-1", true);
    }

    @Test
    @DisplayName("Should return the answer text and distinct citation titles")
    void shouldGenerateWithFileSearch() {
        server.expect(requestTo(BASE_URL + "/v1beta/models/gemini-2.5-flash:generateContent"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.tools[0].fileSearch.fileSearchStoreNames[0]").value("fileSearchStores/m-1"))
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
            .andRespond(withSuccess("""
                {"candidates": [{
                  "content": {"parts": [{"text": "- Rest "}, {"text": "helps"}]},
                  "groundingMetadata": {"groundingChunks": [
                    {"retrievedContext": {"title": "Abstract 354"}},
                    {"retrievedContext": {"title": "Abstract 354"}},
                    {"retrievedContext": {"title": "Abstract 355"}}
                  ]}}]}
                """, MediaType.APPLICATION_JSON));

        QueryAnswer answer = client.generateWithFileSearch("What helps?", List.of("fileSearchStores/m-1"));

        assertThat(answer.answer()).isEqualTo("- Rest helps");
        assertThat(answer.citations()).containsExactly("Abstract 354", "Abstract 355");
    }
}
