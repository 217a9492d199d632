package com.nevis.ingest.controller;

import com.nevis.ingest.exception.FolderNotFoundException;
import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.service.BulkIngestionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BulkIngestionController.class)
class BulkIngestionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private BulkIngestionService bulkIngestionService;

    @Test
    @DisplayName("POST /ingest/folder should accept the job and return its task id")
    void ingestFolder_ShouldReturn202() throws Exception {
        when(bulkIngestionService.start(eq(Path.of("/data/manuscripts")), eq(DocumentType.MANUSCRIPTS),
            argThat(metadata -> metadata.get("354.pdf").shortName().equals("354"))))
            .thenReturn("task-1");

        mockMvc.perform(post("/ingest/folder")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"folder_path": "/data/manuscripts", "document_type": "manuscripts",
                     "metadata": {"354.pdf": {"short_name": "354", "title": "Lumbar outcomes"}}}
                    """))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.task_id").value("task-1"))
            .andExpect(jsonPath("$.status").value("processing"));
    }

    @Test
    @DisplayName("POST /ingest/folder should return 404 for a missing folder")
    void ingestFolder_ShouldReturn404ForMissingFolder() throws Exception {
        when(bulkIngestionService.start(any(), any(), any())).thenThrow(new FolderNotFoundException("/missing"));

        mockMvc.perform(post("/ingest/folder")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"folder_path\": \"/missing\", \"document_type\": \"abstracts\"}"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /ingest/folder should return 400 for an unknown document type")
    void ingestFolder_ShouldReturn400ForUnknownType() throws Exception {
        mockMvc.perform(post("/ingest/folder")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"folder_path\": \"/data\", \"document_type\": \"posters\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid document type: posters"));

        verifyNoInteractions(bulkIngestionService);
    }

    @Test
    @DisplayName("POST /ingest/folder should return 400 when the folder is missing from the body")
    void ingestFolder_ShouldReturn400ForMissingFolder() throws Exception {
        mockMvc.perform(post("/ingest/folder")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"document_type\": \"abstracts\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(bulkIngestionService);
    }

    @Test
    @DisplayName("POST /ingest/folder should return 503 when the job queue is full")
    void ingestFolder_ShouldReturn503WhenRejected() throws Exception {
        when(bulkIngestionService.start(any(), any(), any())).thenThrow(new TaskRejectedException("queue full"));

        mockMvc.perform(post("/ingest/folder")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"folder_path\": \"/data\", \"document_type\": \"abstracts\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value(503));
    }
}
