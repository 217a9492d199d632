package com.nevis.ingest.controller;

import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.QueryAnswer;
import com.nevis.ingest.service.StoreQueryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QueryController.class)
class QueryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private StoreQueryService storeQueryService;

    @Test
    @DisplayName("POST /query should default to the general store")
    void query_ShouldUseGeneralStoreByDefault() throws Exception {
        when(storeQueryService.query("What helps?", DocumentType.GENERAL))
            .thenReturn(new QueryAnswer("- Rest helps", List.of("Spine Atlas")));

        mockMvc.perform(post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\": \"What helps?\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.answer").value("- Rest helps"))
            .andExpect(jsonPath("$.citations[0]").value("Spine Atlas"));
    }

    @Test
    @DisplayName("POST /query without a question should return 400")
    void query_ShouldReturn400WithoutQuestion() throws Exception {
        mockMvc.perform(post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\": \"\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(storeQueryService);
    }
}
