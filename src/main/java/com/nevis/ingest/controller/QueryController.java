package com.nevis.ingest.controller;

import com.nevis.ingest.model.DocumentType;
import com.nevis.ingest.model.QueryAnswer;
import com.nevis.ingest.service.StoreQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/query")
@RequiredArgsConstructor
public class QueryController {

    private final StoreQueryService storeQueryService;

    @PostMapping
    public ResponseEntity<QueryAnswer> query(@Valid @RequestBody QueryRequest request) {
        DocumentType documentType = request.documentType() == null || request.documentType().isBlank()
            ? DocumentType.GENERAL
            : DocumentType.parse(request.documentType());
        return ResponseEntity.ok(storeQueryService.query(request.question(), documentType));
    }
}
