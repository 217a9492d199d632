package com.nevis.ingest.controller;

import com.nevis.ingest.model.DocumentSummary;

import java.util.List;

public record DocumentListResponse(
    List<DocumentSummary> documents
) {}
