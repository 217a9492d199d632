package com.nevis.ingest.model;

import java.util.List;

public record QueryAnswer(
    String answer,
    List<String> citations
) {}
